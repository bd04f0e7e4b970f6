package stripes.steganography.model.text;

import stripes.steganography.exception.InvalidInputException;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Glyph backend on top of a {@link Font}. Antialiasing is switched off and every
 * glyph is rendered once into a bitmap, then stamped onto the canvas.
 */
public class AwtGlyphRasterizer implements GlyphRasterizer {

    private static final int INK_THRESHOLD = 128;

    /** Ink pixel offsets relative to (cell left, baseline), interleaved x,y. */
    private record GlyphBitmap(int[] offsets) {
    }

    private final Font font;
    private final FontMetrics metrics;
    private final Map<Character, GlyphBitmap> cache = new ConcurrentHashMap<>();

    public AwtGlyphRasterizer(Font font) {
        if (font == null) throw new InvalidInputException("Font is required.");
        this.font = font;
        BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = scratch.createGraphics();
        try {
            g.setFont(font);
            this.metrics = g.getFontMetrics();
        } finally {
            g.dispose();
        }
    }

    @Override
    public GlyphSize measure(char c) {
        return new GlyphSize(metrics.charWidth(c), metrics.getAscent());
    }

    @Override
    public void draw(char c, int x, int baselineY, MaskCanvas canvas) {
        int[] offsets = cache.computeIfAbsent(c, this::renderGlyph).offsets();
        for (int i = 0; i < offsets.length; i += 2) {
            canvas.mark(x + offsets[i], baselineY + offsets[i + 1]);
        }
    }

    private GlyphBitmap renderGlyph(char c) {
        int pad = Math.max(2, font.getSize() / 4);
        int ascent = metrics.getAscent();
        int cellWidth = Math.max(1, metrics.charWidth(c)) + 2 * pad;
        int cellHeight = ascent + metrics.getDescent() + 2 * pad;

        BufferedImage cell = new BufferedImage(cellWidth, cellHeight, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = cell.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_OFF);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_OFF);
            g.setFont(font);
            g.setColor(Color.WHITE);
            g.drawString(String.valueOf(c), pad, pad + ascent);
        } finally {
            g.dispose();
        }

        Raster raster = cell.getRaster();
        int[] offsets = new int[cellWidth * cellHeight * 2];
        int n = 0;
        for (int y = 0; y < cellHeight; y++) {
            for (int x = 0; x < cellWidth; x++) {
                if (raster.getSample(x, y, 0) >= INK_THRESHOLD) {
                    offsets[n++] = x - pad;
                    offsets[n++] = y - pad - ascent;
                }
            }
        }
        return new GlyphBitmap(Arrays.copyOf(offsets, n));
    }
}
