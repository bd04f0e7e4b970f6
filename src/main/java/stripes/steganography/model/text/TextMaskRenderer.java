package stripes.steganography.model.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stripes.steganography.exception.InvalidInputException;
import stripes.steganography.model.GrayImage;

/**
 * Rasterizes a message as a repeating, optionally rotated tiling that covers the
 * whole frame. Result samples are 1.0 under ink and 0.0 elsewhere.
 *
 * The tiling is drawn on a square canvas larger than the frame diagonal plus one
 * rotated text instance, starting one tile before the origin on both axes, then
 * rotated and cropped around the centre. Tiles clipped at the canvas edge never
 * reach the cropped window.
 */
public class TextMaskRenderer {

    private static final Logger log = LoggerFactory.getLogger(TextMaskRenderer.class);

    private final GlyphRasterizer rasterizer;

    public TextMaskRenderer(GlyphRasterizer rasterizer) {
        if (rasterizer == null) throw new InvalidInputException("Glyph rasterizer is required.");
        this.rasterizer = rasterizer;
    }

    public GrayImage render(String text, int height, int width, TextLayout layout) {
        GrayImage.requireDimensions(height, width);
        if (layout == null) throw new InvalidInputException("Text layout is required.");
        if (text == null) throw new InvalidInputException("Text to render is required.");
        if (text.isEmpty()) {
            return GrayImage.filled(height, width, 0.0);
        }

        int[] offsets = new int[text.length()];
        int cursor = 0;
        for (int i = 0; i < text.length(); i++) {
            offsets[i] = cursor;
            cursor += rasterizer.measure(text.charAt(i)).width() + layout.letterSpacing();
        }
        int textWidth = cursor - layout.letterSpacing();
        int textHeight = rasterizer.measure(text.charAt(0)).height();

        double theta = Math.toRadians(layout.angleDegrees());
        double cos = Math.abs(Math.cos(theta));
        double sin = Math.abs(Math.sin(theta));
        int rotatedWidth = (int) (textWidth * cos + textHeight * sin);
        int rotatedHeight = (int) (textWidth * sin + textHeight * cos);

        int side = (int) Math.sqrt((double) height * height + (double) width * width)
                + Math.max(rotatedWidth, rotatedHeight);
        int stepX = Math.max((int) (rotatedWidth * layout.spacingX()), 1);
        int stepY = Math.max((int) (rotatedHeight * layout.spacingY()), 1);
        log.debug("Tiling '{}' ({}x{} px, rotated {}x{}) on a {}px canvas with step {}x{}",
                text, textWidth, textHeight, rotatedWidth, rotatedHeight, side, stepX, stepY);

        MaskCanvas canvas = new MaskCanvas(side, side);
        for (int y = -rotatedHeight; y < side + rotatedHeight; y += stepY) {
            for (int x = -rotatedWidth; x < side + rotatedWidth; x += stepX) {
                for (int i = 0; i < text.length(); i++) {
                    rasterizer.draw(text.charAt(i), x + offsets[i], y + textHeight, canvas);
                }
            }
        }

        if (layout.angleDegrees() != 0) {
            canvas = canvas.rotate(layout.angleDegrees());
        }

        MaskCanvas cropped = canvas.crop((side - width) / 2, (side - height) / 2, width, height);
        return cropped.resizeNearest(height, width).toMask();
    }
}
