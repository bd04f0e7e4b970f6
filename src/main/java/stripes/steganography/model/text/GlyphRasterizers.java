package stripes.steganography.model.text;

import stripes.steganography.exception.InvalidInputException;

import java.awt.Font;
import java.util.Locale;

/**
 * Picks a glyph backend from a font name as given on the command line.
 */
public final class GlyphRasterizers {

    public static final String BUILTIN = "builtin";

    /** Pixel size of an AWT font at scale 1.0. */
    private static final int BASE_FONT_SIZE = 22;

    private GlyphRasterizers() {
    }

    /**
     * @param fontName {@value #BUILTIN} for the dot-matrix font, otherwise an AWT font family
     *                 or face name. Names the platform does not know are rejected instead of
     *                 falling back to the default font.
     * @param scale Size multiplier; the dot-matrix font rounds it to a whole number, at least 1.
     * @param thickness Stroke thickness; AWT fonts switch to bold above 1.
     */
    public static GlyphRasterizer forFont(String fontName, double scale, int thickness) {
        if (!(scale > 0)) throw new InvalidInputException("Font scale must be positive, got " + scale);
        if (thickness < 1) throw new InvalidInputException("Font thickness must be at least 1, got " + thickness);
        if (fontName == null || fontName.isBlank() || BUILTIN.equalsIgnoreCase(fontName.trim())) {
            return new BitmapGlyphRasterizer(Math.max(1, (int) Math.round(scale)), thickness);
        }
        int style = thickness > 1 ? Font.BOLD : Font.PLAIN;
        int size = Math.max(1, (int) Math.round(BASE_FONT_SIZE * scale));
        String requested = fontName.trim();
        Font font = new Font(requested, style, size);
        if (!requested.equalsIgnoreCase(font.getFamily(Locale.ROOT))
                && !requested.equalsIgnoreCase(font.getFontName(Locale.ROOT))) {
            throw new InvalidInputException("Unknown font '" + requested + "' (resolved to "
                    + font.getFamily(Locale.ROOT) + "). Use an installed font family or " + BUILTIN + ".");
        }
        return new AwtGlyphRasterizer(font);
    }
}
