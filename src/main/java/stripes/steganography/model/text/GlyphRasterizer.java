package stripes.steganography.model.text;

/**
 * Text rendering backend used by {@link TextMaskRenderer}. Implementations must
 * produce binary ink: a pixel is either marked or left untouched.
 */
public interface GlyphRasterizer {

    /**
     * Measures a single character.
     * @param c Character to measure.
     * @return Advance width and height above the baseline.
     */
    GlyphSize measure(char c);

    /**
     * Marks the ink of a character on the canvas. Pixels falling outside the
     * canvas are ignored.
     * @param c Character to draw.
     * @param x Left edge of the glyph cell.
     * @param baselineY Row of the text baseline.
     * @param canvas Target canvas.
     */
    void draw(char c, int x, int baselineY, MaskCanvas canvas);
}
