package stripes.steganography.model.text;

/**
 * Advance width of a glyph and its height above the baseline, in pixels.
 */
public record GlyphSize(int width, int height) {
}
