package stripes.steganography.model.text;

import stripes.steganography.exception.InvalidInputException;

import java.util.HashMap;
import java.util.Map;

/**
 * Built-in 5x7 dot-matrix font. Needs no system fonts, so output is identical on
 * every machine. Lowercase letters use the uppercase shapes and characters
 * without a shape are drawn as '?'.
 *
 * Each dot is a {@code scale x scale} square grown by {@code thickness - 1}
 * pixels, so thickness widens strokes without moving glyphs.
 */
public class BitmapGlyphRasterizer implements GlyphRasterizer {

    private static final int COLUMNS = 5;
    private static final int ROWS = 7;
    private static final Map<Character, int[]> GLYPHS = new HashMap<>();

    static {
        glyph('A', "01110,10001,10001,11111,10001,10001,10001");
        glyph('B', "11110,10001,10001,11110,10001,10001,11110");
        glyph('C', "01110,10001,10000,10000,10000,10001,01110");
        glyph('D', "11100,10010,10001,10001,10001,10010,11100");
        glyph('E', "11111,10000,10000,11110,10000,10000,11111");
        glyph('F', "11111,10000,10000,11110,10000,10000,10000");
        glyph('G', "01110,10001,10000,10111,10001,10001,01111");
        glyph('H', "10001,10001,10001,11111,10001,10001,10001");
        glyph('I', "01110,00100,00100,00100,00100,00100,01110");
        glyph('J', "00111,00010,00010,00010,00010,10010,01100");
        glyph('K', "10001,10010,10100,11000,10100,10010,10001");
        glyph('L', "10000,10000,10000,10000,10000,10000,11111");
        glyph('M', "10001,11011,10101,10101,10001,10001,10001");
        glyph('N', "10001,10001,11001,10101,10011,10001,10001");
        glyph('O', "01110,10001,10001,10001,10001,10001,01110");
        glyph('P', "11110,10001,10001,11110,10000,10000,10000");
        glyph('Q', "01110,10001,10001,10001,10101,10010,01101");
        glyph('R', "11110,10001,10001,11110,10100,10010,10001");
        glyph('S', "01111,10000,10000,01110,00001,00001,11110");
        glyph('T', "11111,00100,00100,00100,00100,00100,00100");
        glyph('U', "10001,10001,10001,10001,10001,10001,01110");
        glyph('V', "10001,10001,10001,10001,10001,01010,00100");
        glyph('W', "10001,10001,10001,10101,10101,10101,01010");
        glyph('X', "10001,10001,01010,00100,01010,10001,10001");
        glyph('Y', "10001,10001,01010,00100,00100,00100,00100");
        glyph('Z', "11111,00001,00010,00100,01000,10000,11111");
        glyph('0', "01110,10001,10011,10101,11001,10001,01110");
        glyph('1', "00100,01100,00100,00100,00100,00100,01110");
        glyph('2', "01110,10001,00001,00010,00100,01000,11111");
        glyph('3', "11111,00010,00100,00010,00001,10001,01110");
        glyph('4', "00010,00110,01010,10010,11111,00010,00010");
        glyph('5', "11111,10000,11110,00001,00001,10001,01110");
        glyph('6', "00110,01000,10000,11110,10001,10001,01110");
        glyph('7', "11111,00001,00010,00100,01000,01000,01000");
        glyph('8', "01110,10001,10001,01110,10001,10001,01110");
        glyph('9', "01110,10001,10001,01111,00001,00010,01100");
        glyph(' ', "00000,00000,00000,00000,00000,00000,00000");
        glyph('.', "00000,00000,00000,00000,00000,01100,01100");
        glyph(',', "00000,00000,00000,00000,01100,00100,01000");
        glyph('!', "00100,00100,00100,00100,00100,00000,00100");
        glyph('?', "01110,10001,00001,00010,00100,00000,00100");
        glyph('-', "00000,00000,00000,11111,00000,00000,00000");
        glyph(':', "00000,01100,01100,00000,01100,01100,00000");
        glyph('\'', "00100,00100,01000,00000,00000,00000,00000");
        glyph('_', "00000,00000,00000,00000,00000,00000,11111");
        glyph('/', "00001,00010,00010,00100,01000,01000,10000");
    }

    private static void glyph(char c, String rows) {
        String[] parts = rows.split(",");
        int[] bits = new int[ROWS];
        for (int i = 0; i < ROWS; i++) {
            bits[i] = Integer.parseInt(parts[i], 2);
        }
        GLYPHS.put(c, bits);
    }

    private final int scale;
    private final int thickness;

    public BitmapGlyphRasterizer(int scale, int thickness) {
        if (scale < 1) throw new InvalidInputException("Font scale must be at least 1, got " + scale);
        if (thickness < 1) throw new InvalidInputException("Font thickness must be at least 1, got " + thickness);
        this.scale = scale;
        this.thickness = thickness;
    }

    @Override
    public GlyphSize measure(char c) {
        // one blank column separates neighbouring glyphs
        return new GlyphSize((COLUMNS + 1) * scale + thickness - 1, ROWS * scale + thickness - 1);
    }

    @Override
    public void draw(char c, int x, int baselineY, MaskCanvas canvas) {
        int[] bits = shapeOf(c);
        int dot = scale + thickness - 1;
        int top = baselineY - (ROWS * scale + thickness - 1);
        for (int row = 0; row < ROWS; row++) {
            for (int col = 0; col < COLUMNS; col++) {
                if ((bits[row] & (1 << (COLUMNS - 1 - col))) != 0) {
                    canvas.fillRect(x + col * scale, top + row * scale, dot, dot);
                }
            }
        }
    }

    private static int[] shapeOf(char c) {
        int[] bits = GLYPHS.get(Character.toUpperCase(c));
        return bits != null ? bits : GLYPHS.get('?');
    }
}
