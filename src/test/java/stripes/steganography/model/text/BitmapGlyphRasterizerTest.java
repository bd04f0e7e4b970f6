package stripes.steganography.model.text;

import org.junit.Test;
import stripes.steganography.exception.InvalidInputException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BitmapGlyphRasterizerTest {

    @Test
    public void measureScalesCellAndStroke() {
        assertEquals(new GlyphSize(6, 7), new BitmapGlyphRasterizer(1, 1).measure('A'));
        assertEquals(new GlyphSize(12, 14), new BitmapGlyphRasterizer(2, 1).measure('W'));
        assertEquals(new GlyphSize(8, 9), new BitmapGlyphRasterizer(1, 3).measure('.'));
    }

    @Test
    public void drawsGlyphAboveBaseline() {
        MaskCanvas canvas = new MaskCanvas(8, 6);
        new BitmapGlyphRasterizer(1, 1).draw('I', 0, 7, canvas);
        assertTrue(canvas.isInk(1, 0));
        assertTrue(canvas.isInk(3, 0));
        assertFalse(canvas.isInk(1, 1));
        assertTrue(canvas.isInk(2, 3));
        assertFalse(canvas.isInk(2, 7));
        assertEquals(3 + 5 + 3, canvas.inkCount());
    }

    @Test
    public void lowercaseAndUnknownCharactersFallBack() {
        assertEquals(inkOf('S'), inkOf('s'));
        assertEquals(inkOf('?'), inkOf('#'));
    }

    @Test(expected = InvalidInputException.class)
    public void rejectsZeroScale() {
        new BitmapGlyphRasterizer(0, 1);
    }

    private static String inkOf(char c) {
        MaskCanvas canvas = new MaskCanvas(7, 6);
        new BitmapGlyphRasterizer(1, 1).draw(c, 0, 7, canvas);
        StringBuilder sb = new StringBuilder();
        for (int y = 0; y < 7; y++) {
            for (int x = 0; x < 6; x++) {
                sb.append(canvas.isInk(x, y) ? '#' : '.');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
