package stripes.steganography.model.text;

import org.junit.Assume;
import org.junit.Test;
import stripes.steganography.exception.InvalidInputException;

import java.awt.Font;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class GlyphRasterizersTest {

    @Test
    public void builtinRoundsScaleToWholeCells() {
        GlyphRasterizer rasterizer = GlyphRasterizers.forFont("builtin", 1.4, 1);
        assertTrue(rasterizer instanceof BitmapGlyphRasterizer);
        assertEquals(new GlyphSize(6, 7), rasterizer.measure('A'));
        assertEquals(new GlyphSize(12, 14), GlyphRasterizers.forFont(" BUILTIN ", 1.6, 1).measure('A'));
    }

    @Test
    public void unknownFontFamilyIsRejected() {
        InvalidInputException rejected = null;
        try {
            GlyphRasterizers.forFont("No Such Family 7f3a", 1.0, 1);
        } catch (InvalidInputException e) {
            rejected = e;
        } catch (Throwable t) {
            Assume.assumeNoException("no usable font configuration", t);
        }
        assertNotNull(rejected);
        assertTrue(rejected.getMessage().contains("No Such Family 7f3a"));
    }

    @Test
    public void logicalFontFamilyIsAccepted() {
        GlyphRasterizer rasterizer;
        try {
            rasterizer = GlyphRasterizers.forFont(Font.MONOSPACED, 1.0, 1);
        } catch (Throwable t) {
            Assume.assumeNoException("no usable font configuration", t);
            return;
        }
        assertTrue(rasterizer instanceof AwtGlyphRasterizer);
    }

    @Test(expected = InvalidInputException.class)
    public void rejectsNonPositiveScale() {
        GlyphRasterizers.forFont("builtin", 0.0, 1);
    }
}
