package stripes.steganography.model.text;

import org.junit.Assume;
import org.junit.Test;
import stripes.steganography.exception.InvalidInputException;
import stripes.steganography.model.GrayImage;

import java.awt.Font;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TextMaskRendererTest {

    private final TextMaskRenderer renderer = new TextMaskRenderer(new BitmapGlyphRasterizer(1, 1));

    @Test
    public void emptyTextGivesBlankMask() {
        GrayImage mask = renderer.render("", 40, 50, new TextLayout(45, 1.4, 0.4, 0));
        assertEquals(40, mask.height());
        assertEquals(50, mask.width());
        assertEquals(0, mask.max(), 0.0);
    }

    @Test(expected = InvalidInputException.class)
    public void nullTextIsRejected() {
        renderer.render(null, 40, 50, new TextLayout(45, 1.4, 0.4, 0));
    }

    @Test
    public void maskIsBinaryAndFullSize() {
        GrayImage mask = renderer.render("SECRET", 61, 83, new TextLayout(30, 1.4, 0.4, 2));
        assertEquals(61, mask.height());
        assertEquals(83, mask.width());
        for (int row = 0; row < 61; row++) {
            for (int col = 0; col < 83; col++) {
                double v = mask.get(row, col);
                assertTrue(v == 0.0 || v == 1.0);
            }
        }
        assertEquals(1.0, mask.max(), 0.0);
    }

    @Test
    public void renderIsDeterministic() {
        TextLayout layout = new TextLayout(45, 1.4, 0.4, 0);
        assertEquals(renderer.render("SECRET", 50, 70, layout), renderer.render("SECRET", 50, 70, layout));
    }

    @Test
    public void tilingCoversEveryHorizontalBand() {
        for (double angle : new double[]{0, 45, -30, 90}) {
            GrayImage mask = renderer.render("SECRET", 120, 160, new TextLayout(angle, 1.4, 1.0, 0));
            int band = 7;
            for (int top = 0; top + band <= mask.height(); top++) {
                assertTrue("no ink in rows " + top + ".." + (top + band) + " at angle " + angle,
                        mask.regionMean(top, 0, band, mask.width()) > 0);
            }
        }
    }

    @Test
    public void tilingCoversEveryVerticalBand() {
        GrayImage mask = renderer.render("SECRET", 120, 160, new TextLayout(45, 1.4, 0.4, 0));
        for (int left = 0; left + 7 <= mask.width(); left++) {
            assertTrue("no ink in columns starting at " + left, mask.regionMean(0, left, mask.height(), 7) > 0);
        }
    }

    @Test
    public void unrotatedTextKeepsGlyphRows() {
        // with spacing 1.0 the tile pitch equals the text height, so rows repeat every 7 pixels
        GrayImage mask = renderer.render("EEE", 35, 36, new TextLayout(0, 1.0, 1.0, 0));
        for (int row = 0; row + 7 < mask.height(); row++) {
            for (int col = 0; col < mask.width(); col++) {
                assertEquals(mask.get(row, col), mask.get(row + 7, col), 0.0);
            }
        }
    }

    @Test
    public void awtFontBackendProducesInk() {
        GlyphRasterizer awt;
        try {
            awt = new AwtGlyphRasterizer(new Font(Font.MONOSPACED, Font.BOLD, 18));
            Assume.assumeTrue(awt.measure('S').width() > 0);
        } catch (Throwable t) {
            Assume.assumeNoException("no usable font configuration", t);
            return;
        }
        GrayImage mask = new TextMaskRenderer(awt).render("SECRET", 80, 100, new TextLayout(45, 1.4, 0.4, 0));
        assertTrue(mask.max() == 1.0);
        assertTrue(mask.regionMean(0, 0, 80, 100) < 1.0);
    }

    @Test(expected = InvalidInputException.class)
    public void rejectsNonPositiveSpacing() {
        new TextLayout(0, 0, 1, 0);
    }
}
