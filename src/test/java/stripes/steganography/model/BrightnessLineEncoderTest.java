package stripes.steganography.model;

import org.junit.Test;
import stripes.steganography.exception.InvalidInputException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BrightnessLineEncoderTest {

    @Test
    public void thicknessIsNonDecreasingInBrightness() {
        BrightnessLineEncoder encoder = new BrightnessLineEncoder(new LineSettings(10, 10, 1, 9, 15, 240));
        int previous = Integer.MIN_VALUE;
        for (double mean = 0; mean <= 255; mean += 0.5) {
            int thickness = encoder.thicknessFor(mean);
            assertTrue("thickness dropped at " + mean, thickness >= previous);
            previous = thickness;
        }
        assertEquals(1, encoder.thicknessFor(15));
        assertEquals(9, encoder.thicknessFor(240));
        assertEquals(1, encoder.thicknessFor(0));
        assertEquals(9, encoder.thicknessFor(255));
        assertEquals(5, encoder.thicknessFor(127.5));
    }

    @Test
    public void brighterBlocksDrawThickerBars() {
        GrayImage carrier = GrayImage.compute(5, 10, (row, col) -> col < 5 ? 0 : 255);
        GrayImage lines = new BrightnessLineEncoder(new LineSettings(5, 5, 1, 5, 15, 240)).encode(carrier);
        assertEquals(1, inkInRange(lines, 0, 0, 5));
        assertEquals(5, inkInRange(lines, 0, 5, 10));
    }

    @Test
    public void barsAreCentredAndClippedToPartialBlocks() {
        GrayImage carrier = GrayImage.filled(7, 12, 100);
        GrayImage lines = new BrightnessLineEncoder(new LineSettings(5, 5, 3, 5, 15, 240)).encode(carrier);
        double[] expectedRow = {0, 255, 255, 255, 0, 0, 255, 255, 255, 0, 255, 255};
        for (int row = 0; row < 7; row++) {
            for (int col = 0; col < 12; col++) {
                assertEquals("row " + row + " col " + col, expectedRow[col], lines.get(row, col), 0.0);
            }
        }
    }

    @Test
    public void unevenDimensionsProduceFullSizeOutput() {
        GrayImage carrier = GrayImage.compute(23, 17, (row, col) -> (row * 17 + col) % 256);
        GrayImage lines = new BrightnessLineEncoder(new LineSettings(5, 5, 1, 5, 15, 240)).encode(carrier);
        assertEquals(23, lines.height());
        assertEquals(17, lines.width());
        for (int row = 0; row < 23; row++) {
            for (int blockStart = 0; blockStart < 17; blockStart += 5) {
                int end = Math.min(17, blockStart + 5);
                assertTrue("no bar at row " + row + " block " + blockStart,
                        inkInRange(lines, row, blockStart, end) >= 1);
            }
            for (int col = 0; col < 17; col++) {
                double v = lines.get(row, col);
                assertTrue(v == 0 || v == 255);
            }
        }
    }

    @Test(expected = InvalidInputException.class)
    public void rejectsInvertedThicknessRange() {
        new LineSettings(5, 5, 6, 2, 15, 240);
    }

    @Test(expected = InvalidInputException.class)
    public void rejectsEmptyBrightnessRange() {
        new LineSettings(5, 5, 1, 5, 200, 200);
    }

    private static int inkInRange(GrayImage image, int row, int from, int to) {
        int count = 0;
        for (int col = from; col < to; col++) {
            if (image.get(row, col) == 255) count++;
        }
        return count;
    }
}
