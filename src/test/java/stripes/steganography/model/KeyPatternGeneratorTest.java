package stripes.steganography.model;

import org.junit.Test;
import stripes.steganography.exception.InvalidInputException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class KeyPatternGeneratorTest {

    private final KeyPatternGenerator generator = new KeyPatternGenerator();

    @Test
    public void generateIsDeterministic() {
        for (StripeType type : StripeType.values()) {
            GrayImage first = generator.generate(17, 33, 7, type);
            GrayImage second = generator.generate(17, 33, 7, type);
            assertEquals(first, second);
        }
    }

    @Test
    public void binaryStripesAreBrightForFirstHalfOfPeriod() {
        GrayImage key = generator.generate(3, 8, 4, StripeType.BINARY);
        double[] expected = {255, 255, 0, 0, 255, 255, 0, 0};
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 8; col++) {
                assertEquals(expected[col], key.get(row, col), 0.0);
            }
        }
    }

    @Test
    public void sinusoidalStripesFollowSineWave() {
        GrayImage key = generator.generate(2, 4, 4, StripeType.SINUSOIDAL);
        assertEquals(127, key.get(0, 0), 0.0);
        assertEquals(255, key.get(0, 1), 0.0);
        assertEquals(127, key.get(1, 2), 0.0);
        assertEquals(0, key.get(1, 3), 0.0);
    }

    @Test
    public void periodOneBinaryIsFlat() {
        GrayImage key = generator.generate(4, 9, 1, StripeType.BINARY);
        assertEquals(0, key.min(), 0.0);
        assertEquals(0, key.max(), 0.0);
    }

    @Test
    public void halfPeriodShiftFlipsEveryColumn() {
        int width = 60;
        for (int period : new int[]{2, 4, 6, 10}) {
            GrayImage key = generator.generate(2, width, period, StripeType.BINARY);
            GrayImage shifted = generator.generateShifted(key, period / 2);
            for (int col = 0; col < width; col++) {
                assertNotEquals("period " + period + " column " + col,
                        key.get(0, col), shifted.get(0, col), 0.0);
            }
        }
    }

    @Test
    public void shiftMovesContentRightAndWraps() {
        GrayImage key = GrayImage.compute(2, 5, (row, col) -> col * 10.0 + row);
        GrayImage shifted = generator.generateShifted(key, 2);
        assertEquals(30, shifted.get(0, 0), 0.0);
        assertEquals(40, shifted.get(0, 1), 0.0);
        assertEquals(0, shifted.get(0, 2), 0.0);
        assertEquals(21, shifted.get(1, 4), 0.0);
    }

    @Test
    public void shiftByWidthIsIdentityOffset() {
        GrayImage key = generator.generate(5, 23, 6, StripeType.SINUSOIDAL);
        assertEquals(generator.generateShifted(key, 3), generator.generateShifted(key, 3 + 23));
        assertEquals(generator.generateShifted(key, 3), generator.generateShifted(key, 3 - 23));
        assertEquals(key, generator.generateShifted(key, 23));
    }

    @Test(expected = InvalidInputException.class)
    public void rejectsNonPositiveHeight() {
        generator.generate(0, 10, 4, StripeType.BINARY);
    }

    @Test(expected = InvalidInputException.class)
    public void rejectsZeroPeriod() {
        generator.generate(10, 10, 0, StripeType.BINARY);
    }

    @Test(expected = InvalidInputException.class)
    public void rejectsMissingStripeType() {
        generator.generate(10, 10, 4, null);
    }
}
