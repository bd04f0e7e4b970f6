package stripes.steganography.model;

import stripes.steganography.exception.InvalidInputException;

/**
 * Builds the vertical stripe key pattern. Output depends only on the arguments,
 * which is what lets the decoder regenerate the key instead of storing it.
 */
public class KeyPatternGenerator {

    public GrayImage generate(int height, int width, int period, StripeType stripeType) {
        GrayImage.requireDimensions(height, width);
        if (period < 1) throw new InvalidInputException("Stripe period must be at least 1, got " + period);
        if (stripeType == null) throw new InvalidInputException("Stripe type is required.");

        double[] columns = new double[width];
        for (int x = 0; x < width; x++) {
            columns[x] = switch (stripeType) {
                case BINARY -> (x % period) < period / 2 ? 255.0 : 0.0;
                case SINUSOIDAL -> (int) (255.0 * (1.0 + Math.sin(2.0 * Math.PI * x / period)) / 2.0);
            };
        }
        return GrayImage.compute(height, width, (row, col) -> columns[col]);
    }

    /**
     * Moves the pattern {@code shift} pixels to the right, wrapping columns around the border.
     */
    public GrayImage generateShifted(GrayImage key, int shift) {
        if (key == null) throw new InvalidInputException("Key pattern is required.");
        int width = key.width();
        int offset = Math.floorMod(shift, width);
        return GrayImage.compute(key.height(), width,
                (row, col) -> key.get(row, Math.floorMod(col - offset, width)));
    }
}
