package stripes.steganography.model;

import stripes.steganography.exception.InvalidInputException;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable single-channel intensity grid stored row-major.
 * Samples are doubles so that blending intermediates need no separate type;
 * images read from or written to files hold integer values in [0,255].
 */
public final class GrayImage {

    @FunctionalInterface
    public interface SampleFunction {
        double at(int row, int col);
    }

    private final int height;
    private final int width;
    private final double[] samples;

    private GrayImage(int height, int width, double[] samples) {
        this.height = height;
        this.width = width;
        this.samples = samples;
    }

    public static GrayImage of(int height, int width, double[] samples) {
        requireDimensions(height, width);
        if (samples == null || samples.length != height * width) {
            throw new InvalidInputException("Expected " + height * width + " samples for a "
                    + height + "x" + width + " image");
        }
        return new GrayImage(height, width, samples.clone());
    }

    public static GrayImage filled(int height, int width, double value) {
        requireDimensions(height, width);
        double[] samples = new double[height * width];
        Arrays.fill(samples, value);
        return new GrayImage(height, width, samples);
    }

    public static GrayImage compute(int height, int width, SampleFunction function) {
        requireDimensions(height, width);
        double[] samples = new double[height * width];
        for (int row = 0; row < height; row++) {
            int base = row * width;
            for (int col = 0; col < width; col++) {
                samples[base + col] = function.at(row, col);
            }
        }
        return new GrayImage(height, width, samples);
    }

    public static void requireDimensions(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new InvalidInputException("Image dimensions must be positive, got " + height + "x" + width);
        }
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public double get(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException(
                    "Pixel (" + row + ", " + col + ") is outside a " + height + "x" + width + " image");
        }
        return samples[row * width + col];
    }

    public double min() {
        double min = Double.POSITIVE_INFINITY;
        for (double s : samples) min = Math.min(min, s);
        return min;
    }

    public double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (double s : samples) max = Math.max(max, s);
        return max;
    }

    /**
     * Mean of the rectangle starting at (row, col), clipped to the image bounds.
     * Returns NaN when the clipped rectangle is empty.
     */
    public double regionMean(int row, int col, int regionHeight, int regionWidth) {
        int rowEnd = Math.min(height, row + regionHeight);
        int colEnd = Math.min(width, col + regionWidth);
        double sum = 0;
        int count = 0;
        for (int r = Math.max(0, row); r < rowEnd; r++) {
            for (int c = Math.max(0, col); c < colEnd; c++) {
                sum += samples[r * width + c];
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    public GrayImage map(DoubleUnaryOperator operator) {
        double[] out = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = operator.applyAsDouble(samples[i]);
        }
        return new GrayImage(height, width, out);
    }

    public GrayImage combine(GrayImage other, DoubleBinaryOperator operator) {
        requireSameSize(other);
        double[] out = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = operator.applyAsDouble(samples[i], other.samples[i]);
        }
        return new GrayImage(height, width, out);
    }

    /**
     * Clips to [0,255] and truncates toward zero, the conversion applied to every output image.
     */
    public GrayImage quantize() {
        return map(s -> Math.floor(Math.max(0.0, Math.min(255.0, s))));
    }

    public byte[] toByteSamples() {
        byte[] out = new byte[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = (byte) (int) Math.max(0.0, Math.min(255.0, samples[i]));
        }
        return out;
    }

    public boolean sameSize(GrayImage other) {
        return other != null && other.height == height && other.width == width;
    }

    public void requireSameSize(GrayImage other) {
        if (!sameSize(other)) {
            throw new InvalidInputException("Image size mismatch: " + height + "x" + width + " vs "
                    + (other == null ? "null" : other.height + "x" + other.width));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GrayImage)) return false;
        GrayImage that = (GrayImage) o;
        return height == that.height && width == that.width && Arrays.equals(samples, that.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * height + width) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "GrayImage[" + height + "x" + width + "]";
    }
}
