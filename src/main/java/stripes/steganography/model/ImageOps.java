package stripes.steganography.model;

import stripes.steganography.exception.InvalidInputException;

/**
 * Numeric helpers shared by the encoder and decoder.
 */
public final class ImageOps {

    private ImageOps() {
    }

    /**
     * Linear min-max stretch of the sample range onto [low, high].
     * A constant image maps entirely to {@code low}.
     */
    public static GrayImage normalize(GrayImage image, double low, double high) {
        if (!(low <= high)) {
            throw new InvalidInputException("Normalization range is empty: [" + low + ", " + high + "]");
        }
        double min = image.min();
        double max = image.max();
        double span = max - min;
        double scale = span > 0 ? (high - low) / span : 0.0;
        return image.map(s -> (s - min) * scale + low);
    }

    public static GrayImage absDiff(GrayImage a, GrayImage b) {
        return a.combine(b, (x, y) -> Math.abs(x - y));
    }

    /**
     * Per-pixel {@code a * (1 - w) + b * w}.
     */
    public static GrayImage blend(GrayImage a, GrayImage b, GrayImage weights) {
        a.requireSameSize(b);
        a.requireSameSize(weights);
        return GrayImage.compute(a.height(), a.width(), (r, c) -> {
            double w = weights.get(r, c);
            return a.get(r, c) * (1 - w) + b.get(r, c) * w;
        });
    }

    public static GrayImage blend(GrayImage a, GrayImage b, double weight) {
        return a.combine(b, (x, y) -> x * (1 - weight) + y * weight);
    }

    public static GrayImage round(GrayImage image) {
        return image.map(Math::rint);
    }
}
