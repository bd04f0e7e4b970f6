package stripes.steganography.model;

import stripes.steganography.exception.InvalidInputException;

/**
 * Renders the carrier as vertical bars, one per {@code chunkHeight x stripWidth}
 * block. Brighter blocks draw thicker bars.
 */
public class BrightnessLineEncoder {

    private final LineSettings settings;

    public BrightnessLineEncoder(LineSettings settings) {
        if (settings == null) throw new InvalidInputException("Line settings are required.");
        this.settings = settings;
    }

    /**
     * Normalizes the carrier into the configured brightness range, then draws one
     * centred bar per block (255 on a 0 background). Blocks on the right and bottom
     * edges may be smaller; bars are clipped to their block.
     */
    public GrayImage encode(GrayImage carrier) {
        GrayImage adjusted = ImageOps.normalize(carrier, settings.brightnessMin(), settings.brightnessMax());
        int height = adjusted.height();
        int width = adjusted.width();
        double[] lines = new double[height * width];

        for (int x = 0; x < width; x += settings.stripWidth()) {
            int blockWidth = Math.min(settings.stripWidth(), width - x);
            for (int y = 0; y < height; y += settings.chunkHeight()) {
                int blockHeight = Math.min(settings.chunkHeight(), height - y);
                double mean = adjusted.regionMean(y, x, blockHeight, blockWidth);
                if (Double.isNaN(mean)) {
                    continue;
                }
                int thickness = Math.min(thicknessFor(mean), blockWidth);
                int start = x + (blockWidth - thickness) / 2;
                for (int row = y; row < y + blockHeight; row++) {
                    for (int col = start; col < start + thickness; col++) {
                        lines[row * width + col] = 255.0;
                    }
                }
            }
        }
        return GrayImage.of(height, width, lines);
    }

    /**
     * Maps a block mean linearly from the brightness range onto the thickness range,
     * rounded and clamped. Non-decreasing in {@code meanBrightness}.
     */
    public int thicknessFor(double meanBrightness) {
        double brightnessSpan = settings.brightnessMax() - settings.brightnessMin();
        double raw = settings.minThickness() + (meanBrightness - settings.brightnessMin())
                * (settings.maxThickness() - settings.minThickness()) / brightnessSpan;
        long rounded = Math.round(raw);
        return (int) Math.max(settings.minThickness(), Math.min(settings.maxThickness(), rounded));
    }
}
