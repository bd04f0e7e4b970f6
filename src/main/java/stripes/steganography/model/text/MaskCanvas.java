package stripes.steganography.model.text;

import stripes.steganography.model.GrayImage;

/**
 * Mutable binary drawing surface used while the text mask is assembled.
 * Out of bounds writes are clipped silently.
 */
public final class MaskCanvas {

    private final int height;
    private final int width;
    private final boolean[] ink;

    public MaskCanvas(int height, int width) {
        GrayImage.requireDimensions(height, width);
        this.height = height;
        this.width = width;
        this.ink = new boolean[height * width];
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public boolean isInk(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height && ink[y * width + x];
    }

    public void mark(int x, int y) {
        if (x >= 0 && y >= 0 && x < width && y < height) {
            ink[y * width + x] = true;
        }
    }

    public void fillRect(int x, int y, int rectWidth, int rectHeight) {
        int x0 = Math.max(0, x);
        int y0 = Math.max(0, y);
        int x1 = Math.min(width, x + rectWidth);
        int y1 = Math.min(height, y + rectHeight);
        for (int row = y0; row < y1; row++) {
            for (int col = x0; col < x1; col++) {
                ink[row * width + col] = true;
            }
        }
    }

    public long inkCount() {
        long count = 0;
        for (boolean b : ink) if (b) count++;
        return count;
    }

    /**
     * Rotates about the canvas centre by {@code angleDegrees}, counter-clockwise as
     * seen on screen, sampling the source with nearest neighbour so ink stays binary.
     * Areas rotated in from outside the canvas are empty.
     */
    public MaskCanvas rotate(double angleDegrees) {
        double theta = Math.toRadians(angleDegrees);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        double cx = (width - 1) / 2.0;
        double cy = (height - 1) / 2.0;
        MaskCanvas rotated = new MaskCanvas(height, width);
        for (int y = 0; y < height; y++) {
            double dy = y - cy;
            for (int x = 0; x < width; x++) {
                double dx = x - cx;
                long srcX = Math.round(cos * dx - sin * dy + cx);
                long srcY = Math.round(sin * dx + cos * dy + cy);
                if (isInk((int) srcX, (int) srcY)) {
                    rotated.ink[y * width + x] = true;
                }
            }
        }
        return rotated;
    }

    /**
     * Copies the window with top-left corner (x, y), clipped to this canvas.
     * A window entirely outside the canvas yields a blank 1x1 canvas.
     */
    public MaskCanvas crop(int x, int y, int cropWidth, int cropHeight) {
        int x0 = Math.max(0, x);
        int y0 = Math.max(0, y);
        int w = Math.min(width, x + cropWidth) - x0;
        int h = Math.min(height, y + cropHeight) - y0;
        MaskCanvas cropped = new MaskCanvas(Math.max(1, h), Math.max(1, w));
        if (w <= 0) {
            return cropped;
        }
        for (int row = 0; row < h; row++) {
            System.arraycopy(ink, (y0 + row) * width + x0, cropped.ink, row * cropped.width, w);
        }
        return cropped;
    }

    public MaskCanvas resizeNearest(int targetHeight, int targetWidth) {
        if (targetHeight == height && targetWidth == width) {
            return this;
        }
        MaskCanvas resized = new MaskCanvas(targetHeight, targetWidth);
        double scaleY = (double) height / targetHeight;
        double scaleX = (double) width / targetWidth;
        for (int row = 0; row < targetHeight; row++) {
            int srcRow = Math.min(height - 1, (int) Math.floor(row * scaleY));
            for (int col = 0; col < targetWidth; col++) {
                int srcCol = Math.min(width - 1, (int) Math.floor(col * scaleX));
                resized.ink[row * targetWidth + col] = ink[srcRow * width + srcCol];
            }
        }
        return resized;
    }

    /**
     * Ink as 1.0, background as 0.0.
     */
    public GrayImage toMask() {
        return GrayImage.compute(height, width, (row, col) -> ink[row * width + col] ? 1.0 : 0.0);
    }
}
