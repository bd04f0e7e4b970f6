package stripes.steganography.model;

import stripes.steganography.exception.InvalidInputException;

/**
 * Block geometry and thickness mapping of the line layer.
 *
 * @param stripWidth    block width in pixels
 * @param chunkHeight   block height in pixels
 * @param minThickness  bar width drawn for blocks at {@code brightnessMin}
 * @param maxThickness  bar width drawn for blocks at {@code brightnessMax}
 * @param brightnessMin lower end of the range the carrier is normalized into
 * @param brightnessMax upper end of the range the carrier is normalized into
 */
public record LineSettings(int stripWidth, int chunkHeight, int minThickness, int maxThickness,
                           int brightnessMin, int brightnessMax) {

    public LineSettings {
        if (stripWidth < 1) throw new InvalidInputException("Strip width must be at least 1, got " + stripWidth);
        if (chunkHeight < 1) throw new InvalidInputException("Chunk height must be at least 1, got " + chunkHeight);
        if (minThickness < 0 || maxThickness < minThickness) {
            throw new InvalidInputException("Line thickness range is invalid: [" + minThickness + ", " + maxThickness + "]");
        }
        if (brightnessMin < 0 || brightnessMax > 255 || brightnessMin >= brightnessMax) {
            throw new InvalidInputException("Brightness range must satisfy 0 <= min < max <= 255, got ["
                    + brightnessMin + ", " + brightnessMax + "]");
        }
    }
}
