package stripes.steganography.model.text;

import stripes.steganography.exception.InvalidInputException;

/**
 * Placement of the repeated message inside the mask.
 *
 * @param angleDegrees  rotation of the whole tiling, counter-clockwise
 * @param spacingX      horizontal tile step as a multiple of the rotated text width
 * @param spacingY      vertical tile step as a multiple of the rotated text height
 * @param letterSpacing extra pixels between characters of one text instance
 */
public record TextLayout(double angleDegrees, double spacingX, double spacingY, int letterSpacing) {

    public TextLayout {
        if (!Double.isFinite(angleDegrees)) throw new InvalidInputException("Text angle must be finite.");
        if (!(spacingX > 0) || !(spacingY > 0)) {
            throw new InvalidInputException("Text spacing must be positive, got " + spacingX + "/" + spacingY);
        }
        if (letterSpacing < 0) throw new InvalidInputException("Letter spacing cannot be negative.");
    }
}
