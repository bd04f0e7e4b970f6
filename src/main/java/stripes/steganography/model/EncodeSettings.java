package stripes.steganography.model;

import stripes.steganography.exception.InvalidInputException;
import stripes.steganography.model.text.TextLayout;

/**
 * Everything the encoder needs besides the carrier, the message and the glyph backend.
 *
 * @param period     stripe period in pixels
 * @param stripeType binary or sinusoidal stripes
 * @param amplitude  weight of the stripe layer against the line layer, in [0,1]
 * @param lines      line layer settings
 * @param layout     text tiling settings
 */
public record EncodeSettings(int period, StripeType stripeType, double amplitude,
                             LineSettings lines, TextLayout layout) {

    public EncodeSettings {
        if (period < 1) throw new InvalidInputException("Stripe period must be at least 1, got " + period);
        if (stripeType == null) throw new InvalidInputException("Stripe type is required.");
        if (!(amplitude >= 0.0 && amplitude <= 1.0)) {
            throw new InvalidInputException("Amplitude must be within [0, 1], got " + amplitude);
        }
        if (lines == null) throw new InvalidInputException("Line settings are required.");
        if (layout == null) throw new InvalidInputException("Text layout is required.");
    }

    public EncodingParameters parameters() {
        return new EncodingParameters(period, stripeType);
    }
}
