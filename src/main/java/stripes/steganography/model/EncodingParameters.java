package stripes.steganography.model;

import stripes.steganography.exception.InvalidInputException;
import stripes.steganography.exception.MissingMetadataException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The state that must travel from encoder to decoder. Image height and width
 * are taken from the stego image itself.
 */
public record EncodingParameters(int period, StripeType stripeType) {

    public static final String PERIOD_KEY = "stripe_period";
    public static final String STRIPE_TYPE_KEY = "stripe_type";

    public EncodingParameters {
        if (period < 1) throw new InvalidInputException("Stripe period must be at least 1, got " + period);
        if (stripeType == null) throw new InvalidInputException("Stripe type is required.");
    }

    public Map<String, String> toMetadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(PERIOD_KEY, Integer.toString(period));
        metadata.put(STRIPE_TYPE_KEY, stripeType.wireName());
        return metadata;
    }

    /**
     * Rebuilds the parameters from image text metadata.
     * @throws MissingMetadataException if an entry is absent or cannot be parsed.
     */
    public static EncodingParameters fromMetadata(Map<String, String> metadata) {
        if (metadata == null) {
            throw new MissingMetadataException("No metadata available to recover the encoding parameters.");
        }
        String period = metadata.get(PERIOD_KEY);
        String stripeType = metadata.get(STRIPE_TYPE_KEY);
        if (period == null || stripeType == null) {
            throw new MissingMetadataException("Image metadata lacks '" + PERIOD_KEY + "' or '" + STRIPE_TYPE_KEY
                    + "'. Was it produced by the encode command?");
        }
        try {
            return new EncodingParameters(Integer.parseInt(period.trim()), StripeType.fromName(stripeType));
        } catch (NumberFormatException e) {
            throw new MissingMetadataException("Malformed " + PERIOD_KEY + " in image metadata: " + period, e);
        } catch (InvalidInputException e) {
            throw new MissingMetadataException("Malformed encoding parameters in image metadata: " + e.getMessage(), e);
        }
    }
}
