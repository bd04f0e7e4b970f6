package stripes.steganography.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stripes.steganography.exception.InvalidInputException;
import stripes.steganography.exception.MissingMetadataException;

/**
 * Reveals the hidden message as the contrast-stretched absolute difference
 * between the stego image and the key pattern.
 */
public class Decoder {

    private static final Logger log = LoggerFactory.getLogger(Decoder.class);

    private final KeyPatternGenerator keyGenerator;

    public Decoder() {
        this(new KeyPatternGenerator());
    }

    public Decoder(KeyPatternGenerator keyGenerator) {
        this.keyGenerator = keyGenerator;
    }

    /**
     * Regenerates the key pattern from {@code parameters} and the size of {@code stego}.
     * @throws MissingMetadataException if {@code parameters} is null.
     */
    public GrayImage decode(GrayImage stego, EncodingParameters parameters) {
        if (stego == null) throw new InvalidInputException("Stego image is required.");
        if (parameters == null) {
            throw new MissingMetadataException("Encoding parameters are required to regenerate the key pattern.");
        }
        log.debug("Regenerating {} key pattern with period {} for {}x{} image",
                parameters.stripeType(), parameters.period(), stego.height(), stego.width());
        GrayImage key = keyGenerator.generate(stego.height(), stego.width(),
                parameters.period(), parameters.stripeType());
        return reveal(stego, key);
    }

    /**
     * Differences against a key pattern supplied by the caller instead of regenerating it.
     */
    public GrayImage decodeWithKey(GrayImage stego, GrayImage key) {
        if (stego == null) throw new InvalidInputException("Stego image is required.");
        if (key == null) throw new MissingMetadataException("A key pattern is required to decode.");
        stego.requireSameSize(key);
        return reveal(stego, key);
    }

    private GrayImage reveal(GrayImage stego, GrayImage key) {
        GrayImage difference = ImageOps.absDiff(stego, key);
        return ImageOps.round(ImageOps.normalize(difference, 0, 255));
    }
}
