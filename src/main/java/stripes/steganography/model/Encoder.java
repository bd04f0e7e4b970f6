package stripes.steganography.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stripes.steganography.exception.InvalidInputException;
import stripes.steganography.model.text.GlyphRasterizer;
import stripes.steganography.model.text.TextMaskRenderer;

/**
 * Hides a message in a carrier image.
 *
 * Under message ink the stripe layer uses the key pattern shifted by half a
 * period, elsewhere the plain key pattern. The stripe layer is then mixed into
 * the brightness-driven line layer with weight {@code amplitude}.
 */
public class Encoder {

    private static final Logger log = LoggerFactory.getLogger(Encoder.class);

    private final KeyPatternGenerator keyGenerator;
    private final TextMaskRenderer textRenderer;

    public Encoder(GlyphRasterizer rasterizer) {
        this(new KeyPatternGenerator(), new TextMaskRenderer(rasterizer));
    }

    public Encoder(KeyPatternGenerator keyGenerator, TextMaskRenderer textRenderer) {
        this.keyGenerator = keyGenerator;
        this.textRenderer = textRenderer;
    }

    public EncodingResult encode(GrayImage carrier, String text, EncodeSettings settings) {
        if (carrier == null) throw new InvalidInputException("Carrier image is required.");
        if (settings == null) throw new InvalidInputException("Encode settings are required.");
        int height = carrier.height();
        int width = carrier.width();

        if (!carriesMessage(width, settings)) {
            log.warn("Period {} with {} stripes gives a key pattern equal to its half-period shift; "
                    + "the message will not be recoverable", settings.period(), settings.stripeType());
        }
        GrayImage stripes = stripeLayer(text, height, width, settings);
        GrayImage lines = new BrightnessLineEncoder(settings.lines()).encode(carrier);
        GrayImage stego = ImageOps.blend(lines, stripes, settings.amplitude()).quantize();

        log.debug("Encoded {}x{} carrier with period {} ({}), amplitude {}",
                height, width, settings.period(), settings.stripeType(), settings.amplitude());
        return new EncodingResult(stego, settings.parameters());
    }

    /**
     * Whether the half-period shift changes the key pattern at this width. When it does
     * not (period 1, or sinusoidal stripes with period 2), masked and unmasked areas
     * look the same and nothing can be revealed.
     */
    public boolean carriesMessage(int width, EncodeSettings settings) {
        GrayImage key = keyGenerator.generate(1, width, settings.period(), settings.stripeType());
        return !key.equals(keyGenerator.generateShifted(key, settings.period() / 2));
    }

    /**
     * Key pattern where the mask is 0, shifted key pattern where it is 1.
     */
    public GrayImage stripeLayer(String text, int height, int width, EncodeSettings settings) {
        GrayImage key = keyGenerator.generate(height, width, settings.period(), settings.stripeType());
        GrayImage shifted = keyGenerator.generateShifted(key, settings.period() / 2);
        GrayImage mask = textRenderer.render(text, height, width, settings.layout());
        return ImageOps.blend(key, shifted, mask);
    }
}
