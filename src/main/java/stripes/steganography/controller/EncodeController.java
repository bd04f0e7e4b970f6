package stripes.steganography.controller;

import stripes.steganography.model.EncodeSettings;
import stripes.steganography.model.EncodingParameters;
import stripes.steganography.model.LineSettings;
import stripes.steganography.model.SteganographyService;
import stripes.steganography.model.StripeType;
import stripes.steganography.model.text.GlyphRasterizer;
import stripes.steganography.model.text.GlyphRasterizers;
import stripes.steganography.model.text.TextLayout;
import stripes.steganography.view.SteganographyView;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "encode", description = "Hide text in an image as a shifted stripe pattern.")
public class EncodeController implements Callable<Integer> {

    private final SteganographyService service;
    private final SteganographyView view;

    public EncodeController(SteganographyService service, SteganographyView view) {
        this.service = service;
        this.view = view;
    }

    @Option(names = "--input-image", required = true, description = "Carrier image (converted to grayscale).")
    private Path inputImage;

    @Option(names = "--text-to-hide", defaultValue = "SECRET", description = "Text to hide (default: ${DEFAULT-VALUE}).")
    private String textToHide;

    @Option(names = "--output-encoded", description = "Output PNG (default: <output-path>/<input name>-encoded.png).")
    private Path outputEncoded;

    @Option(names = "--output-path", defaultValue = ".", description = "Directory for the default output name (default: ${DEFAULT-VALUE}).")
    private Path outputPath;

    @Option(names = "--stripe-period", defaultValue = "2", description = "Period of the stripes (default: ${DEFAULT-VALUE}).")
    private int stripePeriod;

    @Option(names = "--stripe-type", defaultValue = "binary", description = "binary or sinusoidal (default: ${DEFAULT-VALUE}).")
    private String stripeType;

    @Option(names = "--min-thickness", defaultValue = "1", description = "Minimum line thickness (default: ${DEFAULT-VALUE}).")
    private int minThickness;

    @Option(names = "--max-thickness", defaultValue = "5", description = "Maximum line thickness (default: ${DEFAULT-VALUE}).")
    private int maxThickness;

    @Option(names = "--strip-width", defaultValue = "5", description = "Width of each vertical strip (default: ${DEFAULT-VALUE}).")
    private int stripWidth;

    @Option(names = "--chunk-height", defaultValue = "5", description = "Height of each chunk (default: ${DEFAULT-VALUE}).")
    private int chunkHeight;

    @Option(names = "--brightness-min", defaultValue = "15", description = "Lower end of the carrier brightness range (default: ${DEFAULT-VALUE}).")
    private int brightnessMin;

    @Option(names = "--brightness-max", defaultValue = "240", description = "Upper end of the carrier brightness range (default: ${DEFAULT-VALUE}).")
    private int brightnessMax;

    @Option(names = "--amplitude", defaultValue = "0.3", description = "Strength of the hidden pattern, 0 to 1 (default: ${DEFAULT-VALUE}).")
    private double amplitude;

    @Option(names = "--font", defaultValue = GlyphRasterizers.BUILTIN, description = "'builtin' or an installed font family (default: ${DEFAULT-VALUE}).")
    private String font;

    @Option(names = "--font-scale", defaultValue = "1.0", description = "Font size scaling factor; the builtin font rounds it to a whole number (default: ${DEFAULT-VALUE}).")
    private double fontScale;

    @Option(names = "--font-thickness", defaultValue = "1", description = "Font stroke thickness (default: ${DEFAULT-VALUE}).")
    private int fontThickness;

    @Option(names = "--text-angle", defaultValue = "45", description = "Text rotation angle in degrees (default: ${DEFAULT-VALUE}).")
    private double textAngle;

    @Option(names = "--spacing-x", defaultValue = "1.4", description = "Horizontal text spacing multiplier (default: ${DEFAULT-VALUE}).")
    private double spacingX;

    @Option(names = "--spacing-y", defaultValue = "0.4", description = "Vertical text spacing multiplier (default: ${DEFAULT-VALUE}).")
    private double spacingY;

    @Option(names = "--letter-spacing", defaultValue = "0", description = "Pixel spacing between characters (default: ${DEFAULT-VALUE}).")
    private int letterSpacing;

    @Override
    public Integer call() {
        try {
            validateInputs();
            EncodeSettings settings = new EncodeSettings(
                    stripePeriod,
                    StripeType.fromName(stripeType),
                    amplitude,
                    new LineSettings(stripWidth, chunkHeight, minThickness, maxThickness, brightnessMin, brightnessMax),
                    new TextLayout(textAngle, spacingX, spacingY, letterSpacing));
            GlyphRasterizer rasterizer = GlyphRasterizers.forFont(font, fontScale, fontThickness);
            Path output = outputEncoded != null ? outputEncoded : OutputNames.encodedFor(inputImage, outputPath);

            view.showMessage("Starting encoding process...");
            EncodingParameters parameters = service.hideMessage(inputImage, textToHide, output, settings, rasterizer);
            view.showSuccess("Encoded image saved to " + output.toAbsolutePath()
                    + " (stripe period " + parameters.period() + ", " + parameters.stripeType() + ")");
            return 0;
        } catch (Exception e) {
            view.showError(e.getMessage());
            return 1;
        }
    }

    private void validateInputs() {
        if (!Files.exists(inputImage)) throw new IllegalArgumentException("Input image not found: " + inputImage);
    }
}
