package stripes.steganography.controller;

import stripes.steganography.model.SteganographyService;
import stripes.steganography.view.SteganographyView;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "decode", description = "Reveal the text hidden in an encoded image.")
public class DecodeController implements Callable<Integer> {

    private final SteganographyService service;
    private final SteganographyView view;

    public DecodeController(SteganographyService service, SteganographyView view) {
        this.service = service;
        this.view = view;
    }

    @Option(names = "--input-encoded", required = true, description = "Encoded PNG produced by the encode command.")
    private Path inputEncoded;

    @Option(names = "--output-decoded", description = "Output PNG (default: <output-path>/<input name>-decoded.png).")
    private Path outputDecoded;

    @Option(names = "--output-path", defaultValue = ".", description = "Directory for the default output name (default: ${DEFAULT-VALUE}).")
    private Path outputPath;

    @Override
    public Integer call() {
        try {
            validateInputs();
            Path output = outputDecoded != null ? outputDecoded : OutputNames.decodedFor(inputEncoded, outputPath);
            view.showMessage("Starting decoding process...");
            service.revealMessage(inputEncoded, output);
            view.showSuccess("Decoded image saved to " + output.toAbsolutePath());
            return 0;
        } catch (Exception e) {
            view.showError(e.getMessage());
            return 1;
        }
    }

    private void validateInputs() {
        if (!Files.exists(inputEncoded)) throw new IllegalArgumentException("Encoded image not found: " + inputEncoded);
    }
}
