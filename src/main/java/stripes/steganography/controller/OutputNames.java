package stripes.steganography.controller;

import java.nio.file.Path;

/**
 * Default output file names: {@code <stem>-encoded.png} and {@code <stem>-decoded.png}.
 */
final class OutputNames {

    static final String ENCODED_SUFFIX = "-encoded";
    static final String DECODED_SUFFIX = "-decoded";
    private static final String PNG_EXTENSION = ".png";

    private OutputNames() {
    }

    static Path encodedFor(Path input, Path outputDir) {
        return outputDir.resolve(stem(input) + ENCODED_SUFFIX + PNG_EXTENSION);
    }

    static Path decodedFor(Path encoded, Path outputDir) {
        String stem = stem(encoded);
        if (stem.endsWith(ENCODED_SUFFIX)) {
            stem = stem.substring(0, stem.length() - ENCODED_SUFFIX.length());
        }
        return outputDir.resolve(stem + DECODED_SUFFIX + PNG_EXTENSION);
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(0, dotIndex) : name;
    }
}
