package stripes.steganography.model;

import stripes.steganography.model.text.GlyphRasterizer;

import java.io.IOException;
import java.nio.file.Path;

public interface SteganographyService {

    /**
     * Hides a text message inside an image and writes the stego PNG.
     * @param coverFile Carrier image (any readable raster, converted to grayscale).
     * @param message Text to hide.
     * @param outputFile Output PNG file.
     * @param settings Encoding settings (period, stripe type, amplitude, etc).
     * @param rasterizer Glyph backend used to draw the message.
     * @return Parameters stored in the output file's metadata.
     * @throws IOException if a file cannot be read or written.
     */
    EncodingParameters hideMessage(Path coverFile, String message, Path outputFile,
                                   EncodeSettings settings, GlyphRasterizer rasterizer) throws IOException;

    /**
     * Reveals the message hidden in a stego PNG.
     * @param stegoFile PNG produced by {@link #hideMessage}.
     * @param outputFile File to save the revealed image.
     * @throws IOException if a file cannot be read or written.
     * @throws stripes.steganography.exception.MissingMetadataException if the stego file
     *         carries no usable encoding parameters.
     */
    void revealMessage(Path stegoFile, Path outputFile) throws IOException;
}
