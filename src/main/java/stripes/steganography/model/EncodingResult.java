package stripes.steganography.model;

/**
 * Stego pixels plus the parameters the decoder needs to regenerate the key.
 */
public record EncodingResult(GrayImage stego, EncodingParameters parameters) {
}
