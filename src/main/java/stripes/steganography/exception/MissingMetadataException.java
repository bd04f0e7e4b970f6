package stripes.steganography.exception;

/**
 * Decoding was requested without usable encoding parameters (stripe period and type).
 */
public class MissingMetadataException extends StegoException {

    public MissingMetadataException(String message) {
        super("MISSING_METADATA", message);
    }

    public MissingMetadataException(String message, Throwable cause) {
        super("MISSING_METADATA", message, cause);
    }
}
