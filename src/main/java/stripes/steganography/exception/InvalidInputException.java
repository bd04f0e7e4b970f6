package stripes.steganography.exception;

/**
 * Rejected argument: non-positive dimensions, unknown stripe type, out of range settings.
 */
public class InvalidInputException extends StegoException {

    public InvalidInputException(String message) {
        super("INVALID_INPUT", message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super("INVALID_INPUT", message, cause);
    }
}
