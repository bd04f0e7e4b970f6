package stripes.steganography.exception;

/**
 * Base exception of the stripe steganography tool. Carries a short error code
 * so callers can tell failure kinds apart without parsing messages.
 */
public class StegoException extends RuntimeException {

    private final String errorCode;

    public StegoException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StegoException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
