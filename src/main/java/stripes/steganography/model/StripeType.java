package stripes.steganography.model;

import stripes.steganography.exception.InvalidInputException;

import java.util.Locale;

public enum StripeType {
    BINARY("binary"),
    SINUSOIDAL("sinusoidal");

    private final String wireName;

    StripeType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used on the command line and in image metadata.
     */
    public String wireName() {
        return wireName;
    }

    public static StripeType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (StripeType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidInputException("Unsupported stripe type: " + name + " (expected binary or sinusoidal)");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
