package app.qbank.core.error;

/**
 * Raised while building engine settings from values that can never produce a valid schedule or rating.
 * Not meant to be caught: a context with such settings should not start.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public static void require(boolean condition, String message) {
        if (!condition) throw new InvalidConfigurationException(message);
    }

    public static double requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new InvalidConfigurationException(name + " must be finite, got " + value);
        }
        return value;
    }
}
