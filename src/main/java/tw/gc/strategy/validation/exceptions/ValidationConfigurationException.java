package tw.gc.strategy.validation.exceptions;

/**
 * Raised when the geometry or sizing of a validation run is unusable, before any
 * resampling or training work starts.
 */
public class ValidationConfigurationException extends IllegalArgumentException {

    public ValidationConfigurationException(String message) {
        super(message);
    }
}
