package dateparserjava;

/**
 * Raised when a language configuration cannot be used: an unparsable simplification
 * pattern, an unknown sentence splitter group, or name lists of the wrong arity.
 *
 * <p>These errors are permanent until the configuration is fixed and are reported
 * at the point the faulty piece is first needed.</p>
 */
public class LanguageConfigurationException extends RuntimeException {

    public LanguageConfigurationException(String message) {
        super(message);
    }

    public LanguageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
