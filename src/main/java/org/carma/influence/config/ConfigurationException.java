package org.carma.influence.config;

/**
 * Raised at startup when the configuration cannot drive a sweep. Fatal: nothing is
 * dispatched.
 */
public class ConfigurationException extends RuntimeException {

    private final HarnessConfigValidator.ValidationResult validation;

    public ConfigurationException(String message) {
        super(message);
        this.validation = null;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.validation = null;
    }

    public ConfigurationException(HarnessConfigValidator.ValidationResult validation) {
        super("Invalid harness configuration:\n" + validation.toDetailedString());
        this.validation = validation;
    }

    /**
     * The failed validation, when the exception came from the validator.
     */
    public HarnessConfigValidator.ValidationResult getValidation() {
        return validation;
    }
}
