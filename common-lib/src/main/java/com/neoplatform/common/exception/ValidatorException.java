package com.neoplatform.common.exception;

/**
 * Expected fault raised from inside a validator's own logic.
 *
 * <p>The stage supervisor contains this exception and converts it into a synthetic
 * critical report scoped to the failing validator.
 */
public class ValidatorException extends RuntimeException {
    private final String validatorName;
    private final String reason;

    public ValidatorException(String validatorName, String reason) {
        super("[" + validatorName + "] " + reason);
        this.validatorName = validatorName;
        this.reason = reason;
    }

    public ValidatorException(String validatorName, String reason, Throwable cause) {
        super("[" + validatorName + "] " + reason, cause);
        this.validatorName = validatorName;
        this.reason = reason;
    }

    public String getValidatorName() {
        return validatorName;
    }

    /** The failure description without the validator prefix. */
    public String getReason() {
        return reason;
    }
}
