package com.hotelhub.common.exception;

/**
 * Malformed or out-of-range input that passed bean validation but breaks a domain rule
 * (dates in the wrong order, too many guests, unknown offer).
 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
