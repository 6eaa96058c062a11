package com.ttennebkram.imagelab;

/**
 * A parameter is malformed or out of range.
 * Raised before any session state is touched.
 */
public class ValidationException extends ImageLabException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
