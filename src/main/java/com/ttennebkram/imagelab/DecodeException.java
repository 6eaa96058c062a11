package com.ttennebkram.imagelab;

/**
 * Input bytes could not be decoded into an image.
 * Reported as a validation-class failure.
 */
public class DecodeException extends ValidationException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
