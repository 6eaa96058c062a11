package com.ttennebkram.imagelab;

/**
 * Base class for every failure the engine reports to its caller.
 * All failures are terminal for the request that raised them; nothing is retried.
 */
public class ImageLabException extends RuntimeException {

    public ImageLabException(String message) {
        super(message);
    }

    public ImageLabException(String message, Throwable cause) {
        super(message, cause);
    }
}
