package org.boc;

/**
 * Base class for every error raised by the BOC front-end and its numeric subsystems.
 */
public class BocException extends RuntimeException {

    public BocException(String message) {
        super(message);
    }

    public BocException(String message, Throwable cause) {
        super(message, cause);
    }
}
