package com.chartsnap.core.exception;

/**
 * Base class for capture cycle failures.
 */
public class SnapException extends Exception {

    public SnapException(String message) {
        super(message);
    }

    public SnapException(String message, Throwable cause) {
        super(message, cause);
    }
}
