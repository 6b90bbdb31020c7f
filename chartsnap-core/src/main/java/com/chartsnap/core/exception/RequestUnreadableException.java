package com.chartsnap.core.exception;

/**
 * The capture request marker exists but could not be read.
 */
public class RequestUnreadableException extends SnapException {

    public RequestUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
