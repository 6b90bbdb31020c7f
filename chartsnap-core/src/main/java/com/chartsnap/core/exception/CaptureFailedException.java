package com.chartsnap.core.exception;

/**
 * The redraw or capture of a resolved chart failed.
 */
public class CaptureFailedException extends SnapException {

    private final int errorCode;

    public CaptureFailedException(String message, int errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
