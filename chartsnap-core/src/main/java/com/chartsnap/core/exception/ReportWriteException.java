package com.chartsnap.core.exception;

/**
 * The completion descriptor could not be written.
 */
public class ReportWriteException extends SnapException {

    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
