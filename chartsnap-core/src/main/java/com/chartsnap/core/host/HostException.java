package com.chartsnap.core.host;

/**
 * Failure reported by the charting host, carrying the host's error code.
 */
public class HostException extends Exception {

    public static final int CHART_WRONG_ID = 4101;
    public static final int CHART_NOT_FOUND = 4103;
    public static final int CHART_CANNOT_OPEN = 4105;
    public static final int CHART_SCREENSHOT_FAILED = 4110;
    public static final int OBJECT_ALREADY_EXISTS = 4200;
    public static final int OBJECT_NOT_FOUND = 4202;

    private final int errorCode;

    public HostException(int errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public HostException(int errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
