package com.chartsnap.core.exception;

import com.chartsnap.core.model.Timeframe;

/**
 * No chart could be found or opened for a symbol/timeframe.
 */
public class SurfaceUnavailableException extends SnapException {

    private final Timeframe timeframe;
    private final int errorCode;

    public SurfaceUnavailableException(String message, Timeframe timeframe, int errorCode, Throwable cause) {
        super(message, cause);
        this.timeframe = timeframe;
        this.errorCode = errorCode;
    }

    public Timeframe getTimeframe() {
        return timeframe;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
