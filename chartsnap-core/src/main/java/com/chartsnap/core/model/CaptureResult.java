package com.chartsnap.core.model;

import java.nio.file.Path;

/**
 * Outcome of one timeframe within a capture cycle.
 *
 * @param timeframe     timeframe attempted
 * @param success       true if an image was written
 * @param artifact      image path, or null when the capture did not happen
 * @param mirroredCount number of lines mirrored onto the chart before capture
 * @param errorCode     host error code of the failure, 0 on success
 * @param failure       short failure description, null on success
 */
public record CaptureResult(
    Timeframe timeframe,
    boolean success,
    Path artifact,
    int mirroredCount,
    int errorCode,
    String failure
) {
    public static CaptureResult captured(Timeframe timeframe, Path artifact, int mirroredCount) {
        return new CaptureResult(timeframe, true, artifact, mirroredCount, 0, null);
    }

    public static CaptureResult failed(Timeframe timeframe, int mirroredCount, int errorCode, String failure) {
        return new CaptureResult(timeframe, false, null, mirroredCount, errorCode, failure);
    }
}
