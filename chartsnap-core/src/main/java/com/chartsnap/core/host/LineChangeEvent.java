package com.chartsnap.core.host;

/**
 * Notification that a horizontal line was changed on a chart.
 */
public record LineChangeEvent(
    Type type,
    long handle,
    String name
) {
    public enum Type {
        CREATE,
        DELETE,
        MOVE,
        MODIFY
    }
}
