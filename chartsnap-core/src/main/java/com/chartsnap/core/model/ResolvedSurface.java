package com.chartsnap.core.model;

/**
 * Result of resolving a surface: the surface and whether it was opened by the current cycle.
 */
public record ResolvedSurface(Surface surface, boolean createdNow) {
}
