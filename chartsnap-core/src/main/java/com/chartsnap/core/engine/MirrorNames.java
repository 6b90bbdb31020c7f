package com.chartsnap.core.engine;

/**
 * Naming convention for mirrored lines.
 *
 * <p>A mirror of line {@code X} from chart {@code 42} is named {@code X_copied_42}.
 * The tag is the only thing that distinguishes a mirror from a user-authored line,
 * so any name containing it is never used as a mirroring source.</p>
 */
public final class MirrorNames {

    public static final String MIRROR_TAG = "_copied_";

    private MirrorNames() {} // Prevent instantiation

    public static String mirrorName(String sourceName, long sourceHandle) {
        return sourceName + MIRROR_TAG + sourceHandle;
    }

    public static boolean isMirror(String name) {
        return name != null && name.contains(MIRROR_TAG);
    }
}
