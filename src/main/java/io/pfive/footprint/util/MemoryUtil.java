// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.util;

/// Helpers for the memory estimate messages logged before large buffers are allocated.
public abstract class MemoryUtil {

    private static final double KILO = 1024;
    private static final double MEGA = KILO * KILO;
    private static final double GIGA = MEGA * KILO;

    public static String memString (double bytes) {
        if (bytes >= GIGA) return String.format("%.1f GiB", bytes / GIGA);
        if (bytes >= MEGA) return String.format("%.1f MiB", bytes / MEGA);
        if (bytes >= KILO) return String.format("%.1f kiB", bytes / KILO);
        return (long) bytes + " bytes";
    }

    /// Bytes the JVM could still allocate before reaching its maximum heap size.
    public static long availableHeapBytes () {
        Runtime jvm = Runtime.getRuntime();
        return jvm.maxMemory() - (jvm.totalMemory() - jvm.freeMemory());
    }

}
