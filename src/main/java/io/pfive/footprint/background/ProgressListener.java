// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.background;

/// Receives progress reports from a long-running computation. Implementations must tolerate calls
/// to increment() from several threads at once.
public interface ProgressListener {

    void beginTask (String title, int totalSteps);

    void increment (int n);

    default void increment () {
        increment(1);
    }

    /// Discards all progress reports.
    ProgressListener NONE = new ProgressListener() {
        @Override public void beginTask (String title, int totalSteps) { }
        @Override public void increment (int n) { }
    };
}
