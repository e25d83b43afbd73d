// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.LinkedHashMap;
import java.util.Map;

/// Groups together timings for the successive stages of one computation. Only one stage runs at a
/// time; starting a stage stops the previous one. Not threadsafe, create one per computation.
public class StageTimer {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final String name;
    private final long startTime = System.currentTimeMillis();
    private final Map<String, Long> stageMillis = new LinkedHashMap<>();

    private String currentStage = null;
    private long currentStart;

    /// Auto-starts when created.
    public StageTimer (String name) {
        this.name = name;
    }

    public void start (String stage) {
        stopCurrent();
        currentStage = stage;
        currentStart = System.currentTimeMillis();
    }

    private void stopCurrent () {
        if (currentStage == null) return;
        stageMillis.merge(currentStage, System.currentTimeMillis() - currentStart, Long::sum);
        currentStage = null;
    }

    public long getElapsedMillis () {
        return System.currentTimeMillis() - startTime;
    }

    public String getElapsedString () {
        return String.format("%5.3f sec", getElapsedMillis() / 1000.0D);
    }

    /// Stop the current stage and log all stage times.
    public void done () {
        stopCurrent();
        if (LOG.isDebugEnabled()) {
            StringBuilder sb = new StringBuilder();
            stageMillis.forEach((stage, msec) -> sb.append(String.format("%n  %-24s %6d msec", stage, msec)));
            LOG.debug("{} took {}:{}", name, getElapsedString(), sb);
        }
    }

    public Map<String, Long> stageMillis () {
        return Map.copyOf(stageMillis);
    }

}
