// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.background;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/// Stores progress information, occasionally writing it to the log. Log lines are throttled both
/// by step count and by elapsed time, so a computation with thousands of tiny steps does not
/// flood the log.
public class ProgressSink implements ProgressListener {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    // Parameters affecting the maximum number and frequency of log messages for a single task.
    private static final int DEFAULT_MAX_EVENTS = 10;
    private static final int DEFAULT_MIN_MSEC = 1000;

    private final String id;

    // Tracking current state of the task.
    private String title = "UNKNOWN";
    private int totalSteps = 1;
    private int stepsCompleted = 0;
    private long startTime;

    // Variables used in throttling log messages.
    private int prevLogStep = 0;
    private int logAfter = 0;
    private long lastLogTime = 0;
    private int msecBetweenEvents = DEFAULT_MIN_MSEC;

    public ProgressSink (String id) {
        this.id = id;
    }

    public void minTimeBetweenEventsMsec (int msec) {
        this.msecBetweenEvents = msec;
    }

    @Override
    public synchronized void beginTask (String title, int totalSteps) {
        this.title = title;
        this.totalSteps = Math.max(totalSteps, 1);
        this.stepsCompleted = 0;
        this.startTime = System.currentTimeMillis();
        this.lastLogTime = startTime;
        this.logAfter = this.totalSteps / DEFAULT_MAX_EVENTS;
        this.prevLogStep = 0;
        LOG.debug("[{}] {}: {} steps.", id, title, totalSteps);
    }

    /// Threadsafe: This may be called by many workers at once.
    @Override
    public synchronized void increment (int n) {
        if (stepsCompleted >= totalSteps) return;
        stepsCompleted += n;
        long currTime = System.currentTimeMillis();
        if (stepsCompleted >= totalSteps) {
            LOG.debug("[{}] {}: done in {} msec.", id, title, currTime - startTime);
        } else if (stepsCompleted >= prevLogStep + logAfter && currTime - lastLogTime >= msecBetweenEvents) {
            LOG.info("[{}] {}: {}/{} steps, about {} sec remaining.",
                  id, title, stepsCompleted, totalSteps, estimateRemainingSeconds(currTime));
            prevLogStep = stepsCompleted;
            lastLogTime = currTime;
        }
    }

    private int estimateRemainingSeconds (long currentTime) {
        double activeTimeSeconds = (currentTime - this.startTime) / 1000.0;
        double stepsRemaining = totalSteps - stepsCompleted;
        return (int) (activeTimeSeconds * stepsRemaining / stepsCompleted);
    }

    public synchronized int stepsCompleted () {
        return stepsCompleted;
    }

    public synchronized boolean isComplete () {
        return stepsCompleted >= totalSteps;
    }

}
