// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StageTimerTest {

    @Test
    void recordsStagesInOrder () {
        StageTimer timer = new StageTimer("test");
        timer.start("Preprocessing");
        timer.start("Scatter");
        timer.start("Preprocessing");
        timer.done();
        assertThat(timer.stageMillis()).containsOnlyKeys("Preprocessing", "Scatter");
        assertThat(timer.stageMillis().values()).allSatisfy(msec -> assertThat(msec).isNotNegative());
        assertThat(timer.getElapsedMillis()).isNotNegative();
        assertThat(timer.getElapsedString()).endsWith("sec");
    }

    @Test
    void formatsMemorySizes () {
        assertThat(MemoryUtil.memString(512)).isEqualTo("512 bytes");
        assertThat(MemoryUtil.memString(2048)).isEqualTo("2.0 kiB");
        assertThat(MemoryUtil.memString(3 * 1024 * 1024)).isEqualTo("3.0 MiB");
        assertThat(MemoryUtil.memString(1.5 * 1024 * 1024 * 1024)).isEqualTo("1.5 GiB");
        assertThat(MemoryUtil.availableHeapBytes()).isPositive();
    }

}
