/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.job;

import java.time.Duration;
import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.google.common.base.Preconditions;

/**
 * A periodic job with its next due time.
 */
public class ScheduledJob {
    private final String name;
    private final Runnable job;
    private final Duration interval;
    private Instant nextDueTime;

    public ScheduledJob(String name, Runnable job, Duration interval) {
        Preconditions.checkArgument(!interval.isNegative() && !interval.isZero(), "Interval of %s must be positive", name);
        this.name = name;
        this.job = job;
        this.interval = interval;
        this.nextDueTime = Instant.MIN;
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    public Instant getNextDueTime() {
        return nextDueTime;
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(nextDueTime);
    }

    /**
     * Runs the job and schedules the next run one interval after the given time. Slots missed
     * while the job ran are not made up.
     *
     * @param now time the run started
     */
    void run(Instant now) {
        try {
            job.run();
        } finally {
            nextDueTime = now.plus(interval);
        }
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("name", name).append("interval", interval).append("nextDueTime", nextDueTime).toString();
    }
}
