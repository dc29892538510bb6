/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;

import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

import com.google.common.collect.ImmutableList;

/**
 * Single threaded control loop over a fixed list of jobs.
 *
 * Every job runs once at start, in list order. Afterwards, on each tick, every due job runs in
 * list order and is rescheduled one interval after the tick. A failing job is logged and
 * rescheduled like a successful one.
 */
public class JobRunner {
    private static final Logger logger = LogManager.getLogger(JobRunner.class);

    private final List<ScheduledJob> jobs;
    private final Clock clock;
    private final Duration tickInterval;
    private final Stats stats;
    private volatile boolean running;

    public JobRunner(List<ScheduledJob> jobs, Clock clock, Duration tickInterval, Stats stats) {
        this.jobs = ImmutableList.copyOf(jobs);
        this.clock = clock;
        this.tickInterval = tickInterval;
        this.stats = stats;
    }

    /**
     * Runs the loop on the calling thread until {@link #stop()} is called or the thread is interrupted.
     */
    public void start() {
        running = true;
        logger.info("Starting job runner with jobs {}", jobs);
        for (ScheduledJob job : jobs) {
            if (!running) {
                return;
            }
            runJob(job, clock.instant());
        }
        while (running) {
            try {
                sleep(tickInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Job runner interrupted");
                running = false;
                break;
            }
            runDueJobs(clock.instant());
        }
        logger.info("Job runner stopped");
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public List<ScheduledJob> getJobs() {
        return jobs;
    }

    /**
     * Runs every job due at the given time, in list order.
     *
     * @param now current time
     * @return number of jobs run
     */
    int runDueJobs(Instant now) {
        int ran = 0;
        for (ScheduledJob job : jobs) {
            if (job.isDue(now)) {
                runJob(job, now);
                ran++;
            }
        }
        return ran;
    }

    void sleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }

    private void runJob(ScheduledJob job, Instant now) {
        logger.debug("Running job {}", job.getName());
        try {
            job.run(now);
        } catch (Exception e) {
            stats.increment(StatNames.JOB_FAILURE_COUNT);
            logger.error(new ParameterizedMessage("Job {} failed", job.getName()), e);
        }
    }
}
