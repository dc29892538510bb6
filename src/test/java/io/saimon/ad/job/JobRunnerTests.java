/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.job;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import io.saimon.ad.TestHelpers;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

public class JobRunnerTests {

    private List<String> runs;
    private Stats stats;
    private ScheduledJob training;
    private ScheduledJob inference;

    @Before
    public void setup() {
        runs = new ArrayList<>();
        stats = Stats.withCounters();
        training = new ScheduledJob(TrainingJob.NAME, () -> runs.add(TrainingJob.NAME), Duration.ofHours(24));
        inference = new ScheduledJob(InferenceJob.NAME, () -> runs.add(InferenceJob.NAME), Duration.ofMinutes(5));
    }

    @Test
    public void start_runsEveryJobOnceInOrder() {
        JobRunner runner = new JobRunner(Arrays.asList(training, inference), TestHelpers.fixedClock(), Duration.ofSeconds(1), stats) {
            @Override
            void sleep(Duration duration) {
                stop();
            }
        };

        runner.start();

        assertThat(runs, contains(TrainingJob.NAME, InferenceJob.NAME));
        assertFalse(runner.isRunning());
        assertEquals(TestHelpers.NOW.plus(Duration.ofHours(24)), training.getNextDueTime());
        assertEquals(TestHelpers.NOW.plus(Duration.ofMinutes(5)), inference.getNextDueTime());
    }

    @Test
    public void runDueJobs_honorsIntervals() {
        JobRunner runner = new JobRunner(Arrays.asList(training, inference), TestHelpers.fixedClock(), Duration.ofSeconds(1), stats);
        Instant now = TestHelpers.NOW;

        assertEquals(2, runner.runDueJobs(now));
        assertEquals(0, runner.runDueJobs(now.plus(Duration.ofMinutes(4))));
        assertEquals(1, runner.runDueJobs(now.plus(Duration.ofMinutes(5))));
        assertEquals(1, runner.runDueJobs(now.plus(Duration.ofMinutes(10))));
        assertEquals(2, runner.runDueJobs(now.plus(Duration.ofHours(24))));

        assertThat(
            runs,
            contains(TrainingJob.NAME, InferenceJob.NAME, InferenceJob.NAME, InferenceJob.NAME, TrainingJob.NAME, InferenceJob.NAME)
        );
    }

    @Test
    public void runDueJobs_failingJobIsRescheduled() {
        Runnable job = () -> { throw new IllegalStateException("disk full"); };
        ScheduledJob failing = new ScheduledJob(TrainingJob.NAME, job, Duration.ofHours(1));
        JobRunner runner = new JobRunner(Arrays.asList(failing, inference), TestHelpers.fixedClock(), Duration.ofSeconds(1), stats);

        assertEquals(2, runner.runDueJobs(TestHelpers.NOW));

        assertThat(runs, contains(InferenceJob.NAME));
        assertEquals(TestHelpers.NOW.plus(Duration.ofHours(1)), failing.getNextDueTime());
        assertEquals(1L, stats.getStat(StatNames.JOB_FAILURE_COUNT.getName()).getValue());
    }

    @Test
    public void start_loopRunsDueJobsOnTicks() {
        MutableClock clock = new MutableClock(TestHelpers.NOW);
        JobRunner runner = new JobRunner(Arrays.asList(training, inference), clock, Duration.ofMinutes(1), stats) {
            private int ticks;

            @Override
            void sleep(Duration duration) {
                clock.advance(duration);
                if (++ticks == 10) {
                    stop();
                }
            }
        };

        runner.start();

        assertEquals(1, runs.stream().filter(TrainingJob.NAME::equals).count());
        assertEquals(3, runs.stream().filter(InferenceJob.NAME::equals).count());
    }

    @Test
    public void start_stopsOnInterrupt() {
        JobRunner runner = new JobRunner(Arrays.asList(inference), TestHelpers.fixedClock(), Duration.ofSeconds(1), stats) {
            @Override
            void sleep(Duration duration) throws InterruptedException {
                throw new InterruptedException();
            }
        };

        runner.start();

        assertFalse(runner.isRunning());
        assertTrue(Thread.interrupted());
    }

    @Test(expected = IllegalArgumentException.class)
    public void scheduledJob_rejectsZeroInterval() {
        new ScheduledJob(InferenceJob.NAME, () -> {}, Duration.ZERO);
    }

    private static class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
