package com.deferq.internal;

import com.deferq.RunOutcome;
import com.deferq.RunResult;
import com.deferq.SchedulingInvariantViolationException;
import com.deferq.time.FrozenJobClock;
import com.deferq.time.JobClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobWatcherTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private EligibleJobQuery eligibleJobQuery;
    private JobRunner jobRunner;
    private StoreConnectionRecycler recycler;
    private FrozenJobClock clock;
    private final List<String> lines = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        eligibleJobQuery = mock(EligibleJobQuery.class);
        jobRunner = mock(JobRunner.class);
        recycler = mock(StoreConnectionRecycler.class);
        clock = new FrozenJobClock(NOW);
    }

    @Test
    void shouldStopAfterConfiguredNumberOfJobs() {
        when(eligibleJobQuery.findNextEligible("fetchers")).thenReturn(Optional.of(1L), Optional.of(2L));
        when(jobRunner.run(1L)).thenReturn(done(1L));
        when(jobRunner.run(2L)).thenReturn(done(2L));

        JobWatcher watcher = new JobWatcher(eligibleJobQuery, jobRunner, recycler, clock);
        WatchReport report = watcher.watch(new WatchOptions("fetchers3", 2, Duration.ofSeconds(3)), lines::add);

        assertEquals(2, report.executedJobs());
        assertEquals("fetchers", report.queue());
        assertFalse(report.isFailed());
        assertThat(lines).containsExactly(
                "[Job worker (fetchers) started]",
                "job#1 (Report): done (in 0.010 seconds)",
                "job#2 (Report): done (in 0.010 seconds)",
                "[Job worker (fetchers) stopped]");
        verify(recycler, times(2)).recycle();
        assertEquals(JobWatcher.State.STOPPED, watcher.getState());
        assertEquals(NOW, clock.now());
    }

    @Test
    void shouldSleepWhenNothingIsDue() {
        when(eligibleJobQuery.findNextEligible("all")).thenReturn(Optional.empty(), Optional.empty(), Optional.of(8L));
        when(jobRunner.run(8L)).thenReturn(done(8L));

        JobWatcher watcher = new JobWatcher(eligibleJobQuery, jobRunner, recycler, clock);
        watcher.watch(new WatchOptions("", 1, Duration.ofSeconds(3)), lines::add);

        assertEquals(NOW.plusSeconds(6), clock.now());
    }

    @Test
    void shouldSleepAfterLosingLockRace() {
        when(eligibleJobQuery.findNextEligible("all")).thenReturn(Optional.of(4L), Optional.of(5L));
        when(jobRunner.run(4L)).thenReturn(new RunResult(4L, "Report", RunOutcome.LOCK_CONTENTION, Duration.ZERO));
        when(jobRunner.run(5L)).thenReturn(done(5L));

        JobWatcher watcher = new JobWatcher(eligibleJobQuery, jobRunner, recycler, clock);
        WatchReport report = watcher.watch(new WatchOptions("all", 2, Duration.ofSeconds(2)), lines::add);

        assertEquals(2, report.executedJobs());
        assertEquals(NOW.plusSeconds(2), clock.now());
    }

    @Test
    void shouldStopOnSchedulingViolation() {
        SchedulingInvariantViolationException violation =
                new SchedulingInvariantViolationException("Nightly", "-1 day");
        when(eligibleJobQuery.findNextEligible("all")).thenReturn(Optional.of(1L));
        when(jobRunner.run(1L)).thenThrow(violation);

        JobWatcher watcher = new JobWatcher(eligibleJobQuery, jobRunner, recycler, clock);
        WatchReport report = watcher.watch(new WatchOptions("all", 0, Duration.ofSeconds(1)), lines::add);

        assertTrue(report.isFailed());
        assertSame(violation, report.failure());
        assertEquals("[Job worker (all) stopped]", lines.get(lines.size() - 1));
        verify(recycler).recycle();
    }

    @Test
    void shouldBeStoppableFromAnotherThreadWhileSleeping() throws Exception {
        when(eligibleJobQuery.findNextEligible(anyString())).thenReturn(Optional.empty());
        JobClock realSleepClock = new SleepingClock();
        JobWatcher watcher = new JobWatcher(eligibleJobQuery, jobRunner, recycler, realSleepClock);
        AtomicReference<WatchReport> report = new AtomicReference<>();
        CountDownLatch finished = new CountDownLatch(1);

        Thread thread = new Thread(() -> {
            report.set(watcher.watch(new WatchOptions("all", 0, Duration.ofMinutes(10)), lines::add));
            finished.countDown();
        });
        thread.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> watcher.getState() == JobWatcher.State.POLLING);
        watcher.stop();

        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertTrue(watcher.awaitStopped(Duration.ofSeconds(1)));
        assertEquals(0, report.get().executedJobs());
        assertEquals(JobWatcher.State.STOPPED, watcher.getState());
    }

    @Test
    void shouldOnlyWatchOnce() {
        when(eligibleJobQuery.findNextEligible("all")).thenReturn(Optional.of(1L));
        when(jobRunner.run(1L)).thenReturn(done(1L));
        JobWatcher watcher = new JobWatcher(eligibleJobQuery, jobRunner, recycler, clock);
        WatchOptions options = new WatchOptions("all", 1, Duration.ofSeconds(1));
        watcher.watch(options, lines::add);

        assertThatThrownBy(() -> watcher.watch(options, lines::add)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldValidateOptions() {
        assertThatThrownBy(() -> new WatchOptions("all", -1, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WatchOptions("all", 0, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertEquals("all", new WatchOptions(null, 0, Duration.ZERO).queue());
    }

    private static RunResult done(long id) {
        return new RunResult(id, "Report", RunOutcome.DONE, Duration.ofMillis(10));
    }

    private static final class SleepingClock implements JobClock {
        @Override
        public OffsetDateTime now() {
            return OffsetDateTime.now(ZoneOffset.UTC);
        }

        @Override
        public ZoneId zone() {
            return ZoneOffset.UTC;
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            Thread.sleep(duration.toMillis());
        }
    }
}
