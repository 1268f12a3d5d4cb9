package com.deferq.console;

import com.deferq.Job;
import com.deferq.JobArguments;
import com.deferq.JobRepository;
import com.deferq.RunOutcome;
import com.deferq.RunResult;
import com.deferq.config.DeferQProperties;
import com.deferq.internal.JobRunner;
import com.deferq.internal.JobWatcher;
import com.deferq.internal.JobWatcherFactory;
import com.deferq.internal.RecordLocker;
import com.deferq.internal.WatchOptions;
import com.deferq.internal.WatchReport;
import com.deferq.time.FrozenJobClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobCommandsTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Paris");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-06-01T12:00:00+02:00");

    private JobRepository jobRepository;
    private JobRunner jobRunner;
    private RecordLocker recordLocker;
    private JobWatcherFactory watcherFactory;
    private JobCommands commands;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        jobRunner = mock(JobRunner.class);
        recordLocker = mock(RecordLocker.class);
        watcherFactory = mock(JobWatcherFactory.class);
        FrozenJobClock clock = new FrozenJobClock(Instant.parse("2024-06-01T10:00:00Z"), ZONE);
        commands = new JobCommands(jobRepository, jobRunner, recordLocker, watcherFactory, clock,
                new DeferQProperties());
    }

    @Test
    void shouldListJobsWithStatusMarkers() {
        Job once = job(1L, "SendEmail", "");
        once.setNumberAttempts(2);
        Job recurring = job(3L, "Cleanup", "+1 hour");
        recurring.setLockedAt(NOW);
        recurring.setFailedAt(NOW);
        when(jobRepository.findAllByOrderByIdAsc()).thenReturn(List.of(once, recurring));

        CommandResponse response = commands.index();

        assertEquals(200, response.status());
        assertEquals("job#1 SendEmail at 2024-06-01 12:00:00+02:00, 2 attempts\n"
                + "job#3 Cleanup scheduled each +1 hour, next at 2024-06-01 12:00:00+02:00 (locked) (failed)",
                response.text());
    }

    @Test
    void shouldShowJobDetails() {
        Job job = job(5L, "SendEmail", "");
        job.setArguments(JobArguments.of("bob", 3, true));
        job.setNumberAttempts(1);
        when(jobRepository.findById(5L)).thenReturn(Optional.of(job));

        CommandResponse response = commands.show(5L);

        assertEquals("""
                id: 5
                name: SendEmail
                args: 'bob', 3, true
                perform: 2024-06-01 12:00:00+02:00
                attempts: 1
                queue: default
                repeat: once
                created: 2024-06-01 12:00:00+02:00
                updated: 2024-06-01 12:00:00+02:00
                failed: never""", response.text());
    }

    @Test
    void shouldShowFailureAndLock() {
        Job job = job(6L, "Cleanup", "+1 day");
        job.setLockedAt(NOW);
        job.setFailedAt(NOW);
        job.setLastError("java.lang.IllegalStateException: boom");
        when(jobRepository.findById(6L)).thenReturn(Optional.of(job));

        CommandResponse response = commands.show(6L);

        assertEquals("""
                id: 6
                name: Cleanup
                args: none
                perform: 2024-06-01 12:00:00+02:00
                attempts: 0
                queue: default
                repeat: +1 day
                created: 2024-06-01 12:00:00+02:00
                updated: 2024-06-01 12:00:00+02:00
                locked: 2024-06-01 12:00:00+02:00
                failed: 2024-06-01 12:00:00+02:00
                java.lang.IllegalStateException: boom""", response.text());
    }

    @Test
    void shouldAnswerNotFoundForMissingJob() {
        when(jobRepository.findById(9L)).thenReturn(Optional.empty());

        assertEquals(new CommandResponse(404, "Job 9 does not exist."), commands.show(9L));
        assertEquals(404, commands.unfail(9L).status());
        assertEquals(404, commands.unlock(9L).status());
    }

    @Test
    void shouldUnfailFailedJob() {
        Job job = job(2L, "SendEmail", "");
        job.setFailedAt(NOW);
        job.setLastError("boom");
        when(jobRepository.findById(2L)).thenReturn(Optional.of(job));

        CommandResponse response = commands.unfail(2L);

        assertEquals("Job 2 is no longer failing, was:\nboom", response.text());
        verify(jobRepository).unfail(2L, NOW);
    }

    @Test
    void shouldNotUnfailHealthyJob() {
        when(jobRepository.findById(2L)).thenReturn(Optional.of(job(2L, "SendEmail", "")));

        assertEquals("Job 2 has not failed.", commands.unfail(2L).text());
        verify(jobRepository, never()).unfail(any(), any());
    }

    @Test
    void shouldReleaseHeldLock() {
        Job job = job(4L, "SendEmail", "");
        job.setLockedAt(NOW);
        when(jobRepository.findById(4L)).thenReturn(Optional.of(job));
        when(recordLocker.isLocked(job)).thenReturn(true);

        assertEquals("Job 4 lock has been released.", commands.unlock(4L).text());
        verify(recordLocker).release(job);
    }

    @Test
    void shouldReportUnlockedJob() {
        Job job = job(4L, "SendEmail", "");
        when(jobRepository.findById(4L)).thenReturn(Optional.of(job));

        assertEquals("Job 4 was not locked.", commands.unlock(4L).text());
        verify(recordLocker, never()).release(any());
    }

    @Test
    void shouldMapRunOutcomesToStatus() {
        when(jobRunner.run(1L)).thenReturn(new RunResult(1L, "A", RunOutcome.DONE, Duration.ofMillis(1500)));
        when(jobRunner.run(2L)).thenReturn(new RunResult(2L, "B", RunOutcome.FAILED, Duration.ZERO));
        when(jobRunner.run(3L)).thenReturn(RunResult.notFound(3L));

        assertEquals(new CommandResponse(200, "job#1 (A): done (in 1.500 seconds)"), commands.run(1L));
        assertEquals(new CommandResponse(500, "job#2 (B): failed (in 0.000 seconds)"), commands.run(2L));
        assertEquals(new CommandResponse(404, "Job 3 does not exist."), commands.run(3L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRunWatcherWithGivenOptions() {
        JobWatcher watcher = mock(JobWatcher.class);
        WatchReport report = new WatchReport("mail", 3, null);
        Consumer<String> listener = mock(Consumer.class);
        when(watcherFactory.create()).thenReturn(watcher);
        when(watcher.watch(new WatchOptions("mail2", 3, Duration.ofSeconds(1)), listener)).thenReturn(report);

        assertSame(report, commands.watch("mail2", 3, Duration.ofSeconds(1), listener));
    }

    private static Job job(long id, String name, String frequency) {
        Job job = new Job(name, JobArguments.empty(), NOW, "default", frequency);
        job.setId(id);
        job.setCreatedAt(NOW);
        job.setUpdatedAt(NOW);
        return job;
    }
}
