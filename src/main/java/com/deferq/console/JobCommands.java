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
import com.deferq.time.JobClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Operator commands: watch, run, index, show, unfail and unlock.
 */
@Service
public class JobCommands {

    private static final Logger log = LoggerFactory.getLogger(JobCommands.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

    private final JobRepository jobRepository;
    private final JobRunner jobRunner;
    private final RecordLocker recordLocker;
    private final JobWatcherFactory watcherFactory;
    private final JobClock clock;
    private final DeferQProperties properties;

    public JobCommands(
            JobRepository jobRepository,
            JobRunner jobRunner,
            RecordLocker recordLocker,
            JobWatcherFactory watcherFactory,
            JobClock clock,
            DeferQProperties properties) {
        this.jobRepository = jobRepository;
        this.jobRunner = jobRunner;
        this.recordLocker = recordLocker;
        this.watcherFactory = watcherFactory;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Runs a worker loop on the calling thread until {@code stopAfter} jobs were
     * executed or the JVM receives SIGINT/SIGTERM.
     */
    public WatchReport watch(String queue, long stopAfter, Duration sleepDuration, Consumer<String> listener) {
        JobWatcher watcher = watcherFactory.create();
        Duration waitForJob = properties.getJobs().getLockTimeout();
        Thread shutdownHook = new Thread(() -> {
            watcher.stop();
            try {
                watcher.awaitStopped(waitForJob);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "deferq-watch-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            return watcher.watch(new WatchOptions(queue, stopAfter, sleepDuration), listener);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException shutdownInProgress) {
                log.debug("JVM is shutting down, watch shutdown hook stays registered");
            }
        }
    }

    /**
     * Runs the job now, whatever its scheduled time.
     */
    public CommandResponse run(long id) {
        RunResult result = jobRunner.run(id);
        if (result.outcome() == RunOutcome.NOT_FOUND) {
            return CommandResponse.notFound(id);
        }
        return new CommandResponse(result.isOk() ? 200 : 500, result.describe());
    }

    public CommandResponse index() {
        List<String> lines = new ArrayList<>();
        for (Job job : jobRepository.findAllByOrderByIdAsc()) {
            StringBuilder line = new StringBuilder("job#").append(job.getId()).append(' ').append(job.getName());
            String performAt = format(job.getPerformAt());
            if (job.isRecurring()) {
                line.append(" scheduled each ").append(job.getFrequency()).append(", next at ").append(performAt);
            } else {
                line.append(" at ").append(performAt).append(", ").append(job.getNumberAttempts()).append(" attempts");
            }
            if (job.getLockedAt() != null) {
                line.append(" (locked)");
            }
            if (job.hasFailed()) {
                line.append(" (failed)");
            }
            lines.add(line.toString());
        }
        return CommandResponse.ok(String.join("\n", lines));
    }

    public CommandResponse show(long id) {
        Optional<Job> found = jobRepository.findById(id);
        if (found.isEmpty()) {
            return CommandResponse.notFound(id);
        }
        Job job = found.get();
        JobArguments arguments = job.getArguments();

        StringBuilder text = new StringBuilder();
        text.append("id: ").append(job.getId());
        text.append("\nname: ").append(job.getName());
        text.append("\nargs: ").append(arguments.render());
        text.append("\nperform: ").append(format(job.getPerformAt()));
        text.append("\nattempts: ").append(job.getNumberAttempts());
        text.append("\nqueue: ").append(job.getQueue());
        text.append("\nrepeat: ").append(job.isRecurring() ? job.getFrequency() : "once");
        text.append("\ncreated: ").append(format(job.getCreatedAt()));
        text.append("\nupdated: ").append(format(job.getUpdatedAt()));
        if (job.getLockedAt() != null) {
            text.append("\nlocked: ").append(format(job.getLockedAt()));
        }
        if (job.hasFailed()) {
            text.append("\nfailed: ").append(format(job.getFailedAt()));
            text.append('\n').append(job.getLastError());
        } else {
            text.append("\nfailed: never");
        }
        return CommandResponse.ok(text.toString());
    }

    /**
     * Clears the error of a failed job without running it.
     */
    public CommandResponse unfail(long id) {
        Optional<Job> found = jobRepository.findById(id);
        if (found.isEmpty()) {
            return CommandResponse.notFound(id);
        }
        Job job = found.get();
        if (!job.hasFailed()) {
            return CommandResponse.ok("Job " + id + " has not failed.");
        }
        jobRepository.unfail(id, clock.now());
        return CommandResponse.ok("Job " + id + " is no longer failing, was:\n" + job.getLastError());
    }

    /**
     * Releases the lock of a job, e.g. after its worker crashed.
     */
    public CommandResponse unlock(long id) {
        Optional<Job> found = jobRepository.findById(id);
        if (found.isEmpty()) {
            return CommandResponse.notFound(id);
        }
        Job job = found.get();
        if (!recordLocker.isLocked(job)) {
            return CommandResponse.ok("Job " + id + " was not locked.");
        }
        recordLocker.release(job);
        return CommandResponse.ok("Job " + id + " lock has been released.");
    }

    private String format(OffsetDateTime dateTime) {
        return dateTime.atZoneSameInstant(clock.zone()).format(DATE_FORMAT);
    }
}
