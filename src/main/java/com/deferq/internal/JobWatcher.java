package com.deferq.internal;

import com.deferq.RunOutcome;
import com.deferq.RunResult;
import com.deferq.SchedulingInvariantViolationException;
import com.deferq.time.JobClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Worker loop: poll for the next due job, run it, repeat; sleep when nothing
 * is due. A watcher runs once. {@link #stop()} may be called from any thread;
 * the job in flight is allowed to finish.
 */
public class JobWatcher {

    private static final Logger log = LoggerFactory.getLogger(JobWatcher.class);

    public enum State {
        STARTING,
        POLLING,
        EXECUTING,
        STOPPING,
        STOPPED
    }

    private final EligibleJobQuery eligibleJobQuery;
    private final JobRunner jobRunner;
    private final StoreConnectionRecycler connectionRecycler;
    private final JobClock clock;

    private final Object monitor = new Object();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private State state = State.STARTING;
    private boolean started;
    private boolean stopRequested;
    private Thread sleepingThread;

    public JobWatcher(
            EligibleJobQuery eligibleJobQuery,
            JobRunner jobRunner,
            StoreConnectionRecycler connectionRecycler,
            JobClock clock) {
        this.eligibleJobQuery = eligibleJobQuery;
        this.jobRunner = jobRunner;
        this.connectionRecycler = connectionRecycler;
        this.clock = clock;
    }

    /**
     * Runs the loop on the calling thread until stopped.
     *
     * @param listener receives the started line, one line per run and the stopped line
     */
    public WatchReport watch(WatchOptions options, Consumer<String> listener) {
        synchronized (monitor) {
            if (started) {
                throw new IllegalStateException("This job watcher has already been started");
            }
            started = true;
        }

        String queue = EligibleJobQuery.normalizeQueue(options.queue());
        long executed = 0;
        RuntimeException failure = null;

        try {
            listener.accept("[Job worker (" + queue + ") started]");
            log.info("Job worker ({}) started", queue);

            while (moveTo(State.POLLING)) {
                Optional<Long> nextId = eligibleJobQuery.findNextEligible(queue);
                if (nextId.isEmpty()) {
                    pause(options.sleepDuration());
                    continue;
                }
                if (!moveTo(State.EXECUTING)) {
                    break;
                }

                RunResult result;
                try {
                    result = jobRunner.run(nextId.get());
                } finally {
                    connectionRecycler.recycle();
                }
                executed++;
                listener.accept(result.describe());

                if (options.stopAfter() > 0 && executed >= options.stopAfter()) {
                    stop();
                } else if (result.outcome() == RunOutcome.NOT_FOUND
                        || result.outcome() == RunOutcome.LOCK_CONTENTION) {
                    pause(options.sleepDuration());
                }
            }
        } catch (SchedulingInvariantViolationException e) {
            log.error("Job worker ({}) stopped because a job cannot be rescheduled", queue, e);
            failure = e;
        } finally {
            synchronized (monitor) {
                state = State.STOPPED;
            }
            stopped.countDown();
        }

        listener.accept("[Job worker (" + queue + ") stopped]");
        log.info("Job worker ({}) stopped after {} job(s)", queue, executed);
        return new WatchReport(queue, executed, failure);
    }

    /**
     * Asks the loop to stop after the current job. Wakes it up if it is sleeping.
     */
    public void stop() {
        synchronized (monitor) {
            stopRequested = true;
            if (state != State.STOPPED) {
                state = State.STOPPING;
            }
            if (sleepingThread != null) {
                sleepingThread.interrupt();
            }
        }
    }

    public State getState() {
        synchronized (monitor) {
            return state;
        }
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean moveTo(State target) {
        synchronized (monitor) {
            if (stopRequested) {
                state = State.STOPPING;
                return false;
            }
            state = target;
            return true;
        }
    }

    private void pause(Duration duration) {
        synchronized (monitor) {
            if (stopRequested) {
                return;
            }
            sleepingThread = Thread.currentThread();
        }
        boolean externallyInterrupted = false;
        try {
            clock.sleep(duration);
        } catch (InterruptedException e) {
            synchronized (monitor) {
                externallyInterrupted = !stopRequested;
            }
        } finally {
            synchronized (monitor) {
                sleepingThread = null;
                if (stopRequested) {
                    // a stop() racing with the end of the sleep may have left the flag set
                    Thread.interrupted();
                }
            }
        }
        if (externallyInterrupted) {
            log.info("Job worker interrupted, stopping");
            stop();
            Thread.currentThread().interrupt();
        }
    }
}
