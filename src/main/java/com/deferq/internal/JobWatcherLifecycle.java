package com.deferq.internal;

import com.deferq.config.DeferQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Runs a {@link JobWatcher} on a dedicated thread for the lifetime of the
 * application context. Context shutdown, including the one triggered by
 * SIGINT/SIGTERM, stops the loop and waits for the job in flight.
 * <p>
 * When the loop dies on an unrecoverable error the lifecycle stops reporting
 * itself as running and, unless {@code deferq.worker.exit-on-failure} is off,
 * the application exits with status 1.
 */
@Component
@ConditionalOnProperty(prefix = "deferq.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobWatcherLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobWatcherLifecycle.class);

    private final JobWatcherFactory watcherFactory;
    private final DeferQProperties properties;
    private final Consumer<Throwable> failureHandler;

    private final Object lifecycleMonitor = new Object();
    private JobWatcher watcher;
    private Thread thread;
    private volatile WatchReport lastReport;
    private volatile Throwable lastFailure;

    @Autowired
    public JobWatcherLifecycle(
            JobWatcherFactory watcherFactory,
            DeferQProperties properties,
            ApplicationContext applicationContext) {
        this(watcherFactory, properties, failure -> exitApplication(applicationContext, properties));
    }

    JobWatcherLifecycle(
            JobWatcherFactory watcherFactory,
            DeferQProperties properties,
            Consumer<Throwable> failureHandler) {
        this.watcherFactory = watcherFactory;
        this.properties = properties;
        this.failureHandler = failureHandler;
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (thread != null) {
                return;
            }
            WatchOptions options = WatchOptions.from(properties.getWorker());
            JobWatcher newWatcher = watcherFactory.create();
            Thread newThread = new Thread(() -> runWatcher(newWatcher, options), "deferq-worker");
            this.watcher = newWatcher;
            this.thread = newThread;
            this.lastFailure = null;
            newThread.start();
        }
    }

    private void runWatcher(JobWatcher jobWatcher, WatchOptions options) {
        Throwable failure = null;
        try {
            WatchReport report = jobWatcher.watch(options, line -> log.info("{}", line));
            lastReport = report;
            failure = report.failure();
        } catch (RuntimeException | Error e) {
            log.error("Job worker terminated by an unrecoverable error", e);
            failure = e;
        }

        boolean stopRequested;
        synchronized (lifecycleMonitor) {
            stopRequested = thread != Thread.currentThread();
            if (!stopRequested) {
                thread = null;
                watcher = null;
            }
        }
        if (failure != null) {
            lastFailure = failure;
            if (!stopRequested) {
                failureHandler.accept(failure);
            }
        }
    }

    private static void exitApplication(ApplicationContext applicationContext, DeferQProperties properties) {
        if (!properties.getWorker().isExitOnFailure()) {
            log.warn("Job worker is gone and deferq.worker.exit-on-failure is false; no jobs will run until restart");
            return;
        }
        log.error("Shutting down the application because the job worker died");
        System.exit(SpringApplication.exit(applicationContext, () -> 1));
    }

    @Override
    public void stop() {
        Thread runningThread;
        synchronized (lifecycleMonitor) {
            if (thread == null) {
                return;
            }
            watcher.stop();
            runningThread = thread;
            thread = null;
            watcher = null;
        }
        try {
            runningThread.join();
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for the job worker to finish its current job");
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        synchronized (lifecycleMonitor) {
            return thread != null;
        }
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    public WatchReport getLastReport() {
        return lastReport;
    }

    public Throwable getLastFailure() {
        return lastFailure;
    }
}
