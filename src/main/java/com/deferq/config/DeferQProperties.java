package com.deferq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "deferq")
public class DeferQProperties {

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final Worker worker = new Worker();
    private final Console console = new Console();

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Worker getWorker() {
        return worker;
    }

    public Console getConsole() {
        return console;
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Jobs {
        /**
         * Age after which a lock is considered stale and may be taken over.
         */
        private Duration lockTimeout = Duration.ofHours(1);

        /**
         * One-shot jobs with more attempts than this are no longer picked up.
         */
        private long maxAttempts = 25;
        private String defaultQueue = "default";

        /**
         * Zone used to apply recurring frequencies and to render dates. Empty means
         * the system default zone.
         */
        private ZoneId timeZone;
        private boolean bootstrapRecurring = true;

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }

        public long getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(long maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public String getDefaultQueue() {
            return defaultQueue;
        }

        public void setDefaultQueue(String defaultQueue) {
            this.defaultQueue = defaultQueue;
        }

        public ZoneId getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(ZoneId timeZone) {
            this.timeZone = timeZone;
        }

        public ZoneId resolveTimeZone() {
            return timeZone != null ? timeZone : ZoneId.systemDefault();
        }

        public boolean isBootstrapRecurring() {
            return bootstrapRecurring;
        }

        public void setBootstrapRecurring(boolean bootstrapRecurring) {
            this.bootstrapRecurring = bootstrapRecurring;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private String queue = "all";
        private long stopAfter = 0;
        private Duration sleepDuration = Duration.ofSeconds(3);
        /**
         * Shut the application down with a non-zero exit code when the worker
         * loop dies, so a process supervisor can restart it.
         */
        private boolean exitOnFailure = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = queue;
        }

        public long getStopAfter() {
            return stopAfter;
        }

        public void setStopAfter(long stopAfter) {
            this.stopAfter = stopAfter;
        }

        public Duration getSleepDuration() {
            return sleepDuration;
        }

        public void setSleepDuration(Duration sleepDuration) {
            this.sleepDuration = sleepDuration;
        }

        public boolean isExitOnFailure() {
            return exitOnFailure;
        }

        public void setExitOnFailure(boolean exitOnFailure) {
            this.exitOnFailure = exitOnFailure;
        }
    }

    public static class Console {
        private boolean enabled = false;
        private String username = "";
        private String password = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }
}
