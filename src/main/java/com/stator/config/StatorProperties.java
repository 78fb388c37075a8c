package com.stator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "stator")
public class StatorProperties {

    private final Database database = new Database();
    private final Runner runner = new Runner();

    public Database getDatabase() {
        return database;
    }

    public Runner getRunner() {
        return runner;
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

    public static class Runner {
        private boolean enabled = true;
        private int concurrency = 100;
        private int concurrencyPerType = 40;
        private Duration leaseDuration = Duration.ofMinutes(5);
        private long scheduleIntervalInSeconds = 30;
        private Duration minimumLoopDelay = Duration.ofMillis(500);
        private Duration maximumLoopDelay = Duration.ofSeconds(5);
        private Duration shutdownGracePeriod = Duration.ofSeconds(30);
        private Path livenessFile;
        private boolean handleSignals = false;
        private boolean watchdogEnabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getConcurrencyPerType() {
            return concurrencyPerType;
        }

        public void setConcurrencyPerType(int concurrencyPerType) {
            this.concurrencyPerType = concurrencyPerType;
        }

        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        public long getScheduleIntervalInSeconds() {
            return scheduleIntervalInSeconds;
        }

        public void setScheduleIntervalInSeconds(long scheduleIntervalInSeconds) {
            this.scheduleIntervalInSeconds = scheduleIntervalInSeconds;
        }

        public Duration getMinimumLoopDelay() {
            return minimumLoopDelay;
        }

        public void setMinimumLoopDelay(Duration minimumLoopDelay) {
            this.minimumLoopDelay = minimumLoopDelay;
        }

        public Duration getMaximumLoopDelay() {
            return maximumLoopDelay;
        }

        public void setMaximumLoopDelay(Duration maximumLoopDelay) {
            this.maximumLoopDelay = maximumLoopDelay;
        }

        public Duration getShutdownGracePeriod() {
            return shutdownGracePeriod;
        }

        public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
        }

        public Path getLivenessFile() {
            return livenessFile;
        }

        public void setLivenessFile(Path livenessFile) {
            this.livenessFile = livenessFile;
        }

        public boolean isHandleSignals() {
            return handleSignals;
        }

        public void setHandleSignals(boolean handleSignals) {
            this.handleSignals = handleSignals;
        }

        public boolean isWatchdogEnabled() {
            return watchdogEnabled;
        }

        public void setWatchdogEnabled(boolean watchdogEnabled) {
            this.watchdogEnabled = watchdogEnabled;
        }
    }
}
