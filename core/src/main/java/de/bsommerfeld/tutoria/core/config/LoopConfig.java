package de.bsommerfeld.tutoria.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Timing for the background database loop. Values are persisted in
 * config.toml; setters only exist for the config mapper and tests.
 */
public class LoopConfig {

    @JsonProperty("startup-timeout-millis")
    private long startupTimeoutMillis = 5_000;

    @JsonProperty("shutdown-timeout-millis")
    private long shutdownTimeoutMillis = 2_000;

    @JsonProperty("thread-name")
    private String threadName = "tutoria-db-loop";

    public long getStartupTimeoutMillis() {
        return startupTimeoutMillis;
    }

    public void setStartupTimeoutMillis(long startupTimeoutMillis) {
        this.startupTimeoutMillis = startupTimeoutMillis;
    }

    public long getShutdownTimeoutMillis() {
        return shutdownTimeoutMillis;
    }

    public void setShutdownTimeoutMillis(long shutdownTimeoutMillis) {
        this.shutdownTimeoutMillis = shutdownTimeoutMillis;
    }

    public String getThreadName() {
        return threadName;
    }

    public void setThreadName(String threadName) {
        this.threadName = threadName;
    }

    public Duration startupTimeout() {
        return Duration.ofMillis(startupTimeoutMillis);
    }

    public Duration shutdownTimeout() {
        return Duration.ofMillis(shutdownTimeoutMillis);
    }
}
