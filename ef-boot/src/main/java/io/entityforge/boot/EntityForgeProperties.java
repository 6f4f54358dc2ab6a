package io.entityforge.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Instant;

/**
 * <pre>
 * entityforge:
 *   clock:
 *     mode: artificial        # realtime | artificial
 *     start: 2025-01-01T00:00:00Z
 *   db-time: false
 * </pre>
 */
@ConfigurationProperties(prefix = "entityforge")
public class EntityForgeProperties {

    public enum ClockMode { REALTIME, ARTIFICIAL }

    private final ClockProperties clock = new ClockProperties();
    private boolean dbTime;

    public ClockProperties getClock() {
        return clock;
    }

    public boolean isDbTime() {
        return dbTime;
    }

    public void setDbTime(boolean dbTime) {
        this.dbTime = dbTime;
    }

    public static class ClockProperties {
        private ClockMode mode = ClockMode.REALTIME;
        private Instant start;

        public ClockMode getMode() {
            return mode;
        }

        public void setMode(ClockMode mode) {
            this.mode = mode;
        }

        /** Initial time of an artificial clock; defaults to the current time. */
        public Instant getStart() {
            return start;
        }

        public void setStart(Instant start) {
            this.start = start;
        }
    }
}
