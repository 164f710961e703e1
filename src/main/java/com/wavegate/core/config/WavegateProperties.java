package com.wavegate.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Typed view of the {@code wavegate.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "wavegate")
public class WavegateProperties {

    /** Upper bound for the approval poll interval. */
    public static final Duration MAX_POLL_INTERVAL = Duration.ofSeconds(1);

    private String defaultPlan = "character-development";
    private Scheduler scheduler = new Scheduler();
    private Gate gate = new Gate();
    private Store store = new Store();
    private Stream stream = new Stream();
    private Recovery recovery = new Recovery();
    private DemoPlan demoPlan = new DemoPlan();
    private Batch batch = new Batch();

    public String getDefaultPlan() { return defaultPlan; }
    public void setDefaultPlan(String defaultPlan) { this.defaultPlan = defaultPlan; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Gate getGate() { return gate; }
    public void setGate(Gate gate) { this.gate = gate; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Stream getStream() { return stream; }
    public void setStream(Stream stream) { this.stream = stream; }
    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }
    public DemoPlan getDemoPlan() { return demoPlan; }
    public void setDemoPlan(DemoPlan demoPlan) { this.demoPlan = demoPlan; }
    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }

    public static class Scheduler {
        private int maxParallel = 4;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    }

    public static class Gate {
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration approvalTimeout;
        private RejectionPolicy rejectionPolicy = RejectionPolicy.REGENERATE;

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getApprovalTimeout() { return approvalTimeout; }
        public void setApprovalTimeout(Duration approvalTimeout) { this.approvalTimeout = approvalTimeout; }
        public RejectionPolicy getRejectionPolicy() { return rejectionPolicy; }
        public void setRejectionPolicy(RejectionPolicy rejectionPolicy) { this.rejectionPolicy = rejectionPolicy; }

        /** Poll interval clamped to {@link #MAX_POLL_INTERVAL}. */
        public Duration effectivePollInterval() {
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()
                    || pollInterval.compareTo(MAX_POLL_INTERVAL) > 0) {
                return MAX_POLL_INTERVAL;
            }
            return pollInterval;
        }
    }

    public static class Store {
        private String type = "file";
        private String path = "./wavegate-data";
        private String jdbcUrl;
        private String username;
        private String password;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getJdbcUrl() { return jdbcUrl; }
        public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    public static class Stream {
        private Duration pingInterval = Duration.ofSeconds(20);
        private int maxMissedPings = 3;
        private Duration sseTimeout = Duration.ofMinutes(30);

        public Duration getPingInterval() { return pingInterval; }
        public void setPingInterval(Duration pingInterval) { this.pingInterval = pingInterval; }
        public int getMaxMissedPings() { return maxMissedPings; }
        public void setMaxMissedPings(int maxMissedPings) { this.maxMissedPings = maxMissedPings; }
        public Duration getSseTimeout() { return sseTimeout; }
        public void setSseTimeout(Duration sseTimeout) { this.sseTimeout = sseTimeout; }
    }

    public static class Recovery {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class DemoPlan {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Batch {
        private int mediumPriorityLimit = 2;

        /** How many priority-3 entries one batch may start; higher priorities are always started. */
        public int getMediumPriorityLimit() { return mediumPriorityLimit; }
        public void setMediumPriorityLimit(int mediumPriorityLimit) { this.mediumPriorityLimit = mediumPriorityLimit; }
    }
}
