package com.example.leads.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "leads")
public class LeadConsoleProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Escalation escalation = new Escalation();

    @NestedConfigurationProperty
    private final Housekeeping housekeeping = new Housekeeping();

    @NestedConfigurationProperty
    private final SocketIo socketio = new SocketIo();

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public Housekeeping getHousekeeping() {
        return housekeeping;
    }

    public SocketIo getSocketio() {
        return socketio;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys and topics owned by the console.
         */
        private String keyPrefix = "leads";

        /**
         * Upper bound for waiting on a session transition lock.
         */
        private Duration lockWait = Duration.ofSeconds(5);

        /**
         * Lease of a session transition lock, released automatically if the holder dies.
         */
        private Duration lockLease = Duration.ofSeconds(30);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getLockWait() {
            return lockWait;
        }

        public void setLockWait(Duration lockWait) {
            this.lockWait = lockWait;
        }

        public Duration getLockLease() {
            return lockLease;
        }

        public void setLockLease(Duration lockLease) {
            this.lockLease = lockLease;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic receiving escalation and deletion lifecycle events.
         */
        private String lifecycleTopic = "leads.lifecycle";

        public String getLifecycleTopic() {
            return lifecycleTopic;
        }

        public void setLifecycleTopic(String lifecycleTopic) {
            this.lifecycleTopic = lifecycleTopic;
        }
    }

    @Validated
    public static class Escalation {

        public static final int MAX_AUTO_RELEASE_HOURS = 168;

        /**
         * Reason recorded when an operator escalates without giving one.
         */
        @NotBlank
        private String defaultReason = "Manual escalation from console";

        /**
         * Auto-release window used for organizations without a stored configuration.
         */
        @Min(0)
        @Max(MAX_AUTO_RELEASE_HOURS)
        private int defaultAutoReleaseHours = 24;

        /**
         * Refresh interval of the countdown shown for the selected escalated conversation.
         */
        private Duration countdownInterval = Duration.ofSeconds(1);

        /**
         * Release expired escalations from the housekeeping job even when no console observes them.
         */
        private boolean enforceAutoRelease = false;

        public String getDefaultReason() {
            return defaultReason;
        }

        public void setDefaultReason(String defaultReason) {
            this.defaultReason = defaultReason;
        }

        public int getDefaultAutoReleaseHours() {
            return defaultAutoReleaseHours;
        }

        public void setDefaultAutoReleaseHours(int defaultAutoReleaseHours) {
            this.defaultAutoReleaseHours = defaultAutoReleaseHours;
        }

        public Duration getCountdownInterval() {
            return countdownInterval;
        }

        public void setCountdownInterval(Duration countdownInterval) {
            this.countdownInterval = countdownInterval;
        }

        public boolean isEnforceAutoRelease() {
            return enforceAutoRelease;
        }

        public void setEnforceAutoRelease(boolean enforceAutoRelease) {
            this.enforceAutoRelease = enforceAutoRelease;
        }
    }

    @Validated
    public static class Housekeeping {

        /**
         * Interval between automatic housekeeping cycles.
         */
        private Duration interval = Duration.ofMinutes(1);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    @Validated
    public static class SocketIo {

        private boolean enabled = true;

        @NotBlank
        private String host = "0.0.0.0";

        @Min(1)
        @Max(65535)
        private int port = 9095;

        /**
         * Origin allowed to open the lead view socket.
         */
        @NotBlank
        private String origin = "*";

        /**
         * Heartbeat of an open lead view. A console missing heartbeats for {@link #pingTimeout}
         * is disconnected and its merge session closed.
         */
        private Duration pingInterval = Duration.ofSeconds(25);

        private Duration pingTimeout = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getOrigin() {
            return origin;
        }

        public void setOrigin(String origin) {
            this.origin = origin;
        }

        public Duration getPingInterval() {
            return pingInterval;
        }

        public void setPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
        }

        public Duration getPingTimeout() {
            return pingTimeout;
        }

        public void setPingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
        }
    }
}
