package com.example.leads.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "leads.security")
public class LeadConsoleSecurityProperties {

    /**
     * Toggle for the limiter on escalate, release, prolong and lead delete calls. Lead listings,
     * countdowns and transcripts are never limited.
     */
    private boolean rateLimitingEnabled = true;

    /**
     * Browser origins of the operator console, allowed on the REST API.
     */
    @NotEmpty
    private List<String> consoleOrigins = new ArrayList<>(List.of("http://localhost:5173", "http://localhost:4173"));

    private final RateLimit rateLimit = new RateLimit();

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public List<String> getConsoleOrigins() {
        return consoleOrigins;
    }

    public void setConsoleOrigins(List<String> consoleOrigins) {
        this.consoleOrigins = consoleOrigins;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    @Validated
    public static class RateLimit {

        /**
         * Burst of hand-off changes and lead deletions one client may issue before throttling.
         */
        @Min(1)
        private long capacity = 60;

        /**
         * Changes granted back to a client every {@link #refillPeriod}.
         */
        @Min(1)
        private long refillTokens = 60;

        /**
         * Refill interval; also sent as {@code Retry-After} on a throttled change.
         */
        private Duration refillPeriod = Duration.ofSeconds(60);

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(long refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }
    }
}
