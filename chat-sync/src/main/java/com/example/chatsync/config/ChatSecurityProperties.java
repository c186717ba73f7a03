package com.example.chatsync.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat.security")
public class ChatSecurityProperties {

    private boolean rateLimitingEnabled = true;

    /**
     * Budget for GET requests, shared by all reads of one caller.
     */
    private final RateLimit reads = new RateLimit(240, Duration.ofSeconds(60));

    /**
     * Budget for mutating requests. Every accepted write fans out to subscribers, so it is
     * tighter than the read budget.
     */
    private final RateLimit writes = new RateLimit(60, Duration.ofSeconds(60));

    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:4200", "http://localhost:4201"));

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public RateLimit getReads() {
        return reads;
    }

    public RateLimit getWrites() {
        return writes;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public static class RateLimit {

        private long capacity;

        private Duration refillPeriod;

        public RateLimit() {
            this(120, Duration.ofSeconds(60));
        }

        public RateLimit(long capacity, Duration refillPeriod) {
            this.capacity = capacity;
            this.refillPeriod = refillPeriod;
        }

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }
    }
}
