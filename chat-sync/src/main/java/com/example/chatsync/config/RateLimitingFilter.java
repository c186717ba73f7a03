package com.example.chatsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-caller token buckets for the REST API, one for reads and one for writes. Callers are keyed
 * by {@code X-User-Id} when present, by client address otherwise.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String USER_HEADER = "X-User-Id";

    private final ChatSecurityProperties securityProperties;
    private final ObjectMapper objectMapper;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimitingFilter(ChatSecurityProperties securityProperties, ObjectMapper objectMapper) {
        this.securityProperties = securityProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !securityProperties.isRateLimitingEnabled()
                || !request.getRequestURI().startsWith("/api/")
                || HttpMethod.OPTIONS.matches(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        boolean write = isWrite(request);
        String key = resolveCaller(request) + (write ? ":write" : ":read");
        Bucket bucket = buckets.computeIfAbsent(key, ignored -> newBucket(write
                ? securityProperties.getWrites()
                : securityProperties.getReads()));

        ConsumptionProbe consumption = bucket.tryConsumeAndReturnRemaining(1);
        if (consumption.isConsumed()) {
            response.setHeader("X-RateLimit-Remaining", String.valueOf(consumption.getRemainingTokens()));
            filterChain.doFilter(request, response);
            return;
        }
        log.debug("Rate limit exceeded for {}", key);
        writeRejection(response, Duration.ofNanos(consumption.getNanosToWaitForRefill()));
    }

    private static boolean isWrite(HttpServletRequest request) {
        return !HttpMethod.GET.matches(request.getMethod()) && !HttpMethod.HEAD.matches(request.getMethod());
    }

    private static Bucket newBucket(ChatSecurityProperties.RateLimit limit) {
        Duration period = limit.getRefillPeriod();
        if (period == null || period.isZero() || period.isNegative()) {
            period = Duration.ofSeconds(60);
        }
        long capacity = Math.max(limit.getCapacity(), 1);
        return Bucket.builder()
                .addLimit(Bandwidth.builder().capacity(capacity).refillGreedy(capacity, period).build())
                .build();
    }

    private void writeRejection(HttpServletResponse response, Duration wait) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("Retry-After", String.valueOf(Math.max(wait.toSeconds(), 1)));
        objectMapper.writeValue(response.getWriter(), Map.of(
                "timestamp", Instant.now().toString(),
                "error", "Request rate exceeded",
                "code", "too_many_requests"));
    }

    private static String resolveCaller(HttpServletRequest request) {
        String userId = request.getHeader(USER_HEADER);
        if (userId != null && !userId.isBlank()) {
            return "user:" + userId.trim();
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        return forwardedFor != null && !forwardedFor.isBlank()
                ? "ip:" + forwardedFor.split(",")[0].trim()
                : "ip:" + request.getRemoteAddr();
    }
}
