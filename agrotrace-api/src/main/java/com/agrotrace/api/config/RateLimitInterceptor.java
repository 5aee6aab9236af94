package com.agrotrace.api.config;

import com.agrotrace.api.web.CallerHeaders;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces the per-caller request budgets. Answers 429 once a budget is spent.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimitConfig rateLimitConfig;
    private final RateLimitProperties properties;

    public RateLimitInterceptor(RateLimitConfig rateLimitConfig, RateLimitProperties properties) {
        this.rateLimitConfig = rateLimitConfig;
        this.properties = properties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {
        if (!properties.isEnabled()) {
            return true;
        }

        String callerId = resolveCallerId(request);
        Bucket bucket = selectBucket(request, callerId);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            response.addHeader("X-Rate-Limit-Remaining", String.valueOf(probe.getRemainingTokens()));
            return true;
        }

        long waitForRefill = probe.getNanosToWaitForRefill() / 1_000_000_000;
        log.warn("Rate limit exceeded for {} on {} {}", callerId, request.getMethod(), request.getRequestURI());
        response.addHeader("X-Rate-Limit-Retry-After-Seconds", String.valueOf(waitForRefill));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"RATE_001\",\"message\":\"Rate limit exceeded. Retry after "
                + waitForRefill + " seconds.\"}");
        return false;
    }

    private String resolveCallerId(HttpServletRequest request) {
        String callerId = request.getHeader(CallerHeaders.CALLER_ID);
        if (callerId != null && !callerId.isBlank()) {
            return callerId;
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private Bucket selectBucket(HttpServletRequest request, String callerId) {
        String path = request.getRequestURI();
        String method = request.getMethod();

        if (isRoleHolderOperation(path, method)) {
            return rateLimitConfig.resolveStrictBucket(callerId);
        }
        if ("GET".equals(method)) {
            return rateLimitConfig.resolveReadBucket(callerId);
        }
        return rateLimitConfig.resolveBucket(callerId);
    }

    static boolean isRoleHolderOperation(String path, String method) {
        if ("GET".equals(method)) {
            return false;
        }
        return path.startsWith("/api/v1/registry/")
                || path.startsWith("/api/v1/practice-log/")
                || path.equals("/api/v1/farmers/batch")
                || path.endsWith("/verification")
                || path.endsWith("/deactivation")
                || path.endsWith("/moderation")
                || path.endsWith("/deposits");
    }
}
