package com.example.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * ハンドラの手前で「APIキー取り出し → キー検証 → レート判定」をこの順で行う。
 *
 *  - X-API-KEY が無い / 空         → 401
 *  - 知らないキー                  → 401 (無い場合と同じレスポンス。どちらなのかは返さない)
 *  - バケツが空                    → 429 + Retry-After ヘッダ
 *  - それ以外                      → そのままハンドラへ
 *
 * 拒否したリクエストはリトライしない。再試行するかどうかは呼び出し側が決める。
 */
@Component
public class AdmissionGate implements HandlerInterceptor {

    public static final String API_KEY_HEADER = "X-API-KEY";

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    private static final ErrorBody UNAUTHENTICATED =
            new ErrorBody("unauthenticated", "Missing or invalid API key");
    private static final ErrorBody RATE_LIMITED =
            new ErrorBody("rate_limited", "Rate limit exceeded");

    private final ApiKeyStore apiKeys;
    private final RateLimiterService limiter;
    private final int capacity;
    private final ObjectMapper objectMapper;
    private final Counter unauthenticatedCounter;
    private final Counter rateLimitedCounter;

    public AdmissionGate(
            ApiKeyStore apiKeys,
            RateLimiterService limiter,
            RateLimitProperties props,
            ObjectMapper objectMapper,
            MeterRegistry registry
    ) {
        this.apiKeys = apiKeys;
        this.limiter = limiter;
        this.capacity = props.getCapacity();
        this.objectMapper = objectMapper;
        this.unauthenticatedCounter = Counter.builder("admission_rejections_total")
                .tag("reason", "unauthenticated")
                .register(registry);
        this.rateLimitedCounter = Counter.builder("admission_rejections_total")
                .tag("reason", "rate_limited")
                .register(registry);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        String apiKey = request.getHeader(API_KEY_HEADER);

        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Rejected {} {}: missing API key", request.getMethod(), request.getRequestURI());
            unauthenticatedCounter.increment();
            return reject(response, HttpStatus.UNAUTHORIZED, UNAUTHENTICATED);
        }

        if (!apiKeys.isValid(apiKey)) {
            log.debug("Rejected {} {}: unknown API key", request.getMethod(), request.getRequestURI());
            unauthenticatedCounter.increment();
            return reject(response, HttpStatus.UNAUTHORIZED, UNAUTHENTICATED);
        }

        AllowResult res = limiter.allow(apiKey);

        response.setHeader("X-RateLimit-Limit", String.valueOf(capacity));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(res.remaining()));

        if (!res.allowed()) {
            log.debug("Rejected {} {}: rate limited, retry after {}s",
                    request.getMethod(), request.getRequestURI(), res.retryAfterSeconds());
            rateLimitedCounter.increment();
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(res.retryAfterSeconds()));
            return reject(response, HttpStatus.TOO_MANY_REQUESTS, RATE_LIMITED);
        }

        return true;
    }

    private boolean reject(HttpServletResponse response, HttpStatus status, ErrorBody body) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), body);
        return false;
    }
}
