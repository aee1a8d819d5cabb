package com.pagefrontier.core.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 429/5xx/전송오류(-1)에서만 재시도.
 * 지연: base, base*2, base*4 ... (±10% jitter). Retry-After(초)가 있으면 우선, 상한 30s.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    static final Duration MAX_DELAY = Duration.ofSeconds(30);

    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 500); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return statusCode == 429 || statusCode >= 500 || statusCode == -1;
    }

    @Override public Duration delayBefore(int nextAttempt, String retryAfter) {
        // 초 단위만 지원(HTTP-date 형식은 백오프로 대체)
        if (retryAfter != null && retryAfter.trim().matches("\\d{1,9}")) {
            return min(Duration.ofSeconds(Long.parseLong(retryAfter.trim())), MAX_DELAY);
        }
        int exp = Math.max(0, Math.min(nextAttempt - 2, 20));   // 2번째 시도 → base
        long raw = baseMillis << exp;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return min(Duration.ofMillis((long) (raw * jitter)), MAX_DELAY);
    }

    @Override public int maxAttempts() { return maxAttempts; }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
