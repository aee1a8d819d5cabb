package com.pagefrontier.core.util;

/**
 * 토큰 버킷. reader 서비스로 나가는 요청을 초당 permitsPerSecond 로 제한한다.
 * 워커 스레드 간 공유(synchronized).
 */
public final class RateLimiter {
    private final double capacity;
    private final double permitsPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(int permitsPerSecond) {
        this(permitsPerSecond, permitsPerSecond);
    }

    public RateLimiter(int burst, int permitsPerSecond) {
        if (permitsPerSecond <= 0) throw new IllegalArgumentException("permitsPerSecond must be > 0");
        this.capacity = Math.max(1, burst);
        this.permitsPerSecond = permitsPerSecond;
        this.tokens = this.capacity;
        this.lastNs = System.nanoTime();
    }

    /** 토큰 1개를 얻을 때까지 대기(인터럽트 가능) */
    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            long waitMs = (long) Math.ceil((1.0 - tokens) / permitsPerSecond * 1000.0);
            this.wait(Math.max(1, Math.min(waitMs, 50)));
        }
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * permitsPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
