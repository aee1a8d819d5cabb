package com.pagefrontier.core.util;

import java.time.Duration;

/** 재시도 대기 추상화(테스트에서 실제 대기 없이 기록만 하도록 교체). */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper SYSTEM = d -> {
        long ms = Math.max(0, d.toMillis());
        if (ms > 0) Thread.sleep(ms);
    };
}
