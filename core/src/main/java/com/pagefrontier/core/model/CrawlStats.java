package com.pagefrontier.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong fetchesTotal  = new AtomicLong(0);   // fetch 호출 수(URL 단위)
    private final AtomicLong fetchFailures = new AtomicLong(0);   // 실패로 끝난 fetch 수
    private final AtomicLong readerRetries = new AtomicLong(0);   // reader 재시도 총합
    private final AtomicLong sumFetchWallMs = new AtomicLong(0);  // fetch 벽시계 합(대기 포함)
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void recordFetch(long wallMs, boolean success) {
        fetchesTotal.incrementAndGet();
        sumFetchWallMs.addAndGet(Math.max(0, wallMs));
        if (!success) fetchFailures.incrementAndGet();
    }

    public void addRetries(long retries) {
        if (retries > 0) readerRetries.addAndGet(retries);
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long total = fetchesTotal.get();
        long avg = sumFetchWallMs.get() / Math.max(1, total);
        return new Snapshot(total, fetchFailures.get(), readerRetries.get(),
                maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long fetchesTotal;
        public final long fetchFailures;
        public final long readerRetries;
        public final int  maxObservedConcurrency;
        public final long avgFetchMs;
        public Snapshot(long fetches, long failures, long retries, int cc, long avgMs) {
            this.fetchesTotal = fetches;
            this.fetchFailures = failures;
            this.readerRetries = retries;
            this.maxObservedConcurrency = cc;
            this.avgFetchMs = avgMs;
        }
    }
}
