package com.pagefrontier.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 프론티어의 페이지 한 건. 식별자는 정규화 URL 하나뿐이다.
 * 불변 레코드. 상태 변화는 새 인스턴스로 교체한다(FrontierStore 락 안에서만).
 */
public record Page(String url,
                   int depth,
                   Status status,
                   int attempts,
                   String filename,
                   String contentHash,
                   Instant discoveredAt) {

    public enum Status { PENDING, DONE, FAILED }

    public Page {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(status, "status");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }

    public static Page pending(String url, int depth) {
        return new Page(url, depth, Status.PENDING, 0, null, null, Instant.now());
    }

    public boolean isDone() { return status == Status.DONE; }
    public boolean isPending() { return status == Status.PENDING; }
    public boolean isFailed() { return status == Status.FAILED; }

    /** 완료 전이. 메타데이터가 null이면 기존 값 유지 */
    public Page withDone(String filename, String contentHash) {
        return new Page(url, depth, Status.DONE, attempts,
                filename != null ? filename : this.filename,
                contentHash != null ? contentHash : this.contentHash,
                discoveredAt);
    }

    /** 실패 1회 기록. 누적 실패가 maxAttempts 에 도달하면 FAILED(dead-letter) */
    public Page withFailedAttempt(int maxAttempts) {
        int n = attempts + 1;
        Status next = (n >= maxAttempts) ? Status.FAILED : Status.PENDING;
        return new Page(url, depth, next, n, filename, contentHash, discoveredAt);
    }
}
