package com.pagefrontier.core.http;

import java.time.Duration;

/** reader 호출 재시도 조건/지연 정책 */
public interface RetryPolicy {
    /**
     * @param statusCode HTTP 상태 코드, 전송 오류면 -1
     * @param attempt    방금 끝난 시도 번호(1부터)
     * @return true 면 지연 후 재시도
     */
    boolean shouldRetry(int statusCode, int attempt);

    /**
     * 다음 시도 전 대기 시간.
     * @param retryAfter 서버가 준 Retry-After 헤더 값(없으면 null)
     */
    Duration delayBefore(int nextAttempt, String retryAfter);

    /** 최대 시도 횟수(첫 시도 포함) */
    int maxAttempts();
}
