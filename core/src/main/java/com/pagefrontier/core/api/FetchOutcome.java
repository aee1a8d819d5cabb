package com.pagefrontier.core.api;

import com.pagefrontier.core.model.PageContent;

import java.util.Objects;

/**
 * fetch 결과 태그 타입: 성공(PageContent) 또는 실패(사유 + 원인).
 * URL 단위 실패는 예외가 아니라 이 값으로 전달한다.
 */
public final class FetchOutcome {

    public enum Failure { TRANSPORT, HTTP_STATUS, PARSE, EMPTY_CONTENT, INTERRUPTED }

    private final String url;
    private final PageContent content;   // 성공 시
    private final Failure failure;       // 실패 시
    private final String message;
    private final Throwable cause;
    private final int retries;

    private FetchOutcome(String url, PageContent content, Failure failure, String message, Throwable cause, int retries) {
        this.url = Objects.requireNonNull(url, "url");
        this.content = content;
        this.failure = failure;
        this.message = message;
        this.cause = cause;
        this.retries = retries;
    }

    public static FetchOutcome success(PageContent content) {
        return success(content, 0);
    }

    public static FetchOutcome success(PageContent content, int retries) {
        Objects.requireNonNull(content, "content");
        return new FetchOutcome(content.getUrl(), content, null, null, null, retries);
    }

    public static FetchOutcome failure(String url, Failure failure, String message) {
        return failure(url, failure, message, null, 0);
    }

    public static FetchOutcome failure(String url, Failure failure, String message, Throwable cause, int retries) {
        return new FetchOutcome(url, null, Objects.requireNonNull(failure, "failure"), message, cause, retries);
    }

    public boolean isSuccess() { return content != null; }
    public String getUrl() { return url; }
    /** 실패 결과에서 호출하면 IllegalStateException */
    public PageContent getContent() {
        if (content == null) throw new IllegalStateException("no content for failed fetch: " + url);
        return content;
    }
    public Failure getFailure() { return failure; }
    public String getMessage() { return message; }
    public Throwable getCause() { return cause; }
    /** reader 재시도 횟수(0 이상) */
    public int getRetries() { return retries; }

    @Override
    public String toString() {
        return isSuccess()
                ? "FetchOutcome{success, url=" + url + ", links=" + content.getLinks().size() + "}"
                : "FetchOutcome{" + failure + ", url=" + url + ", message=" + message + "}";
    }
}
