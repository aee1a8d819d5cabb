package com.pagefrontier.core.api;

/**
 * 페이지 추출 최소 계약: URL을 받아 본문/링크/이미지를 돌려준다.
 * 네트워크·파싱 오류는 예외 대신 {@link FetchOutcome#failure} 로 표현한다.
 * 타임아웃은 구현체 책임.
 */
@FunctionalInterface
public interface IPageFetcher extends AutoCloseable {
    FetchOutcome fetch(String url);
    @Override default void close() throws Exception {}
}
