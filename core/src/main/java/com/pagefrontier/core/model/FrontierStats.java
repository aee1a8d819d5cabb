package com.pagefrontier.core.model;

/**
 * 프론티어 통계 스냅샷(읽기 전용). 호출 시점의 전체 페이지 맵에서 계산한다.
 * maxPages 가 null 이면 무제한.
 */
public record FrontierStats(int totalUniquePages,
                            int uniquePagesScraped,
                            int pagesPending,
                            int pagesFailed,
                            int maxDepthReached,
                            Integer maxPages) {

    /** "scraped/max" 형태 진행 표기 (무제한이면 "scraped/∞") */
    public String progressLabel() {
        return uniquePagesScraped + "/" + (maxPages == null ? "∞" : String.valueOf(maxPages));
    }
}
