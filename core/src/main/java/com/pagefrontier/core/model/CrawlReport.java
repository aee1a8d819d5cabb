package com.pagefrontier.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** 크롤 1회 실행 결과 요약(종료 시점 통계 + 런타임 텔레메트리 + dead-letter 목록) */
public record CrawlReport(String jobName,
                          Instant startedAt,
                          Instant finishedAt,
                          Duration duration,
                          FrontierStats frontier,
                          CrawlStats.Snapshot runtime,
                          List<String> failedUrls,
                          String outputDir) {

    public CrawlReport {
        failedUrls = (failedUrls == null) ? List.of() : List.copyOf(failedUrls);
    }
}
