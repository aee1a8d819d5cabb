package com.pagefrontier.core.service;

import com.pagefrontier.core.api.FetchOutcome;
import com.pagefrontier.core.api.IPageFetcher;
import com.pagefrontier.core.crawler.FrontierStore;
import com.pagefrontier.core.http.ReaderPageFetcher;
import com.pagefrontier.core.model.CrawlJobConfig;
import com.pagefrontier.core.model.CrawlReport;
import com.pagefrontier.core.model.CrawlStats;
import com.pagefrontier.core.model.FrontierStats;
import com.pagefrontier.core.model.Page;
import com.pagefrontier.core.model.PageContent;
import com.pagefrontier.core.util.ContentHash;
import com.pagefrontier.core.util.ProgressListener;
import com.pagefrontier.core.util.RateLimiter;
import com.pagefrontier.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 크롤 오케스트레이터:
 *  - SEEDING: 시드 URL 투입
 *  - DRAINING: pending → 워커 풀(maxWorkers) → fetch → 파일 저장 → markDone → 링크 추가
 *  - DONE: pending 없음 + in-flight 없음 (또는 예산 소진)
 *
 * 디스패치는 이 스레드 하나가 맡는다. in-flight 집합으로 같은 URL 이 동시에 두 번 나가지 않게 하고,
 * 한 번에 min(maxWorkers, 남은 예산) 개까지만 띄우므로 동시 fetch 수는 maxWorkers 를 넘지 않고
 * 예산을 넘는 fetch 는 시작되지 않는다.
 * 워커 하나의 실패(실패 결과/예외)는 로그 + markFailed 로 끝나고 다른 워커에 영향을 주지 않는다.
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    public enum State { SEEDING, DRAINING, DONE }

    private final CrawlStats stats = new CrawlStats();
    private final CrawlJobConfig config;
    private final FrontierStore frontier;
    private final IPageFetcher fetcher;
    private final PageWriter writer;
    private final RateLimiter rateLimiter;
    private final boolean ownsFetcher;
    private final AtomicInteger active = new AtomicInteger(0);

    private volatile State state = State.SEEDING;

    /** 기본 구현(reader 서비스 + outputDir 파일 저장) */
    public CrawlService(CrawlJobConfig config) {
        this(validated(config), new ReaderPageFetcher(config), new FilePageWriter(config.getOutputDir()), true);
    }

    /** DI/테스트용. fetcher 는 호출자가 닫는다. */
    public CrawlService(CrawlJobConfig config, IPageFetcher fetcher, PageWriter writer) {
        this(config, fetcher, writer, false);
    }

    /** ownsFetcher 면 run() 종료 시 fetcher 를 닫는다 */
    CrawlService(CrawlJobConfig config, IPageFetcher fetcher, PageWriter writer, boolean ownsFetcher) {
        this.config = validated(config);
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.frontier = new FrontierStore(config);
        this.rateLimiter = new RateLimiter(config.getRps());
        this.ownsFetcher = ownsFetcher;
    }

    private static CrawlJobConfig validated(CrawlJobConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }

    /* =========================
       실행 API
       ========================= */

    public CrawlReport run() {
        return run(ProgressListener.NONE, null);
    }

    public CrawlReport run(ProgressListener listener) {
        return run(listener, null);
    }

    /**
     * 진행률 + 취소 플래그(옵션).
     * 취소되면 새 디스패치를 멈추고 in-flight 작업이 끝나기를 기다린 뒤 보고서를 만든다.
     */
    public CrawlReport run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Instant startedAt = Instant.now();
        final int workers = config.getMaxWorkers();

        // ---- 0) SEEDING ----
        state = State.SEEDING;
        LOG.info("Crawl start: job={}, seeds={}, maxPages={}, maxDepth={}, workers={}, rps={}",
                config.getName(), config.getSeedUrls().size(), config.getMaxPages(),
                config.getMaxDepth(), workers, config.getRps());
        SLOG.info("crawl-start",
                "job", config.getName(),
                "seeds", config.getSeedUrls().size(),
                "maxPages", config.getMaxPages(),
                "maxDepth", config.getMaxDepth(),
                "workers", workers,
                "rps", config.getRps());
        LOG.info("Scope: hosts={}, segments={}",
                frontier.policy().seedHosts(), frontier.policy().seedSegments());
        frontier.seed(config.getSeedUrls());
        notify(pl, "seed", frontier.getStatistics());

        // ---- 1) DRAINING: 고정 스레드풀 + completion service ----
        state = State.DRAINING;
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(workers * 2),
                new NamedThreadFactory("crawl-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );
        CompletionService<String> ecs = new ExecutorCompletionService<>(exec);
        Map<Future<String>, String> inFlight = new HashMap<>();

        try {
            while (true) {
                // 매 회 호출: 예산 소진 시 남은 pending 이 여기서 비워진다
                List<String> pending = frontier.getPending();
                if (pending.isEmpty() && inFlight.isEmpty()) break;

                boolean cancelled = cancelFlag != null && cancelFlag.get();
                int room = cancelled ? 0 : Math.min(workers, frontier.remainingBudget()) - inFlight.size();
                if (room > 0) {
                    Set<String> busy = new HashSet<>(inFlight.values());
                    for (String url : pending) {
                        if (room <= 0) break;
                        if (busy.contains(url)) continue;
                        inFlight.put(ecs.submit(() -> process(url)), url);
                        room--;
                    }
                }
                if (inFlight.isEmpty()) break;

                Future<String> f = ecs.take();
                String url = inFlight.remove(f);
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    handleFailure(url, "task failed: " + cause, cause);
                }

                FrontierStats s = frontier.getStatistics();
                LOG.info("Progress {} (pending={}, failed={}, inFlight={})",
                        s.progressLabel(), s.pagesPending(), s.pagesFailed(), inFlight.size());
                notify(pl, "crawl", s);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Crawl interrupted with {} fetches in flight", inFlight.size());
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            if (ownsFetcher) closeFetcher();
        }

        // ---- 2) DONE ----
        state = State.DONE;
        Instant finishedAt = Instant.now();
        FrontierStats fin = frontier.getStatistics();
        List<String> failed = frontier.pages().stream()
                .filter(Page::isFailed)
                .map(Page::url)
                .collect(Collectors.toList());
        CrawlStats.Snapshot rt = stats.snapshot();
        notify(pl, "done", fin);

        LOG.info("Crawl done. job={}, scraped={}, unique={}, failed={}, maxDepth={}, maxObservedCC={}",
                config.getName(), fin.uniquePagesScraped(), fin.totalUniquePages(),
                fin.pagesFailed(), fin.maxDepthReached(), rt.maxObservedConcurrency);
        SLOG.info("crawl-done",
                "job", config.getName(),
                "scraped", fin.uniquePagesScraped(),
                "unique", fin.totalUniquePages(),
                "failed", fin.pagesFailed(),
                "maxDepthReached", fin.maxDepthReached(),
                "fetches", rt.fetchesTotal,
                "retries", rt.readerRetries,
                "maxObservedCC", rt.maxObservedConcurrency);

        return new CrawlReport(config.getName(), startedAt, finishedAt,
                Duration.between(startedAt, finishedAt), fin, rt, failed,
                String.valueOf(config.getOutputDir()));
    }

    private void closeFetcher() {
        try {
            fetcher.close();
        } catch (Exception e) {
            LOG.warn("Failed to close fetcher: {}", e.toString());
        }
    }

    /** 워커: rate-limit → fetch → 저장 → markDone → 링크 추가. 실패는 값으로 처리하고 던지지 않는다. */
    private String process(String url) {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.debug("Interrupted while rate-limiting {}", url);
            return url;
        }

        int cur = active.incrementAndGet();
        stats.observeConcurrency(cur);
        long t0 = System.nanoTime();
        boolean ok = false;
        int retries = 0;
        try {
            FetchOutcome out;
            try {
                out = fetcher.fetch(url);
            } catch (RuntimeException e) {
                out = FetchOutcome.failure(url, FetchOutcome.Failure.TRANSPORT, e.toString(), e, 0);
            }
            retries = out.getRetries();
            if (!out.isSuccess()) {
                handleFailure(url, out.getFailure() + ": " + out.getMessage(), out.getCause());
                return url;
            }

            PageContent page = out.getContent();
            if (page.isBlank()) {
                handleFailure(url, FetchOutcome.Failure.EMPTY_CONTENT + ": blank content", null);
                return url;
            }

            Path file;
            try {
                file = writer.write(page);
            } catch (IOException | RuntimeException e) {
                handleFailure(url, "write failed: " + e, e);
                return url;
            }

            String hash = ContentHash.sha256Hex(page.getContent());
            if (!frontier.markDone(url, file.getFileName().toString(), hash)) {
                LOG.warn("{} was fetched but not marked done", url);
                return url;
            }
            ok = true;

            List<String> accepted = config.isFollowLinks()
                    ? frontier.addUrls(page.getLinks(), url)
                    : List.of();
            LOG.info("Scraped {} -> {} (links={}, accepted={})",
                    url, file.getFileName(), page.getLinks().size(), accepted.size());
            SLOG.info("page-done",
                    "url", url,
                    "file", file.getFileName().toString(),
                    "links", page.getLinks().size(),
                    "accepted", accepted.size(),
                    "retries", retries);
            return url;

        } finally {
            long wallMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            stats.recordFetch(wallMs, ok);
            stats.addRetries(retries);
            stats.observeConcurrency(active.decrementAndGet());
        }
    }

    private void handleFailure(String url, String reason, Throwable cause) {
        boolean dead = frontier.markFailed(url);
        LOG.warn("Fetch failed for {}: {}", url, reason);
        if (cause != null) {
            SLOG.error("fetch-failed", cause, "url", url, "reason", reason, "deadLetter", dead);
        } else {
            SLOG.warn("fetch-failed", "url", url, "reason", reason, "deadLetter", dead);
        }
        if (dead) {
            LOG.warn("Giving up on {} after {} attempts", url, config.getMaxFetchAttempts());
            SLOG.warn("dead-letter", "url", url, "attempts", config.getMaxFetchAttempts());
        }
    }

    private static void notify(ProgressListener pl, String phase, FrontierStats s) {
        try {
            pl.onProgress(phase, s);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed in phase {}: {}", phase, e.toString());
        }
    }

    /* =========================
       공용 유틸 / 게터
       ========================= */

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    public State state() { return state; }

    public FrontierStore frontier() { return frontier; }

    public CrawlStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }
}
