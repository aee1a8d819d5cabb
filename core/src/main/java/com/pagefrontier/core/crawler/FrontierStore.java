package com.pagefrontier.core.crawler;

import com.pagefrontier.core.model.CrawlJobConfig;
import com.pagefrontier.core.model.FrontierStats;
import com.pagefrontier.core.model.Page;
import com.pagefrontier.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 작업 1회분 크롤 상태의 단일 동기화 지점.
 *
 * 모든 공개 연산은 하나의 락(lock) 안에서 원자적으로 실행된다. 연산이 짧고 개수가 적어서
 * 세분화된 락 대신 단일 락을 쓴다. 락 안에서는 I/O를 하지 않는다.
 *
 * 불변식:
 *  - 정규화 URL당 Page 는 정확히 1개
 *  - depth 는 최초 삽입 시 고정(first discovery wins)
 *  - maxPages 설정 시 DONE 개수 <= maxPages. 도달하면 더 이상 pending 을 내주지 않음
 *  - maxDepth 설정 시 depth > maxDepth 인 Page 는 존재하지 않음
 *  - pending = PENDING 상태이면서 아직 버려지지 않은 URL (in-flight 상태는 없음)
 *
 * fetch 실패는 markFailed 로 기록하고, maxFetchAttempts 회 실패하면 FAILED(dead-letter)로
 * 옮겨 pending 에서 뺀다.
 */
public final class FrontierStore {
    private static final Logger LOG = LoggerFactory.getLogger(FrontierStore.class);

    private final Object lock = new Object();

    private final RestrictionPolicy policy;
    private final Integer maxPages;
    private final Integer maxDepth;
    private final int maxFetchAttempts;

    // ---- lock 으로 보호되는 상태 ----
    private final Map<String, Page> pages = new LinkedHashMap<>();
    private final Set<String> pending = new LinkedHashSet<>();
    private final Set<String> done = new LinkedHashSet<>();

    public FrontierStore(CrawlJobConfig config) {
        this(config, new RestrictionPolicy(config));
    }

    public FrontierStore(CrawlJobConfig config, RestrictionPolicy policy) {
        Objects.requireNonNull(config, "config").validate();
        this.policy = Objects.requireNonNull(policy, "policy");
        this.maxPages = config.getMaxPages();
        this.maxDepth = config.getMaxDepth();
        this.maxFetchAttempts = config.getMaxFetchAttempts();
        seed(config.getSeedUrls());
    }

    /**
     * 시드 URL을 depth 0 으로 넣는다. 이미 있는 URL은 무시(멱등).
     * 시드는 제한 정책을 거치지 않는다.
     * @return 새로 추가된 정규화 URL
     */
    public List<String> seed(Collection<String> seedUrls) {
        List<String> added = new ArrayList<>();
        if (seedUrls == null) return added;
        synchronized (lock) {
            for (String s : seedUrls) {
                String n = UrlUtils.normalize(s);
                if (n.isEmpty() || pages.containsKey(n)) continue;
                pages.put(n, Page.pending(n, 0));
                pending.add(n);
                added.add(n);
            }
        }
        return added;
    }

    /**
     * source 페이지에서 발견된 후보 링크들을 추가한다.
     *
     * depth = depth(normalize(source)) + 1 (모르는 source 는 depth 0 취급).
     * depth 가 maxDepth 를 넘으면 배치 전체를 거절한다(깊이는 source 의 속성).
     * 후보마다 정규화 → 중복 아님 → 정책 통과 → 예산(이번 호출 수락 수 + DONE 수 <= maxPages) 이면 수락.
     * 후보 하나의 예외는 로그만 남기고 나머지 후보 처리를 계속한다.
     *
     * @return 수락된 정규화 URL (발견 순서)
     */
    public List<String> addUrls(Collection<String> candidates, String sourceUrl) {
        List<String> accepted = new ArrayList<>();
        if (candidates == null || candidates.isEmpty()) return accepted;
        String source = UrlUtils.normalize(sourceUrl);

        synchronized (lock) {
            Page src = pages.get(source);
            int newDepth = (src == null ? 0 : src.depth()) + 1;
            if (maxDepth != null && newDepth > maxDepth) {
                LOG.debug("Depth {} exceeds maxDepth {} - rejecting {} links from {}",
                        newDepth, maxDepth, candidates.size(), source);
                return accepted;
            }

            int slots = (maxPages == null) ? Integer.MAX_VALUE : maxPages - done.size();

            for (String candidate : candidates) {
                if (accepted.size() >= slots) break;
                try {
                    String n = UrlUtils.normalize(candidate);
                    if (n.isEmpty() || pages.containsKey(n)) continue;

                    Eligibility e = policy.check(n, done);
                    if (!e.isEligible()) continue;

                    pages.put(n, Page.pending(n, newDepth));
                    pending.add(n);
                    accepted.add(n);
                } catch (RuntimeException ex) {
                    LOG.warn("Skipping candidate {} from {}: {}", candidate, source, ex.toString());
                }
            }
        }
        if (!accepted.isEmpty()) {
            LOG.debug("Accepted {} of {} links from {}", accepted.size(), candidates.size(), source);
        }
        return accepted;
    }

    /**
     * 완료 처리(멱등). 모르는 URL이나 이미 DONE 이면 아무것도 하지 않는다.
     * 예산이 이미 찼으면 거절한다.
     * @return 이번 호출로 DONE 이 되었으면 true
     */
    public boolean markDone(String url, String filename, String contentHash) {
        String n = UrlUtils.normalize(url);
        synchronized (lock) {
            Page p = pages.get(n);
            if (p == null || p.isDone()) return false;
            if (budgetReachedLocked()) {
                LOG.warn("Page budget {} already reached - not marking {} as done", maxPages, n);
                return false;
            }
            pages.put(n, p.withDone(filename, contentHash));
            pending.remove(n);
            done.add(n);
            return true;
        }
    }

    public boolean markDone(String url) {
        return markDone(url, null, null);
    }

    /**
     * fetch 실패 1회 기록. 누적 실패가 maxFetchAttempts 에 도달하면 FAILED 로 전이하고 pending 에서 뺀다.
     * 모르는 URL, DONE/FAILED 인 URL 은 무시.
     * @return 이번 호출로 dead-letter 되었으면 true
     */
    public boolean markFailed(String url) {
        String n = UrlUtils.normalize(url);
        synchronized (lock) {
            Page p = pages.get(n);
            if (p == null || !p.isPending()) return false;
            Page next = p.withFailedAttempt(maxFetchAttempts);
            pages.put(n, next);
            if (next.isFailed()) {
                pending.remove(n);
                return true;
            }
            return false;
        }
    }

    /**
     * 현재 pending URL (발견 순서). 예산이 이미 찼으면 pending 을 비우고 빈 리스트를 돌려준다.
     * 오케스트레이터는 이 빈 리스트로 종료를 알게 된다.
     */
    public List<String> getPending() {
        synchronized (lock) {
            if (budgetReachedLocked()) {
                if (!pending.isEmpty()) {
                    LOG.info("Page budget {} reached - dropping {} pending URLs", maxPages, pending.size());
                    pending.clear();
                }
                return List.of();
            }
            return new ArrayList<>(pending);
        }
    }

    /** maxPages - DONE 수 (무제한이면 Integer.MAX_VALUE) */
    public int remainingBudget() {
        synchronized (lock) {
            return (maxPages == null) ? Integer.MAX_VALUE : Math.max(0, maxPages - done.size());
        }
    }

    public Optional<Page> page(String url) {
        String n = UrlUtils.normalize(url);
        synchronized (lock) {
            return Optional.ofNullable(pages.get(n));
        }
    }

    /** 전체 페이지 복사본(발견 순서) */
    public List<Page> pages() {
        synchronized (lock) {
            return new ArrayList<>(pages.values());
        }
    }

    /** 통계 스냅샷. 누적 카운터 없이 호출 시점의 페이지 맵에서 계산 */
    public FrontierStats getStatistics() {
        synchronized (lock) {
            int scraped = 0, failed = 0, maxSeenDepth = 0;
            for (Page p : pages.values()) {
                if (p.isDone()) scraped++;
                else if (p.isFailed()) failed++;
                maxSeenDepth = Math.max(maxSeenDepth, p.depth());
            }
            return new FrontierStats(pages.size(), scraped, pending.size(), failed, maxSeenDepth, maxPages);
        }
    }

    public RestrictionPolicy policy() { return policy; }

    private boolean budgetReachedLocked() {
        return maxPages != null && done.size() >= maxPages;
    }
}
