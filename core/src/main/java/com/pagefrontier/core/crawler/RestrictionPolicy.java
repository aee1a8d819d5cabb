package com.pagefrontier.core.crawler;

import com.pagefrontier.core.model.CrawlJobConfig;
import com.pagefrontier.core.util.UrlExclusion;
import com.pagefrontier.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 크롤 대상 여부 판정(순수 함수, 부작용 없음).
 * 검사 순서(첫 실패에서 중단):
 *   1) 이미 완료된 URL
 *   2) domainRestricted: host 가 시드 host 집합에 포함
 *   3) pathRestricted: 첫 path 세그먼트가 시드 중 하나의 첫 세그먼트와 일치
 *      (세그먼트 없는 시드는 제약을 걸지 않음, 세그먼트 없는 후보는 통과)
 *   4) 제외 패턴
 * 파싱 불가 URL, http(s) 절대 URL이 아닌 링크(mailto:, javascript: 등)는 MALFORMED.
 * 로그만 남기고 예외는 던지지 않는다.
 */
public final class RestrictionPolicy {
    private static final Logger LOG = LoggerFactory.getLogger(RestrictionPolicy.class);

    private final boolean domainRestricted;
    private final boolean pathRestricted;
    private final List<String> exclusionPatterns;
    private final Set<String> seedHosts;
    private final Set<String> seedSegments;
    private final boolean pathUnconstrained;   // 세그먼트 없는 시드가 하나라도 있으면 path 제약 없음

    public RestrictionPolicy(CrawlJobConfig config) {
        Objects.requireNonNull(config, "config");
        this.domainRestricted = config.isDomainRestricted();
        this.pathRestricted = config.isPathRestricted();
        this.exclusionPatterns = config.getExclusionPatterns();

        Set<String> hosts = new LinkedHashSet<>();
        Set<String> segments = new LinkedHashSet<>();
        boolean unconstrained = false;
        for (String seed : config.getSeedUrls()) {
            String h = UrlUtils.host(seed);
            if (h != null) hosts.add(h);
            try {
                String seg = UrlUtils.firstPathSegment(seed);
                if (seg.isEmpty()) unconstrained = true;
                else segments.add(seg);
            } catch (URISyntaxException e) {
                LOG.warn("Invalid seed URL {}: {}", seed, e.getMessage());
            }
        }
        this.seedHosts = Collections.unmodifiableSet(hosts);
        this.seedSegments = Collections.unmodifiableSet(segments);
        this.pathUnconstrained = unconstrained || segments.isEmpty();
    }

    public Eligibility check(String url, Set<String> doneUrls) {
        if (url == null || url.isBlank()) return Eligibility.MALFORMED;
        try {
            if (doneUrls != null && doneUrls.contains(url)) return Eligibility.ALREADY_DONE;

            if (!UrlUtils.isAbsoluteHttp(url)) {
                LOG.debug("Skipping {} - not an absolute http(s) URL", url);
                return Eligibility.MALFORMED;
            }

            if (domainRestricted) {
                String host = UrlUtils.host(url);
                if (host == null) {
                    LOG.debug("Skipping {} - no host", url);
                    return Eligibility.MALFORMED;
                }
                if (!seedHosts.contains(host)) {
                    LOG.debug("Skipping {} - domain {} not in {}", url, host, seedHosts);
                    return Eligibility.OUTSIDE_DOMAIN;
                }
            }

            if (pathRestricted && !pathUnconstrained) {
                String seg = UrlUtils.firstPathSegment(url);
                if (!seg.isEmpty() && !seedSegments.contains(seg)) {
                    LOG.debug("Skipping {} - path {} not in {}", url, seg, seedSegments);
                    return Eligibility.OUTSIDE_PATH;
                }
            }

            if (UrlExclusion.isExcluded(url, exclusionPatterns)) {
                LOG.debug("Skipping {} - matches exclusion pattern", url);
                return Eligibility.EXCLUDED;
            }
            return Eligibility.ELIGIBLE;

        } catch (URISyntaxException | RuntimeException e) {
            LOG.warn("Invalid URL {}: {}", url, e.getMessage());
            return Eligibility.MALFORMED;
        }
    }

    public Set<String> seedHosts() { return seedHosts; }
    public Set<String> seedSegments() { return seedSegments; }
}
