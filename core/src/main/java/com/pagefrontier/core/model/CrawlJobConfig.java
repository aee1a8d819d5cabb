package com.pagefrontier.core.model;

import com.pagefrontier.core.util.UrlExclusion;
import com.pagefrontier.core.util.UrlUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 크롤 작업 설정 (job.yml `scrape_job:` 매핑 대상). 한 번의 실행 동안 불변으로 취급한다.
 *
 * maxPages / maxDepth 는 null 이면 무제한.
 */
public final class CrawlJobConfig {

    /** reader 서비스 관련 하위 설정: YAML의 `reader:` 섹션과 매핑 */
    public static final class ReaderCfg {
        private String endpoint = "https://r.jina.ai/";
        /** API 키를 읽을 환경변수 이름 */
        private String apiKeyEnv = "JINA_API_KEY";
        private Duration timeout = Duration.ofSeconds(30);
        /** 최대 시도 횟수(첫 시도 포함) */
        private int retryAttempts = 3;
        private long retryBaseMs = 500;

        public String getEndpoint() { return endpoint; }
        public ReaderCfg setEndpoint(String endpoint) { this.endpoint = endpoint; return this; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public ReaderCfg setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; return this; }

        public Duration getTimeout() { return timeout; }
        public ReaderCfg setTimeout(Duration timeout) { this.timeout = timeout; return this; }
        public ReaderCfg setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(ms); return this; }

        public int getRetryAttempts() { return retryAttempts; }
        public ReaderCfg setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; return this; }

        public long getRetryBaseMs() { return retryBaseMs; }
        public ReaderCfg setRetryBaseMs(long retryBaseMs) { this.retryBaseMs = retryBaseMs; return this; }
    }

    // ---------- 기본 필드 ----------
    private String name = "default";
    private List<String> seedUrls = List.of();
    private boolean followLinks = true;
    private boolean domainRestricted = true;
    private boolean pathRestricted = true;
    private List<String> exclusionPatterns = List.of();
    private Integer maxPages;            // 완료 페이지 예산 (null = 무제한)
    private Integer maxDepth;            // 발견 깊이 상한 (null = 무제한)

    // ---------- 실행 파라미터 ----------
    private int maxWorkers = 3;          // 동시 fetch 상한
    private int maxFetchAttempts = 3;    // URL당 fetch 실패 허용 횟수(초과 시 dead-letter)
    private int rps = 5;                 // reader 서비스 초당 요청 상한
    private Path outputDir = Path.of("output");

    private ReaderCfg reader = new ReaderCfg();

    // ---------- getters ----------
    public String getName() { return name; }
    public List<String> getSeedUrls() { return seedUrls; }
    public boolean isFollowLinks() { return followLinks; }
    public boolean isDomainRestricted() { return domainRestricted; }
    public boolean isPathRestricted() { return pathRestricted; }
    public List<String> getExclusionPatterns() { return exclusionPatterns; }
    public Integer getMaxPages() { return maxPages; }
    public Integer getMaxDepth() { return maxDepth; }
    public int getMaxWorkers() { return maxWorkers; }
    public int getMaxFetchAttempts() { return maxFetchAttempts; }
    public int getRps() { return rps; }
    public Path getOutputDir() { return outputDir; }
    public ReaderCfg getReader() { return reader; }

    // ---------- fluent setters ----------
    public CrawlJobConfig setName(String name) { this.name = name; return this; }

    public CrawlJobConfig setSeedUrls(List<String> seeds) {
        this.seedUrls = (seeds == null) ? List.of() : List.copyOf(seeds);
        return this;
    }

    public CrawlJobConfig setFollowLinks(boolean v) { this.followLinks = v; return this; }
    public CrawlJobConfig setDomainRestricted(boolean v) { this.domainRestricted = v; return this; }
    public CrawlJobConfig setPathRestricted(boolean v) { this.pathRestricted = v; return this; }

    public CrawlJobConfig setExclusionPatterns(List<String> patterns) {
        List<String> out = new ArrayList<>();
        if (patterns != null) for (String p : patterns) if (p != null && !p.isEmpty()) out.add(p);
        this.exclusionPatterns = List.copyOf(out);
        return this;
    }

    public CrawlJobConfig setMaxPages(Integer maxPages) { this.maxPages = maxPages; return this; }
    public CrawlJobConfig setMaxDepth(Integer maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlJobConfig setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; return this; }
    public CrawlJobConfig setMaxFetchAttempts(int v) { this.maxFetchAttempts = v; return this; }
    public CrawlJobConfig setRps(int rps) { this.rps = rps; return this; }
    public CrawlJobConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlJobConfig setReader(ReaderCfg reader) { this.reader = (reader != null ? reader : new ReaderCfg()); return this; }

    // ---------- validate ----------
    /** 크롤 시작 전에 호출. 문제가 있으면 JobConfigException */
    public void validate() {
        if (seedUrls == null || seedUrls.isEmpty())
            throw new JobConfigException("seedUrls must not be empty");
        for (String s : seedUrls) {
            if (!UrlUtils.isAbsoluteHttp(s))
                throw new JobConfigException("seed url must be an absolute http(s) URL: " + s);
        }
        if (maxPages != null && maxPages < 1) throw new JobConfigException("maxPages must be >= 1");
        if (maxDepth != null && maxDepth < 0) throw new JobConfigException("maxDepth must be >= 0");
        if (maxWorkers < 1) throw new JobConfigException("maxWorkers must be >= 1");
        if (maxFetchAttempts < 1) throw new JobConfigException("maxFetchAttempts must be >= 1");
        if (rps <= 0) throw new JobConfigException("rps must be > 0");
        if (outputDir == null) throw new JobConfigException("outputDir must not be null");

        for (String p : exclusionPatterns) {
            try {
                UrlExclusion.checkPattern(p);
            } catch (IllegalArgumentException e) {
                throw new JobConfigException("invalid exclusion pattern: " + p, e);
            }
        }

        if (reader == null) throw new JobConfigException("reader must not be null");
        if (reader.getEndpoint() == null || !UrlUtils.isAbsoluteHttp(reader.getEndpoint()))
            throw new JobConfigException("reader.endpoint must be an absolute http(s) URL");
        Duration t = reader.getTimeout();
        if (t == null || t.isNegative() || t.isZero())
            throw new JobConfigException("reader.timeout must be > 0");
        if (reader.getRetryAttempts() < 1) throw new JobConfigException("reader.retryAttempts must be >= 1");
        if (reader.getRetryBaseMs() < 0) throw new JobConfigException("reader.retryBaseMs must be >= 0");
    }

    // ---------- helpers ----------
    public static CrawlJobConfig defaults() { return new CrawlJobConfig(); }
}
