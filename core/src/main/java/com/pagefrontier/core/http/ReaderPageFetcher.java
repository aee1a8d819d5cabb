package com.pagefrontier.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagefrontier.core.api.FetchOutcome;
import com.pagefrontier.core.api.FetchOutcome.Failure;
import com.pagefrontier.core.api.IPageFetcher;
import com.pagefrontier.core.model.CrawlJobConfig;
import com.pagefrontier.core.model.PageContent;
import com.pagefrontier.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 외부 reader 서비스(기본 https://r.jina.ai/) 클라이언트.
 * POST {"url": ..., "options": "Markdown"} → data.content / data.title / data.links / data.images.
 * 429/5xx/전송 오류는 RetryPolicy 에 따라 재시도하고, 최종 실패는 FetchOutcome.failure 로 돌려준다.
 */
public class ReaderPageFetcher implements IPageFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(ReaderPageFetcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final URI endpoint;
    private final String apiKey;
    private final Duration timeout;
    private final HttpSender sender;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    /** 프로덕션 경로: API 키는 config.reader.apiKeyEnv 환경변수에서 읽는다 */
    public ReaderPageFetcher(CrawlJobConfig config) {
        this(config, System.getenv(config.getReader().getApiKeyEnv()));
    }

    public ReaderPageFetcher(CrawlJobConfig config, String apiKey) {
        this(config, apiKey, clientSender(config), defaultPolicy(config), Sleeper.SYSTEM);
    }

    /** 테스트용 생성자(송신 훅/정책/슬리퍼 주입) */
    public ReaderPageFetcher(CrawlJobConfig config, String apiKey, HttpSender sender,
                             RetryPolicy retryPolicy, Sleeper sleeper) {
        Objects.requireNonNull(config, "config");
        this.endpoint = URI.create(config.getReader().getEndpoint());
        this.timeout = config.getReader().getTimeout();
        this.apiKey = apiKey;
        this.sender = Objects.requireNonNull(sender, "sender");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        if (apiKey == null || apiKey.isBlank()) {
            LOG.warn("No reader API key ({} unset) - sending unauthenticated requests", config.getReader().getApiKeyEnv());
        }
    }

    private static HttpSender clientSender(CrawlJobConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getReader().getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static RetryPolicy defaultPolicy(CrawlJobConfig config) {
        return new DefaultRetryPolicy(config.getReader().getRetryAttempts(), config.getReader().getRetryBaseMs());
    }

    @Override
    public FetchOutcome fetch(String url) {
        Objects.requireNonNull(url, "url");
        HttpRequest req;
        try {
            req = buildRequest(url);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return FetchOutcome.failure(url, Failure.TRANSPORT, "cannot build request: " + e.getMessage(), e, 0);
        }

        int attempt = 1;
        while (true) {
            int status;
            String retryAfter = null;
            Exception error = null;
            HttpResponse<String> resp = null;
            try {
                resp = sender.send(req);
                status = resp.statusCode();
                retryAfter = resp.headers().firstValue("Retry-After").orElse(null);
            } catch (IOException e) {
                status = -1;
                error = e;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return FetchOutcome.failure(url, Failure.INTERRUPTED, "interrupted", ie, attempt - 1);
            }

            if (resp != null && status >= 200 && status < 300) {
                return parse(url, resp.body(), attempt - 1);
            }

            if (!retryPolicy.shouldRetry(status, attempt)) {
                return (status == -1)
                        ? FetchOutcome.failure(url, Failure.TRANSPORT, "reader unreachable: " + error, error, attempt - 1)
                        : FetchOutcome.failure(url, Failure.HTTP_STATUS, "reader returned HTTP " + status, null, attempt - 1);
            }

            Duration delay = retryPolicy.delayBefore(attempt + 1, retryAfter);
            LOG.debug("Reader retry {} for {} (status={}, delay={}ms)", attempt, url, status, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return FetchOutcome.failure(url, Failure.INTERRUPTED, "interrupted", ie, attempt - 1);
            }
            attempt++;
        }
    }

    HttpRequest buildRequest(String url) throws JsonProcessingException {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("url", url);
        payload.put("options", "Markdown");

        HttpRequest.Builder b = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("X-No-Cache", "true")
                .header("X-With-Links-Summary", "true")
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(payload)));
        if (apiKey != null && !apiKey.isBlank()) b.header("Authorization", "Bearer " + apiKey);
        return b.build();
    }

    /** 응답 본문 → PageContent. data 래퍼가 없으면 최상위에서 읽는다. */
    static FetchOutcome parse(String url, String body, int retries) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            return FetchOutcome.failure(url, Failure.PARSE, "invalid reader JSON: " + e.getOriginalMessage(), e, retries);
        }
        if (root == null || !root.isObject()) {
            return FetchOutcome.failure(url, Failure.PARSE, "reader response is not a JSON object", null, retries);
        }
        JsonNode data = root.has("data") ? root.get("data") : root;

        String content = data.path("content").asText("");
        if (content.isBlank()) {
            return FetchOutcome.failure(url, Failure.EMPTY_CONTENT, "no content returned", null, retries);
        }

        PageContent pc = PageContent.builder()
                .url(url)
                .title(data.path("title").isTextual() ? data.get("title").asText() : null)
                .content(content)
                .links(urls(url, data.path("links")))
                .images(urls(url, data.path("images")))
                .build();
        return FetchOutcome.success(pc, retries);
    }

    /** {"title": "url", ...} 또는 ["url", {"url": ...}] 형태 모두 지원. 상대 URL은 page 기준 절대화 */
    private static List<String> urls(String pageUrl, JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) return out;
        Iterator<JsonNode> it = node.elements();   // object → values, array → elements
        while (it.hasNext()) {
            JsonNode n = it.next();
            String v = n.isTextual() ? n.asText()
                    : n.isObject() ? n.path("url").asText(n.path("href").asText(null))
                    : null;
            if (v != null && !v.isBlank()) out.add(absolutize(pageUrl, v.strip()));
        }
        return out;
    }

    private static String absolutize(String base, String link) {
        try {
            return URI.create(base).resolve(link).toString();
        } catch (IllegalArgumentException e) {
            return link;   // 정책 단계에서 MALFORMED 로 걸러짐
        }
    }
}
