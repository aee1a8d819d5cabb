package com.pagefrontier.core.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagefrontier.core.api.FetchOutcome;
import com.pagefrontier.core.api.FetchOutcome.Failure;
import com.pagefrontier.core.model.CrawlJobConfig;
import com.pagefrontier.core.model.PageContent;
import com.pagefrontier.core.util.Sleeper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ReaderPageFetcherTest {

    private static final String PAGE = "https://docs.example.com/guide/intro";

    /** 테스트용 Sleeper: sleep(Duration) 호출 기록 */
    static class TestSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    /** 테스트용 HttpResponse<String> */
    static class Resp implements HttpResponse<String> {
        final int code; final Map<String, List<String>> headers; final String body;
        Resp(int code, Map<String, List<String>> headers, String body) {
            this.code = code; this.headers = headers; this.body = body;
        }
        Resp(int code, String body) { this(code, Map.of(), body); }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URI.create("https://r.jina.ai/"); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private static final String OK_BODY = "{\"code\":200,\"data\":{"
            + "\"title\":\"Intro\","
            + "\"content\":\"# Intro\\n\\nWelcome.\","
            + "\"links\":{\"Setup\":\"https://docs.example.com/guide/setup\",\"Rel\":\"../api/ref\"},"
            + "\"images\":{\"Logo\":\"https://docs.example.com/logo.png\"}}}";

    private static CrawlJobConfig cfg() {
        return CrawlJobConfig.defaults().setSeedUrls(List.of(PAGE));
    }

    private static ReaderPageFetcher fetcher(ReaderPageFetcher.HttpSender sender, TestSleeper sleeper) {
        return new ReaderPageFetcher(cfg(), "secret", sender, new DefaultRetryPolicy(3, 100), sleeper);
    }

    @Nested
    @DisplayName("응답 파싱")
    class Parsing {
        @Test
        void parses_content_title_links_and_images() {
            FetchOutcome out = fetcher(req -> new Resp(200, OK_BODY), new TestSleeper()).fetch(PAGE);

            assertThat(out.isSuccess()).isTrue();
            PageContent pc = out.getContent();
            assertThat(pc.getUrl()).isEqualTo(PAGE);
            assertThat(pc.getTitle()).isEqualTo("Intro");
            assertThat(pc.getContent()).startsWith("# Intro");
            assertThat(pc.getLinks()).containsExactly(
                    "https://docs.example.com/guide/setup", "https://docs.example.com/api/ref");
            assertThat(pc.getImages()).containsExactly("https://docs.example.com/logo.png");
            assertThat(out.getRetries()).isZero();
        }

        @Test
        void accepts_array_links_and_missing_title() {
            String body = "{\"data\":{\"content\":\"Body\",\"links\":[\"https://a.com/x\",{\"url\":\"https://a.com/y\"},\"\"]}}";
            FetchOutcome out = fetcher(req -> new Resp(200, body), new TestSleeper()).fetch(PAGE);

            assertThat(out.isSuccess()).isTrue();
            assertThat(out.getContent().getTitle()).isNull();
            assertThat(out.getContent().getLinks()).containsExactly("https://a.com/x", "https://a.com/y");
            assertThat(out.getContent().getImages()).isEmpty();
        }

        @Test
        void empty_content_is_a_failure() {
            FetchOutcome out = fetcher(req -> new Resp(200, "{\"data\":{\"content\":\"  \"}}"), new TestSleeper()).fetch(PAGE);
            assertThat(out.isSuccess()).isFalse();
            assertThat(out.getFailure()).isEqualTo(Failure.EMPTY_CONTENT);
        }

        @Test
        void invalid_json_is_a_parse_failure() {
            FetchOutcome out = fetcher(req -> new Resp(200, "<html>oops</html>"), new TestSleeper()).fetch(PAGE);
            assertThat(out.getFailure()).isEqualTo(Failure.PARSE);
            assertThat(out.getCause()).isNotNull();
        }
    }

    @Nested
    @DisplayName("재시도")
    class Retries {
        @Test
        void retry_after_is_honored_on_429_and_succeeds_on_second_attempt() {
            AtomicInteger calls = new AtomicInteger();
            TestSleeper sleeper = new TestSleeper();
            FetchOutcome out = fetcher(req -> calls.incrementAndGet() == 1
                    ? new Resp(429, Map.of("Retry-After", List.of("1")), "slow down")
                    : new Resp(200, OK_BODY), sleeper).fetch(PAGE);

            assertThat(out.isSuccess()).isTrue();
            assertThat(out.getRetries()).isEqualTo(1);
            assertThat(calls.get()).isEqualTo(2);
            assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1));
        }

        @Test
        void transport_errors_are_retried_then_reported() {
            AtomicInteger calls = new AtomicInteger();
            TestSleeper sleeper = new TestSleeper();
            FetchOutcome out = fetcher(req -> {
                calls.incrementAndGet();
                throw new IOException("connection reset");
            }, sleeper).fetch(PAGE);

            assertThat(out.getFailure()).isEqualTo(Failure.TRANSPORT);
            assertThat(out.getCause()).isInstanceOf(IOException.class);
            assertThat(calls.get()).isEqualTo(3);
            assertThat(sleeper.sleeps).hasSize(2);
            assertThat(out.getRetries()).isEqualTo(2);
        }

        @Test
        void client_errors_are_not_retried() {
            AtomicInteger calls = new AtomicInteger();
            FetchOutcome out = fetcher(req -> {
                calls.incrementAndGet();
                return new Resp(404, "{}");
            }, new TestSleeper()).fetch(PAGE);

            assertThat(out.getFailure()).isEqualTo(Failure.HTTP_STATUS);
            assertThat(out.getMessage()).contains("404");
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        void interrupt_during_backoff_stops_and_restores_flag() {
            Sleeper interrupting = d -> { throw new InterruptedException("stop"); };
            ReaderPageFetcher f = new ReaderPageFetcher(cfg(), "k", req -> new Resp(503, ""),
                    new DefaultRetryPolicy(), interrupting);
            try {
                FetchOutcome out = f.fetch(PAGE);
                assertThat(out.getFailure()).isEqualTo(Failure.INTERRUPTED);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted(); // 다음 테스트에 영향 없도록 플래그 정리
            }
        }
    }

    @Test
    @DisplayName("reader 요청 형식: POST JSON + 헤더")
    void sends_expected_request_to_local_reader() throws Exception {
        AtomicReference<String> method = new AtomicReference<>();
        AtomicReference<String> auth = new AtomicReference<>();
        AtomicReference<String> linksHeader = new AtomicReference<>();
        AtomicReference<String> noCache = new AtomicReference<>();
        AtomicReference<String> requestBody = new AtomicReference<>();

        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            method.set(ex.getRequestMethod());
            auth.set(ex.getRequestHeaders().getFirst("Authorization"));
            linksHeader.set(ex.getRequestHeaders().getFirst("X-With-Links-Summary"));
            noCache.set(ex.getRequestHeaders().getFirst("X-No-Cache"));
            requestBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = OK_BODY.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "application/json");
            ex.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(bytes); }
        });
        server.start();
        try {
            CrawlJobConfig cfg = cfg();
            cfg.getReader()
                    .setEndpoint("http://127.0.0.1:" + server.getAddress().getPort() + "/")
                    .setTimeoutMs(5000);

            try (ReaderPageFetcher f = new ReaderPageFetcher(cfg, "secret")) {
                FetchOutcome out = f.fetch(PAGE);
                assertThat(out.isSuccess()).isTrue();
            }

            assertThat(method.get()).isEqualTo("POST");
            assertThat(auth.get()).isEqualTo("Bearer secret");
            assertThat(linksHeader.get()).isEqualTo("true");
            assertThat(noCache.get()).isEqualTo("true");
            JsonNode sent = new ObjectMapper().readTree(requestBody.get());
            assertThat(sent.get("url").asText()).isEqualTo(PAGE);
            assertThat(sent.get("options").asText()).isEqualTo("Markdown");
        } finally {
            server.stop(0);
        }
    }

    @Test
    void no_api_key_means_no_authorization_header() throws Exception {
        ReaderPageFetcher f = new ReaderPageFetcher(cfg(), null, req -> new Resp(200, OK_BODY),
                new DefaultRetryPolicy(), new TestSleeper());
        HttpRequest req = f.buildRequest(PAGE);
        assertThat(req.headers().firstValue("Authorization")).isEmpty();
        assertThat(req.headers().firstValue("Accept")).contains("application/json");
        assertThat(req.method()).isEqualTo("POST");
    }
}
