package com.newscorpus.core.http;

import com.newscorpus.core.TestConfigs;
import com.newscorpus.core.config.ConfigValidator;
import com.newscorpus.core.config.CrawlerConfig;
import com.newscorpus.core.model.FetchResult;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HttpFetcherTest {

    private HttpServer server;
    private String base;
    private final AtomicReference<String> seenUserAgent = new AtomicReference<>();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ru", ex -> {
            seenUserAgent.set(ex.getRequestHeaders().getFirst("User-Agent"));
            byte[] body = "<p>Привет, мир</p>".getBytes(Charset.forName("windows-1251"));
            // 서버는 utf-8 이라고 주장하지만 실제 바이트는 cp1251
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.createContext("/missing", ex -> {
            byte[] body = "gone".getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(404, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private static CrawlerConfig config(String encoding) {
        Map<String, Object> raw = TestConfigs.validRaw();
        raw.put(ConfigValidator.ENCODING, encoding);
        raw.put(ConfigValidator.HEADERS, Map.of("User-Agent", "newscorpus-test/1.0"));
        return ConfigValidator.validate(raw);
    }

    @Test
    void body_is_decoded_with_configured_encoding_not_server_charset() {
        HttpFetcher fetcher = new HttpFetcher(config("windows-1251"));

        FetchResult r = fetcher.fetch(URI.create(base + "/ru"));

        assertThat(r.getOutcome()).isEqualTo(FetchResult.Outcome.SUCCESS);
        assertThat(r.getStatusCode()).isEqualTo(200);
        assertThat(r.text()).isEqualTo("<p>Привет, мир</p>");
        assertThat(r.getBodyLength()).isEqualTo("<p>Привет, мир</p>".getBytes(Charset.forName("windows-1251")).length);
        assertThat(r.getElapsedMs()).isNotNegative();
        assertThat(seenUserAgent.get()).isEqualTo("newscorpus-test/1.0");
    }

    @Test
    void non_2xx_is_http_error_with_body_kept() {
        HttpFetcher fetcher = new HttpFetcher(config("utf-8"));

        FetchResult r = fetcher.fetch(URI.create(base + "/missing"));

        assertThat(r.getOutcome()).isEqualTo(FetchResult.Outcome.HTTP_ERROR);
        assertThat(r.isSuccess()).isFalse();
        assertThat(r.getStatusCode()).isEqualTo(404);
        assertThat(r.text()).isEqualTo("gone");
    }

    @Test
    void connection_refused_is_transport_error() throws IOException {
        int freePort;
        try (ServerSocket s = new ServerSocket(0)) { freePort = s.getLocalPort(); }
        HttpFetcher fetcher = new HttpFetcher(config("utf-8"));

        FetchResult r = fetcher.fetch(URI.create("http://127.0.0.1:" + freePort + "/news/"));

        assertThat(r.getOutcome()).isEqualTo(FetchResult.Outcome.TRANSPORT_ERROR);
        assertThat(r.getStatusCode()).isEqualTo(-1);
        assertThat(r.getError()).isPresent();
        assertThat(r.getBodyLength()).isZero();
    }

    // ---- 송신 훅 경로 ----

    static final class Resp implements HttpResponse<byte[]> {
        final int code; final byte[] body;
        Resp(int code, byte[] body) { this.code = code; this.body = body; }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<byte[]>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(Map.of(), (a, b) -> true); }
        @Override public byte[] body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URI.create("https://example.test/"); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    @Test
    void request_is_get_with_configured_timeout_and_headers() {
        AtomicReference<HttpRequest> captured = new AtomicReference<>();
        HttpFetcher fetcher = new HttpFetcher(config("utf-8"), req -> {
            captured.set(req);
            return new Resp(200, "ok".getBytes(StandardCharsets.UTF_8));
        });

        FetchResult r = fetcher.fetch(URI.create("https://example.test/news/"));

        assertThat(r.isSuccess()).isTrue();
        assertThat(captured.get().method()).isEqualTo("GET");
        assertThat(captured.get().timeout()).contains(Duration.ofSeconds(5));
        assertThat(captured.get().headers().firstValue("User-Agent")).contains("newscorpus-test/1.0");
    }

    @Test
    void restricted_header_is_skipped_not_fatal() {
        Map<String, Object> raw = TestConfigs.validRaw();
        raw.put(ConfigValidator.HEADERS, Map.of("Host", "evil.test", "Accept", "text/html"));
        CrawlerConfig cfg = ConfigValidator.validate(raw);
        AtomicReference<HttpRequest> captured = new AtomicReference<>();
        HttpFetcher fetcher = new HttpFetcher(cfg, req -> {
            captured.set(req);
            return new Resp(200, new byte[0]);
        });

        FetchResult r = fetcher.fetch(URI.create("https://example.test/news/"));

        assertThat(r.isSuccess()).isTrue();
        assertThat(captured.get().headers().firstValue("Accept")).contains("text/html");
        assertThat(captured.get().headers().firstValue("Host")).isEmpty();
    }

    @Test
    void sender_exception_becomes_transport_error() {
        HttpFetcher fetcher = new HttpFetcher(config("utf-8"), req -> {
            throw new java.net.http.HttpTimeoutException("request timed out");
        });

        FetchResult r = fetcher.fetch(URI.create("https://example.test/slow/"));

        assertThat(r.getOutcome()).isEqualTo(FetchResult.Outcome.TRANSPORT_ERROR);
        assertThat(r.getError()).hasValueSatisfying(e -> assertThat(e).contains("HttpTimeoutException"));
    }

    @Test
    void trust_all_context_is_available_for_disabled_verification() {
        assertThat(HttpFetcher.trustAllContext().getProtocol()).isEqualTo("TLS");
    }
}
