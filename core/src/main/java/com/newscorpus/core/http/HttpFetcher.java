package com.newscorpus.core.http;

import com.newscorpus.core.api.IFetcher;
import com.newscorpus.core.config.CrawlerConfig;
import com.newscorpus.core.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * 설정(헤더/타임아웃/인증서 정책/인코딩)을 적용한 단일 GET.
 * - 본문은 바이트로 받고 설정된 encoding 으로만 해석(서버 선언 charset 무시)
 * - I/O 실패는 TRANSPORT_ERROR, 비 2xx 는 HTTP_ERROR 로 구분
 * - 재시도 없음, 쿠키 저장 없음
 */
public class HttpFetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws Exception;
    }

    private final CrawlerConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpFetcher(CrawlerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        HttpClient.Builder b = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getTimeout());
        if (!config.isVerifyCertificate()) {
            b.sslContext(trustAllContext());
        }
        this.client = b.build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(CrawlerConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(URI url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpRequest req = buildRequest(url, config.getTimeout());

            HttpResponse<byte[]> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofByteArray());

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            FetchResult result = FetchResult.builder()
                    .url(url)
                    .statusCode(resp.statusCode())
                    .body(resp.body())
                    .charset(config.getCharset())
                    .elapsedMs(elapsedMs)
                    .outcomeFromStatus()
                    .build();
            LOG.debug("GET {} -> {} ({} ms)", url, resp.statusCode(), elapsedMs);
            return result;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return transportError(url, start, "interrupted");
        } catch (Exception e) {
            // HttpTimeoutException, ConnectException, UnresolvedAddress 등 모두 여기로
            LOG.debug("GET {} failed: {}", url, e.toString());
            return transportError(url, start, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private HttpRequest buildRequest(URI url, Duration timeout) {
        HttpRequest.Builder rb = HttpRequest.newBuilder(url).timeout(timeout).GET();
        for (Map.Entry<String, String> h : config.getHeaders().entrySet()) {
            try {
                rb.header(h.getKey(), h.getValue());
            } catch (IllegalArgumentException restricted) {
                // Host/Connection 등 JDK 가 직접 관리하는 헤더는 설정할 수 없음
                LOG.warn("Header '{}' skipped: {}", h.getKey(), restricted.getMessage());
            }
        }
        return rb.build();
    }

    private FetchResult transportError(URI url, long startNs, String error) {
        long elapsedMs = (System.nanoTime() - startNs) / 1_000_000;
        return FetchResult.transportError(url, config.getCharset(), elapsedMs, error);
    }

    /** should_verify_certificate=false 용. 인증서 체인 검증 생략 */
    static SSLContext trustAllContext() {
        TrustManager[] trustAll = { new X509TrustManager() {
            @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {}
            @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
            @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
        }};
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, trustAll, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot create trust-all SSL context", e);
        }
    }
}
