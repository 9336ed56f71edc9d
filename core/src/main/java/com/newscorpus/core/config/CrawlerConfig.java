package com.newscorpus.core.config;

import java.net.URI;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Collections;

/**
 * 검증이 끝난 크롤러 설정 (불변).
 * 인스턴스는 {@link ConfigValidator} 만 만들 수 있다. 부분적으로 유효한 설정은 존재하지 않는다.
 */
public final class CrawlerConfig {

    /** total_articles_to_find_and_parse 상한 */
    public static final int MAX_ARTICLES = 150;
    /** timeout(초) 개구간 하한/상한: 0 < timeout < 60 */
    public static final int TIMEOUT_LOWER_LIMIT = 0;
    public static final int TIMEOUT_UPPER_LIMIT = 60;

    private final List<URI> seedUrls;
    private final int totalArticles;
    private final Map<String, String> headers;
    private final String encoding;
    private final int timeoutSeconds;
    private final boolean verifyCertificate;
    private final boolean headlessMode;

    CrawlerConfig(List<URI> seedUrls, int totalArticles, Map<String, String> headers,
                  String encoding, int timeoutSeconds, boolean verifyCertificate, boolean headlessMode) {
        this.seedUrls = List.copyOf(seedUrls);
        this.totalArticles = totalArticles;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.encoding = encoding;
        this.timeoutSeconds = timeoutSeconds;
        this.verifyCertificate = verifyCertificate;
        this.headlessMode = headlessMode;
    }

    public List<URI> getSeedUrls() { return seedUrls; }
    public int getTotalArticles() { return totalArticles; }
    public Map<String, String> getHeaders() { return headers; }
    public String getEncoding() { return encoding; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public boolean isVerifyCertificate() { return verifyCertificate; }

    /** 브라우저 기반 fetch 정책용 예약 플래그. 현재 HTTP fetch 경로에서는 사용하지 않는다. */
    public boolean isHeadlessMode() { return headlessMode; }

    public Duration getTimeout() { return Duration.ofSeconds(timeoutSeconds); }

    /** 검증 단계에서 지원 여부를 확인했으므로 여기서는 실패하지 않는다. */
    public Charset getCharset() { return Charset.forName(encoding); }

    @Override
    public String toString() {
        return "CrawlerConfig{seeds=" + seedUrls.size()
                + ", totalArticles=" + totalArticles
                + ", headers=" + headers.keySet()
                + ", encoding=" + encoding
                + ", timeout=" + timeoutSeconds + "s"
                + ", verify=" + verifyCertificate
                + ", headless=" + headlessMode + '}';
    }
}
