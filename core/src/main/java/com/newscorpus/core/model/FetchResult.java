package com.newscorpus.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * 단일 GET 의 결과. 호출마다 새로 만들고 호출자가 즉시 소비한다(캐시하지 않음).
 * 본문은 바이트로 보관하고, 디코딩은 설정된 charset 으로만 한다.
 */
public final class FetchResult {

    public enum Outcome {
        SUCCESS,
        /** DNS/연결/타임아웃 등 응답 자체를 못 받은 경우 */
        TRANSPORT_ERROR,
        /** 응답은 받았으나 2xx 가 아님 */
        HTTP_ERROR
    }

    private final URI url;
    private final int statusCode;
    private final byte[] body;
    private final Charset charset;
    private final Outcome outcome;
    private final long elapsedMs;
    private final String error;

    private FetchResult(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.body = (b.body == null) ? new byte[0] : b.body;
        this.charset = (b.charset == null) ? StandardCharsets.UTF_8 : b.charset;
        this.outcome = b.outcome;
        this.elapsedMs = b.elapsedMs;
        this.error = b.error;
    }

    public URI getUrl() { return url; }
    /** 응답을 받지 못했으면 -1 */
    public int getStatusCode() { return statusCode; }
    /** 본문 바이트 수 */
    public int getBodyLength() { return body.length; }
    public Charset getCharset() { return charset; }
    public Outcome getOutcome() { return outcome; }
    public long getElapsedMs() { return elapsedMs; }
    public Optional<String> getError() { return Optional.ofNullable(error); }

    public boolean isSuccess() { return outcome == Outcome.SUCCESS; }

    /** 설정된 charset 으로 디코딩한 본문 (서버가 선언한 charset 은 무시) */
    public String text() { return new String(body, charset); }

    /** 로그용 한 줄 요약 */
    public String describe() {
        return switch (outcome) {
            case SUCCESS -> "HTTP " + statusCode;
            case HTTP_ERROR -> "HTTP " + statusCode + " (non-2xx)";
            case TRANSPORT_ERROR -> "transport error: " + (error == null ? "unknown" : error);
        };
    }

    public static FetchResult transportError(URI url, Charset charset, long elapsedMs, String error) {
        return builder().url(url).statusCode(-1).charset(charset)
                .outcome(Outcome.TRANSPORT_ERROR).elapsedMs(elapsedMs).error(error).build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode = -1;
        private byte[] body;
        private Charset charset;
        private Outcome outcome;
        private long elapsedMs;
        private String error;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder charset(Charset charset) { this.charset = charset; return this; }
        public Builder outcome(Outcome outcome) { this.outcome = outcome; return this; }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }
        public Builder error(String error) { this.error = error; return this; }

        /** 상태코드로 SUCCESS/HTTP_ERROR 를 정한다 */
        public Builder outcomeFromStatus() {
            this.outcome = (statusCode >= 200 && statusCode < 300) ? Outcome.SUCCESS : Outcome.HTTP_ERROR;
            return this;
        }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(outcome, "outcome");
            return new FetchResult(this);
        }
    }
}
