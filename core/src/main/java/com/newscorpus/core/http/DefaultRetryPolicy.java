package com.newscorpus.core.http;

import com.newscorpus.core.model.FetchResult;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 전송 오류와 429/5xx 만 재시도한다. 그 밖의 4xx 는 첫 결과를 그대로 쓴다.
 * 대기: BASE_DELAY × 2^(attempt-1), 상한 MAX_DELAY, ±10% 지터.
 * BASE_DELAY 는 요청 사이 최소 페이싱 간격(1s)과 같다.
 */
public final class DefaultRetryPolicy implements RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration MAX_DELAY = Duration.ofSeconds(30);

    private final int maxAttempts;
    private final Duration base;

    public DefaultRetryPolicy() { this(DEFAULT_MAX_ATTEMPTS, BASE_DELAY); }

    public DefaultRetryPolicy(int maxAttempts) { this(maxAttempts, BASE_DELAY); }

    public DefaultRetryPolicy(int maxAttempts, Duration base) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.base = (base == null || base.isNegative() || base.isZero()) ? BASE_DELAY : base;
    }

    @Override
    public boolean shouldRetry(FetchResult result, int attempt) {
        if (attempt >= maxAttempts || result.isSuccess()) return false;
        if (result.getOutcome() == FetchResult.Outcome.TRANSPORT_ERROR) return true;
        int sc = result.getStatusCode();
        return sc == 429 || sc >= 500;
    }

    @Override
    public Duration nextDelay(int attempt) {
        int shift = Math.min(16, Math.max(0, attempt - 1));
        long raw = Math.min(base.toMillis() << shift, MAX_DELAY.toMillis());
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
