package com.newscorpus.core.http;

import com.newscorpus.core.api.IFetcher;
import com.newscorpus.core.model.FetchResult;
import com.newscorpus.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호출자 수준의 선택적 재시도 데코레이터.
 * 마지막 시도 결과(성공이든 실패든)를 그대로 돌려준다.
 */
public final class RetryingFetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingFetcher.class);

    private final IFetcher delegate;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final AtomicInteger retries = new AtomicInteger();

    public RetryingFetcher(IFetcher delegate, RetryPolicy policy, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public FetchResult fetch(URI url) {
        int attempt = 1;
        while (true) {
            FetchResult r = delegate.fetch(url);
            if (attempt >= policy.maxAttempts() || !policy.shouldRetry(r, attempt)) {
                return r;
            }
            LOG.info("Retrying {} after {} (attempt {}/{})", url, r.describe(), attempt + 1, policy.maxAttempts());
            try {
                sleeper.sleep(policy.nextDelay(attempt));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return r;
            }
            retries.incrementAndGet();
            attempt++;
        }
    }

    /** 누적 재시도 횟수 */
    public int getRetryCount() { return retries.get(); }

    @Override
    public void close() throws Exception {
        delegate.close();
    }
}
