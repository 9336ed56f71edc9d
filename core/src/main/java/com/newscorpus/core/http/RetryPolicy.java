package com.newscorpus.core.http;

import com.newscorpus.core.model.FetchResult;

import java.time.Duration;

/** 실패한 fetch 를 다시 시도할지, 얼마나 기다릴지 정한다. {@link RetryingFetcher} 가 사용한다. */
public interface RetryPolicy {
    /** attempt 는 방금 끝난 시도 번호(1부터). */
    boolean shouldRetry(FetchResult result, int attempt);
    /** attempt 번째 시도가 실패한 뒤의 대기 시간 */
    Duration nextDelay(int attempt);
    /** 첫 시도를 포함한 최대 시도 횟수. 1이면 재시도 없음. */
    int maxAttempts();
}
