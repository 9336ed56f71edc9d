package com.newscorpus.core.util;

import java.time.Duration;

/** 요청 사이 대기 시간을 정하는 정책 */
@FunctionalInterface
public interface JitterPolicy {
    Duration nextDelay();

    /** 대기 없음(테스트/로컬 전용) */
    JitterPolicy NONE = () -> Duration.ZERO;

    static JitterPolicy fixed(Duration d) { return () -> d; }
}
