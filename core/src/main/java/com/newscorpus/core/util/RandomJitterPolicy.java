package com.newscorpus.core.util;

import java.time.Duration;
import java.util.Random;

/**
 * [min, max] 구간의 균등 분포 지연. 하한은 1초 미만으로 내려가지 않는다.
 * 기본값 1~3초.
 */
public final class RandomJitterPolicy implements JitterPolicy {

    public static final Duration FLOOR = Duration.ofSeconds(1);

    private final long minMillis;
    private final long maxMillis;
    private final Random random;

    public RandomJitterPolicy() {
        this(Duration.ofSeconds(1), Duration.ofSeconds(3), new Random());
    }

    public RandomJitterPolicy(Duration min, Duration max, Random random) {
        long lo = Math.max(FLOOR.toMillis(), min.toMillis());
        long hi = Math.max(lo, max.toMillis());
        this.minMillis = lo;
        this.maxMillis = hi;
        this.random = random;
    }

    @Override
    public Duration nextDelay() {
        long span = maxMillis - minMillis;
        long extra = (span == 0) ? 0 : (long) (random.nextDouble() * (span + 1));
        return Duration.ofMillis(Math.min(maxMillis, minMillis + extra));
    }
}
