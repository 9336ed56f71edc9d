package com.newscorpus.core.util;

import java.time.Duration;

/** 대기 추상화. 테스트에서는 실제로 자지 않는 구현을 주입한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** 실제 스레드 대기. null 이나 0 이하 간격이면 바로 돌아온다. */
    Sleeper SYSTEM = d -> {
        if (d != null && !d.isNegative() && !d.isZero()) Thread.sleep(d.toMillis());
    };
}
