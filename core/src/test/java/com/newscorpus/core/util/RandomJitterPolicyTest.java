package com.newscorpus.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RandomJitterPolicyTest {

    @Test
    void delays_stay_within_default_one_to_three_seconds() {
        RandomJitterPolicy p = new RandomJitterPolicy(Duration.ofSeconds(1), Duration.ofSeconds(3), new Random(42));
        for (int i = 0; i < 500; i++) {
            assertThat(p.nextDelay()).isBetween(Duration.ofSeconds(1), Duration.ofSeconds(3));
        }
    }

    @Test
    void lower_bound_never_drops_below_one_second() {
        RandomJitterPolicy p = new RandomJitterPolicy(Duration.ZERO, Duration.ofMillis(10), new Random(1));
        for (int i = 0; i < 100; i++) {
            assertThat(p.nextDelay()).isEqualTo(RandomJitterPolicy.FLOOR);
        }
    }
}
