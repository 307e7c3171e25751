package com.tempo.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

import java.time.Duration;

import org.junit.Test;

public class RetryPolicyTest {

    @Test
    public void defaultMakesOneAttempt() {
        assertThat(RetryPolicy.none().getMaxAttempts(), is(1));
        assertThat(RetryPolicy.none().shouldRetry(1), is(false));
    }

    @Test
    public void retriesUpToMaxAttempts() {
        RetryPolicy p = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(60));
        assertThat(p.shouldRetry(1), is(true));
        assertThat(p.shouldRetry(2), is(true));
        assertThat(p.shouldRetry(3), is(false));
    }

    @Test
    public void delayGrowsWithJitterAndIsCapped() {
        RetryPolicy p = new RetryPolicy(10, Duration.ofMillis(1000), Duration.ofMillis(5000));
        for (int i = 0; i < 50; i++) {
            long first = p.delayAfter(1).toMillis();
            long third = p.delayAfter(3).toMillis();
            long tenth = p.delayAfter(10).toMillis();
            assertThat("first " + first, first >= 800 && first <= 1200, is(true));
            assertThat("third " + third, third >= 3200 && third <= 4800, is(true));
            assertThat("tenth " + tenth, tenth >= 4000 && tenth <= 6000, is(true));
        }
    }

    @Test
    public void rejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(2, Duration.ofMillis(-1), Duration.ZERO));
    }
}
