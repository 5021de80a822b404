package com.communitychat.client;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;

class ReconnectPolicyTest {

    private static final int ABNORMAL_CLOSURE = 1006;

    @Test
    void backsOffExponentiallyThenGivesUp() {
        ReconnectPolicy policy = new ReconnectPolicy();

        List<Long> delays = new ArrayList<>();
        OptionalLong delay;
        while ((delay = policy.nextDelay(ABNORMAL_CLOSURE)).isPresent()) {
            delays.add(delay.getAsLong());
        }

        assertThat(delays).containsExactly(1000L, 2000L, 4000L, 8000L, 16000L);
        assertThat(policy.getAttempts()).isEqualTo(5);
    }

    @Test
    void normalCloseDoesNotReconnect() {
        assertThat(new ReconnectPolicy().nextDelay(ReconnectPolicy.NORMAL_CLOSURE)).isEmpty();
    }

    @Test
    void successfulJoinResetsBackoff() {
        ReconnectPolicy policy = new ReconnectPolicy();
        policy.nextDelay(ABNORMAL_CLOSURE);
        policy.nextDelay(ABNORMAL_CLOSURE);

        policy.reset();

        assertThat(policy.nextDelay(ABNORMAL_CLOSURE)).hasValue(1000L);
    }

    @Test
    void stoppedPolicyNeverReconnects() {
        ReconnectPolicy policy = new ReconnectPolicy();
        policy.stop();
        policy.reset();

        assertThat(policy.nextDelay(ABNORMAL_CLOSURE)).isEmpty();
    }
}
