package com.batchflow.test.domain;

import com.batchflow.domain.job.model.valobj.RetryDecision;
import com.batchflow.domain.job.service.BackoffFunction;
import com.batchflow.domain.job.service.DefaultRetryPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RetryPolicyTest {

    @Test
    public void shouldRetryImmediatelyWithoutBackoff() {
        DefaultRetryPolicy policy = new DefaultRetryPolicy(BackoffFunction.none());

        RetryDecision decision = policy.decide(0, 2, "boom");

        Assertions.assertEquals(RetryDecision.Kind.RETRY_NOW, decision.getKind());
        Assertions.assertTrue(decision.isRetry());
    }

    @Test
    public void shouldGiveUpWhenRetriesExhausted() {
        DefaultRetryPolicy policy = new DefaultRetryPolicy(BackoffFunction.fixed(100L));

        Assertions.assertEquals(RetryDecision.Kind.GIVE_UP, policy.decide(2, 2, "boom").getKind());
        Assertions.assertEquals(RetryDecision.Kind.GIVE_UP, policy.decide(0, 0, "boom").getKind());
        Assertions.assertFalse(policy.decide(3, 2, "boom").isRetry());
    }

    @Test
    public void shouldDelayRetryWithConfiguredBackoff() {
        DefaultRetryPolicy policy = new DefaultRetryPolicy(BackoffFunction.exponential(100L, 2D, 0L, false));

        RetryDecision first = policy.decide(0, 5, "boom");
        RetryDecision third = policy.decide(2, 5, "boom");

        Assertions.assertEquals(RetryDecision.Kind.RETRY_AFTER_DELAY, first.getKind());
        Assertions.assertEquals(100L, first.getDelayMs());
        Assertions.assertEquals(400L, third.getDelayMs());
    }

    @Test
    public void shouldCapExponentialBackoff() {
        BackoffFunction backoff = BackoffFunction.exponential(1000L, 3D, 5000L, false);

        Assertions.assertEquals(1000L, backoff.delayMs(1));
        Assertions.assertEquals(3000L, backoff.delayMs(2));
        Assertions.assertEquals(5000L, backoff.delayMs(3));
        Assertions.assertEquals(5000L, backoff.delayMs(20));
    }

    @Test
    public void shouldApplyJitterWithinHalfToFullDelay() {
        BackoffFunction lowest = BackoffFunction.exponential(1000L, 2D, 0L, true, () -> 0D);
        BackoffFunction highest = BackoffFunction.exponential(1000L, 2D, 0L, true, () -> 0.999D);

        Assertions.assertEquals(1000L, lowest.delayMs(2));
        Assertions.assertTrue(highest.delayMs(2) < 2000L);
        Assertions.assertTrue(highest.delayMs(2) >= 1990L);
    }

    @Test
    public void shouldBuildBackoffByName() {
        Assertions.assertEquals(0L, BackoffFunction.of("none", 500L, 0L, 2D, false).delayMs(3));
        Assertions.assertEquals(500L, BackoffFunction.of("fixed", 500L, 0L, 2D, false).delayMs(3));
        Assertions.assertEquals(1200L, BackoffFunction.of("LINEAR", 500L, 1200L, 2D, false).delayMs(3));
        Assertions.assertEquals(2000L, BackoffFunction.of("exponential", 500L, 0L, 2D, false).delayMs(3));
        Assertions.assertThrows(IllegalArgumentException.class, () -> BackoffFunction.of("random", 1L, 1L, 1D, false));
    }
}
