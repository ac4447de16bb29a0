package io.possync.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RetryPolicyTest {

    @Test
    void backoffDoublesUpToTheCap() {
        RetryPolicy policy = new RetryPolicy(6, 1_000L, 5_000L);
        Assertions.assertEquals(1_000L, policy.delayAfterAttempt(1));
        Assertions.assertEquals(2_000L, policy.delayAfterAttempt(2));
        Assertions.assertEquals(4_000L, policy.delayAfterAttempt(3));
        Assertions.assertEquals(5_000L, policy.delayAfterAttempt(4));
        Assertions.assertEquals(5_000L, policy.delayAfterAttempt(40));
        Assertions.assertTrue(policy.hasAttemptAfter(5));
        Assertions.assertFalse(policy.hasAttemptAfter(6));
    }

    @Test
    void invalidBoundsAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 0L, 0L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 500L, 100L));
        Assertions.assertFalse(RetryPolicy.none().hasAttemptAfter(1));
    }
}
