package peopleops.compensation.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RetryPolicy}.
 */
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(5);

    @Test
    void testNextFailureCount_incrementsByOne() {
        assertEquals(1, policy.nextFailureCount(0));
        assertEquals(5, policy.nextFailureCount(4));
    }

    @Test
    void testIsExhausted_onlyFromThreshold() {
        for (int count = 1; count < 5; count++) {
            assertFalse(policy.isExhausted(count), "count " + count + " must still retry");
        }
        assertTrue(policy.isExhausted(5));
        assertTrue(policy.isExhausted(6));
    }

    @Test
    void testFifthConsecutiveFailureExhausts() {
        int count = 0;
        int exhaustedAt = -1;
        for (int attempt = 1; attempt <= 5 && exhaustedAt < 0; attempt++) {
            count = policy.nextFailureCount(count);
            if (policy.isExhausted(count)) {
                exhaustedAt = attempt;
            }
        }
        assertEquals(5, exhaustedAt);
    }

    @Test
    void testRejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0));
    }
}
