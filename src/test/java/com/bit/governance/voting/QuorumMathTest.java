package com.bit.governance.voting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QuorumMathTest {

    @Test
    void requiredQuorumFloorsTheProduct() {
        assertEquals(500_000, QuorumMath.requiredQuorum(1_000_000, 5000));
        assertEquals(0, QuorumMath.requiredQuorum(1, 5000));
        assertEquals(3, QuorumMath.requiredQuorum(7, 5000));
        assertEquals(7, QuorumMath.requiredQuorum(7, 10_000));
    }

    @Test
    void largeTotalsDoNotOverflow() {
        long total = Long.MAX_VALUE / 2;
        assertEquals(total, QuorumMath.requiredQuorum(total, 10_000));
        assertEquals(total / 2, QuorumMath.requiredQuorum(total, 5000));
    }

    @Test
    void thresholdOutsideBasisPointRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> QuorumMath.requiredQuorum(100, 0));
        assertThrows(IllegalArgumentException.class, () -> QuorumMath.requiredQuorum(100, 10_001));
    }

    @Test
    void quorumIsInclusive() {
        assertTrue(QuorumMath.isQuorumReached(500_000, 1_000_000, 5000));
        assertFalse(QuorumMath.isQuorumReached(499_999, 1_000_000, 5000));
    }

    @Test
    void passingNeedsQuorumAndStrictMajority() {
        assertTrue(QuorumMath.isPassed(600_000, 0, 1_000_000, 5000));
        assertFalse(QuorumMath.isPassed(250_000, 250_000, 1_000_000, 5000));
        assertFalse(QuorumMath.isPassed(400_000, 0, 1_000_000, 5000));
        assertFalse(QuorumMath.isPassed(200_000, 400_000, 1_000_000, 5000));
    }
}
