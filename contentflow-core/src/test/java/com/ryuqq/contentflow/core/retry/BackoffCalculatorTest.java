package com.ryuqq.contentflow.core.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BackoffCalculator 테스트.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void delayMillis_GrowsExponentiallyWithinJitterBounds() {
        // Given
        BackoffCalculator calculator = new BackoffCalculator(1000, 30000, 0.1);

        // When & Then
        for (int i = 0; i < 50; i++) {
            long first = calculator.delayMillis(1);
            long second = calculator.delayMillis(2);
            long third = calculator.delayMillis(3);
            assertTrue(first >= 1000 && first <= 1100, "first=" + first);
            assertTrue(second >= 2000 && second <= 2200, "second=" + second);
            assertTrue(third >= 4000 && third <= 4400, "third=" + third);
        }
    }

    @Test
    void delayMillis_CappedAtMaxDelay() {
        // Given
        BackoffCalculator calculator = new BackoffCalculator(1000, 30000, 0.1);

        // Then
        assertEquals(30000, calculator.delayMillis(6));
        assertEquals(30000, calculator.delayMillis(100));
    }

    @Test
    void delayMillis_NoJitter_IsDeterministic() {
        BackoffCalculator calculator = new BackoffCalculator(100, 10000, 0.0);

        assertEquals(100, calculator.delayMillis(1));
        assertEquals(800, calculator.delayMillis(4));
    }

    @Test
    void defaults_MatchDocumentedValues() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertEquals(1000, calculator.getBaseDelayMs());
        assertEquals(30000, calculator.getMaxDelayMs());
        assertEquals(0.1, calculator.getJitterFactor());
    }

    @Test
    void constructor_InvalidArguments_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(0, 1000, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(1000, 999, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(1000, 2000, 1.5));
    }

    @Test
    void delayMillis_NonPositiveAttempt_ThrowsException() {
        BackoffCalculator calculator = new BackoffCalculator();

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> calculator.delayMillis(0)
        );
        assertTrue(exception.getMessage().contains("failedAttempt must be positive"));
    }
}
