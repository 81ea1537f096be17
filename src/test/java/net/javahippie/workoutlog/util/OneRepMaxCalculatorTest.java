package net.javahippie.workoutlog.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OneRepMaxCalculator.
 */
class OneRepMaxCalculatorTest {

    @Test
    @DisplayName("Should apply the Epley formula")
    void testEstimate_Epley() {
        OptionalDouble estimate = OneRepMaxCalculator.estimate(100.0, 5);

        assertTrue(estimate.isPresent());
        assertEquals(116.67, estimate.getAsDouble(), 0.01);
    }

    @Test
    @DisplayName("Single rep should return the lifted weight")
    void testEstimate_SingleRep() {
        assertEquals(140.0, OneRepMaxCalculator.estimate(140.0, 1).getAsDouble(), 0.0001);
    }

    @Test
    @DisplayName("Should not estimate outside 1 to 10 reps or without weight")
    void testEstimate_OutOfRange() {
        assertTrue(OneRepMaxCalculator.estimate(60.0, 11).isEmpty());
        assertTrue(OneRepMaxCalculator.estimate(60.0, 0).isEmpty());
        assertTrue(OneRepMaxCalculator.estimate(null, 5).isEmpty());
        assertTrue(OneRepMaxCalculator.estimate(60.0, null).isEmpty());
    }
}
