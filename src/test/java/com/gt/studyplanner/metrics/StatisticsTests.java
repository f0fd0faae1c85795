package com.gt.studyplanner.metrics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StatisticsTests {

    private static final List<Double> TEST_VALUES = List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0);

    @Test
    public void testStdDev() {
        assertEquals(2.0, Statistics.populationStdDev(TEST_VALUES), 0.0001);
        assertEquals(Math.sqrt(32.0 / 7), Statistics.sampleStdDev(TEST_VALUES), 0.0001);
        assertEquals(0, Statistics.sampleStdDev(List.of(3.0)));
        assertEquals(0, Statistics.populationStdDev(List.of()));
    }

    @Test
    public void testConsistency() {
        assertEquals(100, Statistics.consistency(List.of(10.0, 10.0, 10.0), true), 0.0001);
        assertEquals(100 - Math.sqrt(50) / 85 * 100, Statistics.consistency(List.of(80.0, 90.0), true), 0.0001);
        assertEquals(0, Statistics.consistency(List.of(0.0, 0.0), false));
        assertEquals(0, Statistics.consistency(List.of(75.0), true));
        // a coefficient of variation above 1 floors at 0
        assertEquals(0, Statistics.consistency(List.of(0.0, 0.0, 0.0, 30.0), false));
    }

    @Test
    public void testCorrelationWithIndex() {
        assertEquals(1.0, Statistics.correlationWithIndex(List.of(1.0, 2.0, 3.0, 4.0)), 0.0001);
        assertEquals(-1.0, Statistics.correlationWithIndex(List.of(8.0, 6.0, 4.0)), 0.0001);
        assertEquals(0, Statistics.correlationWithIndex(List.of(5.0, 5.0, 5.0)));
        assertEquals(0, Statistics.correlationWithIndex(List.of(5.0)));
        assertEquals(1.0, Statistics.correlationWithIndex(List.of(1e-6, 2e-6, 3e-6)), 0.0001);
        assertEquals(0, Statistics.correlationWithIndex(List.of(0.1 + 0.2, 0.3, 0.3)), 0.0001);
    }

    @Test
    public void testRoundAndClamp() {
        assertEquals(3.14, Statistics.round(3.14159, 2));
        assertEquals(0, Statistics.clamp(-4, 0, 100));
        assertEquals(100, Statistics.clamp(140, 0, 100));
        assertEquals(42, Statistics.clamp(42, 0, 100));
    }
}
