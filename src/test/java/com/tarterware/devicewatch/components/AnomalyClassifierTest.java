package com.tarterware.devicewatch.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tarterware.devicewatch.models.AnalyticsResult;
import com.tarterware.devicewatch.models.WindowedStatistics;

class AnomalyClassifierTest
{
    private BufferRegistry bufferRegistry;

    private AnomalyClassifier anomalyClassifier;

    @BeforeEach
    void setup()
    {
        bufferRegistry = new BufferRegistry(1000);
        anomalyClassifier = new AnomalyClassifier(bufferRegistry, 50);
    }

    @Test
    void testInvalidWindowSize()
    {
        assertThrows(IllegalArgumentException.class, () -> new AnomalyClassifier(bufferRegistry, 0));
    }

    @Test
    void testThresholdBoundaryIsStrict()
    {
        // mean 10, stdDev 2: 14 is exactly two deviations out.
        WindowedStatistics stats = new WindowedStatistics(10.0, 2.0, 50);

        double atThreshold = AnomalyClassifier.zScore(10.0 + 2.0 * 2.0, stats);
        assertEquals(2.0, atThreshold, 0.0);
        assertFalse(AnomalyClassifier.isAnomaly(atThreshold));

        double pastThreshold = AnomalyClassifier.zScore(10.0 + 2.0001 * 2.0, stats);
        assertTrue(AnomalyClassifier.isAnomaly(pastThreshold));

        // Symmetric below the mean.
        assertFalse(AnomalyClassifier.isAnomaly(AnomalyClassifier.zScore(6.0, stats)));
        assertTrue(AnomalyClassifier.isAnomaly(AnomalyClassifier.zScore(10.0 - 2.0001 * 2.0, stats)));
    }

    @Test
    void testDegenerateStatisticsScoreZero()
    {
        // Empty window, single sample, and no spread all score 0.
        assertEquals(0.0, AnomalyClassifier.zScore(99.0, WindowedStatistics.EMPTY), 0.0);
        assertEquals(0.0, AnomalyClassifier.zScore(99.0, new WindowedStatistics(5.0, 0.0, 1)), 0.0);
        assertEquals(0.0, AnomalyClassifier.zScore(99.0, new WindowedStatistics(5.0, 0.0, 20)), 0.0);

        // A single sample never scores, even if the statistics claim a spread.
        assertEquals(0.0, AnomalyClassifier.zScore(99.0, new WindowedStatistics(5.0, 1.0, 1)), 0.0);
    }

    @Test
    void testUnknownDeviceIsNormal()
    {
        AnalyticsResult result = anomalyClassifier.classify("ghost", 123.0, 1700000000L);

        assertEquals("ghost", result.getDeviceId());
        assertEquals(0.0, result.getRollingAverage(), 0.0);
        assertEquals(0.0, result.getZscore(), 0.0);
        assertFalse(result.isAnomaly());
        assertEquals(1700000000L, result.getTimestamp());
        assertEquals(123.0, result.getValue(), 0.0);

        // Classification never creates a buffer.
        assertEquals(0, bufferRegistry.size());
    }

    @Test
    void testAllEqualValuesNeverAnomalous()
    {
        DeviceBuffer buffer = bufferRegistry.getOrCreate("flat");
        for (int i = 0; i < 20; i++)
        {
            buffer.append(30.0);
        }

        AnalyticsResult result = anomalyClassifier.classify("flat", 30.0, 1L);
        assertEquals(30.0, result.getRollingAverage(), 0.0);
        assertEquals(0.0, result.getZscore(), 0.0);
        assertFalse(result.isAnomaly());
    }

    @Test
    void testSpikeIncludedInItsOwnBaseline()
    {
        DeviceBuffer buffer = bufferRegistry.getOrCreate("d1");
        for (int i = 0; i < 10; i++)
        {
            buffer.append(50.0);
        }
        buffer.append(95.0);

        AnalyticsResult result = anomalyClassifier.classify("d1", 95.0, 11L);

        // Ten equal values plus one outlier: the outlier's z-score is sqrt(10)
        // whatever the two values are.
        assertEquals(595.0 / 11.0, result.getRollingAverage(), 0.0001);
        assertEquals(Math.sqrt(10.0), result.getZscore(), 0.0001);
        assertTrue(result.isAnomaly());
    }

    @Test
    void testClassificationDoesNotMutateBuffer()
    {
        DeviceBuffer buffer = bufferRegistry.getOrCreate("d1");
        buffer.append(1.0);
        buffer.append(2.0);

        anomalyClassifier.classify("d1", 1000.0, 3L);

        assertEquals(2, buffer.size());
    }
}
