package com.tarterware.devicewatch.components;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tarterware.devicewatch.models.AnalyticsResult;
import com.tarterware.devicewatch.models.WindowedStatistics;

/**
 * Classifies a sample as anomalous when its z-score against the device's
 * rolling window exceeds {@link #Z_SCORE_THRESHOLD} in magnitude.
 * 
 * <p>
 * The window is read after the sample has been appended, so the sample is part
 * of its own baseline. Classification only reads the buffer.
 * </p>
 */
@Component
public class AnomalyClassifier
{
    public static final double Z_SCORE_THRESHOLD = 2.0;

    // Fewer samples than this and the deviation is meaningless.
    public static final int MIN_SAMPLES_FOR_SCORE = 2;

    private final BufferRegistry bufferRegistry;

    private final int windowSize;

    private static final Logger logger = LoggerFactory.getLogger(AnomalyClassifier.class);

    /**
     * @param bufferRegistry registry holding the device buffers
     * @param windowSize     number of trailing samples forming the baseline
     * @throws IllegalArgumentException if windowSize is less than 1
     */
    public AnomalyClassifier(BufferRegistry bufferRegistry,
            @Value("${com.tarterware.devicewatch.window-size:50}") int windowSize)
    {
        if (windowSize < 1)
        {
            throw new IllegalArgumentException("Window size must be at least 1");
        }
        this.bufferRegistry = bufferRegistry;
        this.windowSize = windowSize;
    }

    /**
     * Scores a value against the current window of its device.
     *
     * @param deviceId  the device the value came from
     * @param value     the value to classify
     * @param timestamp the sample timestamp, carried into the result
     * @return the classification; a device with no buffer scores 0
     */
    public AnalyticsResult classify(String deviceId, double value, long timestamp)
    {
        WindowedStatistics stats = bufferRegistry.find(deviceId).map(buffer -> buffer.windowStats(windowSize))
                .orElse(WindowedStatistics.EMPTY);

        double zScore = zScore(value, stats);
        boolean anomaly = isAnomaly(zScore);

        if (anomaly)
        {
            logger.warn("Anomaly detected! Device: {}, Value: {}, Z-Score: {}", deviceId,
                    String.format("%.2f", value), String.format("%.2f", zScore));
        }
        else
        {
            logger.debug("Device {} value {} z-score {}", deviceId, value, zScore);
        }

        return new AnalyticsResult(deviceId, stats.getMean(), zScore, anomaly, timestamp, value);
    }

    /**
     * Computes the z-score of a value against window statistics.
     *
     * @return the z-score, or 0 when the window holds fewer than two samples or
     *         has no spread
     */
    public static double zScore(double value, WindowedStatistics stats)
    {
        if (stats.getSampleCount() < MIN_SAMPLES_FOR_SCORE || stats.getStdDev() == 0.0)
        {
            return 0.0;
        }
        return (value - stats.getMean()) / stats.getStdDev();
    }

    public static boolean isAnomaly(double zScore)
    {
        return Math.abs(zScore) > Z_SCORE_THRESHOLD;
    }

    public int getWindowSize()
    {
        return windowSize;
    }
}
