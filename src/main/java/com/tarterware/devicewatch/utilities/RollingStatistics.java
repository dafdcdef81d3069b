package com.tarterware.devicewatch.utilities;

import com.tarterware.devicewatch.models.WindowedStatistics;

/**
 * Computes the statistics (mean and population standard deviation) over the
 * trailing window of an ordered sequence of measurements.
 */
public class RollingStatistics
{
    private RollingStatistics()
    {
    }

    /**
     * Computes the statistics over the last {@code window} values. When fewer
     * values than the window are present, all of them are used.
     *
     * @param values the measurements in arrival order
     * @param window the number of trailing values to consider
     * @return the statistics; an empty window yields mean and standard deviation
     *         of 0, and a single value yields a standard deviation of 0
     * @throws IllegalArgumentException if window is less than 1
     */
    public static WindowedStatistics windowStats(double[] values, int window)
    {
        if (window < 1)
        {
            throw new IllegalArgumentException("Window must be at least 1");
        }
        if (values == null || values.length == 0)
        {
            return WindowedStatistics.EMPTY;
        }

        int start = Math.max(0, values.length - window);
        int n = values.length - start;

        double sum = 0.0;
        for (int i = start; i < values.length; i++)
        {
            sum += values[i];
        }
        double mean = sum / n;

        // Population variance; a lone value has no spread.
        double stdDev = 0.0;
        if (n > 1)
        {
            double sumSqDiff = 0.0;
            for (int i = start; i < values.length; i++)
            {
                double diff = values[i] - mean;
                sumSqDiff += diff * diff;
            }
            stdDev = Math.sqrt(sumSqDiff / n);
        }

        return new WindowedStatistics(mean, stdDev, n);
    }
}
