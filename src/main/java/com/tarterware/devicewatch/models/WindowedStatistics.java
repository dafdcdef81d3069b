package com.tarterware.devicewatch.models;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Mean, population standard deviation and sample count computed over the most
 * recent values of a device buffer. Derived on demand, never stored.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class WindowedStatistics
{
    public static final WindowedStatistics EMPTY = new WindowedStatistics(0.0, 0.0, 0);

    private final double mean;

    private final double stdDev;

    private final int sampleCount;
}
