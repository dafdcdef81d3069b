package com.tarterware.devicewatch.components;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.tarterware.devicewatch.models.WindowedStatistics;
import com.tarterware.devicewatch.utilities.RollingStatistics;

/**
 * Bounded, append-only sequence of measurements for a single device, kept in a
 * fixed-size circular buffer. Once the buffer is full, each append replaces the
 * oldest value, so the buffer always holds the most recent {@code capacity}
 * values in arrival order.
 * 
 * <p>
 * Appends take an exclusive write lock; readers share a read lock, so a reader
 * never observes a partially applied append.
 * </p>
 */
public class DeviceBuffer
{
    // Device this buffer belongs to
    private final String deviceId;

    // Maximum number of measurements to retain
    private final int capacity;

    // Circular buffer to hold measurements
    private final double[] measurements;

    // Slot the next measurement is written into
    private int index = 0;

    // Current number of valid measurements in the buffer
    private int count = 0;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Constructs a new DeviceBuffer with the specified capacity.
     *
     * @param deviceId the device the measurements belong to
     * @param capacity the maximum number of measurements to retain
     * @throws IllegalArgumentException if capacity is less than 1
     */
    public DeviceBuffer(String deviceId, int capacity)
    {
        if (capacity < 1)
        {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.deviceId = deviceId;
        this.capacity = capacity;
        this.measurements = new double[capacity];
    }

    /**
     * Appends a measurement, evicting the oldest one if the buffer is full.
     *
     * @param value the measurement
     */
    public void append(double value)
    {
        lock.writeLock().lock();
        try
        {
            measurements[index] = value;
            index = (index + 1) % capacity;
            if (count < capacity)
            {
                count++;
            }
        }
        finally
        {
            lock.writeLock().unlock();
        }
    }

    /**
     * Copies the most recent measurements, oldest first.
     *
     * @param window the maximum number of measurements to copy
     * @return at most {@code window} measurements in arrival order
     * @throws IllegalArgumentException if window is less than 1
     */
    public double[] snapshotWindow(int window)
    {
        if (window < 1)
        {
            throw new IllegalArgumentException("Window must be at least 1");
        }

        lock.readLock().lock();
        try
        {
            int n = Math.min(window, count);
            double[] snapshot = new double[n];

            // The newest value sits just before index; walk back n slots.
            int start = (index - n + capacity) % capacity;
            for (int i = 0; i < n; i++)
            {
                snapshot[i] = measurements[(start + i) % capacity];
            }
            return snapshot;
        }
        finally
        {
            lock.readLock().unlock();
        }
    }

    /**
     * Computes the statistics over the most recent {@code window} measurements.
     *
     * @param window the number of trailing measurements to consider
     * @return the windowed statistics
     */
    public WindowedStatistics windowStats(int window)
    {
        return RollingStatistics.windowStats(snapshotWindow(window), window);
    }

    /**
     * Returns the current number of retained measurements.
     */
    public int size()
    {
        lock.readLock().lock();
        try
        {
            return count;
        }
        finally
        {
            lock.readLock().unlock();
        }
    }

    public int capacity()
    {
        return capacity;
    }

    public String getDeviceId()
    {
        return deviceId;
    }
}
