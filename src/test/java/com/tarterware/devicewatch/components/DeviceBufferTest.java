package com.tarterware.devicewatch.components;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import com.tarterware.devicewatch.models.WindowedStatistics;

class DeviceBufferTest
{
    @Test
    void testInvalidCapacity()
    {
        assertThrows(IllegalArgumentException.class, () -> new DeviceBuffer("d1", 0));
        assertThrows(IllegalArgumentException.class, () -> new DeviceBuffer("d1", -5));
    }

    @Test
    void testInitialState()
    {
        DeviceBuffer buffer = new DeviceBuffer("d1", 3);
        assertEquals("d1", buffer.getDeviceId());
        assertEquals(3, buffer.capacity());
        assertEquals(0, buffer.size());
        assertArrayEquals(new double[0], buffer.snapshotWindow(10));
        assertEquals(WindowedStatistics.EMPTY, buffer.windowStats(10));
    }

    @Test
    void testEvictionKeepsMostRecentInOrder()
    {
        int capacity = 5;
        DeviceBuffer buffer = new DeviceBuffer("d1", capacity);

        // After every append the buffer holds min(appends, capacity) values, and
        // they are the latest appends in arrival order.
        for (int appends = 1; appends <= 17; appends++)
        {
            buffer.append(appends);

            int expectedSize = Math.min(appends, capacity);
            double[] expected = new double[expectedSize];
            for (int i = 0; i < expectedSize; i++)
            {
                expected[i] = appends - expectedSize + 1 + i;
            }

            assertEquals(expectedSize, buffer.size());
            assertArrayEquals(expected, buffer.snapshotWindow(capacity), 0.0);
        }
    }

    @Test
    void testSnapshotWindowSmallerThanContents()
    {
        DeviceBuffer buffer = new DeviceBuffer("d1", 4);
        buffer.append(1.0);
        buffer.append(2.0);
        buffer.append(3.0);
        buffer.append(4.0);
        buffer.append(5.0); // buffer wraps: [5, 2, 3, 4]

        assertArrayEquals(new double[] { 4.0, 5.0 }, buffer.snapshotWindow(2), 0.0);
        assertArrayEquals(new double[] { 2.0, 3.0, 4.0, 5.0 }, buffer.snapshotWindow(50), 0.0);
        assertThrows(IllegalArgumentException.class, () -> buffer.snapshotWindow(0));
    }

    @Test
    void testWindowStatsUsesTrailingValues()
    {
        DeviceBuffer buffer = new DeviceBuffer("d1", 10);
        buffer.append(1000.0);
        buffer.append(10.0);
        buffer.append(20.0);
        buffer.append(30.0);

        WindowedStatistics stats = buffer.windowStats(3);
        assertEquals(3, stats.getSampleCount());
        assertEquals(20.0, stats.getMean(), 0.0001);
        assertEquals(Math.sqrt(200.0 / 3.0), stats.getStdDev(), 0.0001);
    }

    @Test
    void testConcurrentAppendsAreNotLost() throws Exception
    {
        int threads = 8;
        int appendsPerThread = 500;
        DeviceBuffer buffer = new DeviceBuffer("d1", threads * appendsPerThread);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try
        {
            for (int t = 0; t < threads; t++)
            {
                futures.add(executor.submit(() ->
                {
                    start.await();
                    for (int i = 0; i < appendsPerThread; i++)
                    {
                        buffer.append(1.0);
                        // Readers must only ever see whole values.
                        buffer.windowStats(50);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures)
            {
                future.get();
            }
        }
        finally
        {
            executor.shutdownNow();
        }

        assertEquals(threads * appendsPerThread, buffer.size());
        WindowedStatistics stats = buffer.windowStats(threads * appendsPerThread);
        assertEquals(1.0, stats.getMean(), 0.0);
        assertEquals(0.0, stats.getStdDev(), 0.0);
    }
}
