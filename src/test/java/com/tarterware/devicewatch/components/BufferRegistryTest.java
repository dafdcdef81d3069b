package com.tarterware.devicewatch.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

class BufferRegistryTest
{
    @Test
    void testInvalidCapacity()
    {
        assertThrows(IllegalArgumentException.class, () -> new BufferRegistry(0));
    }

    @Test
    void testGetOrCreateReturnsSameBuffer()
    {
        BufferRegistry registry = new BufferRegistry(10);

        DeviceBuffer first = registry.getOrCreate("d1");
        DeviceBuffer second = registry.getOrCreate("d1");
        DeviceBuffer other = registry.getOrCreate("d2");

        assertSame(first, second);
        assertNotSame(first, other);
        assertEquals(10, first.capacity());
        assertEquals(2, registry.size());
    }

    @Test
    void testFindDoesNotCreate()
    {
        BufferRegistry registry = new BufferRegistry(10);

        assertTrue(registry.find("unknown").isEmpty());
        assertEquals(0, registry.size());

        DeviceBuffer buffer = registry.getOrCreate("d1");
        assertSame(buffer, registry.find("d1").get());
    }

    @Test
    void testConcurrentCreationYieldsSingleBuffer() throws Exception
    {
        BufferRegistry registry = new BufferRegistry(10);
        int callers = 32;

        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<DeviceBuffer>> futures = new ArrayList<>();
        try
        {
            for (int i = 0; i < callers; i++)
            {
                futures.add(executor.submit(() ->
                {
                    start.await();
                    return registry.getOrCreate("x");
                }));
            }
            start.countDown();

            DeviceBuffer expected = futures.get(0).get();
            for (Future<DeviceBuffer> future : futures)
            {
                assertSame(expected, future.get());
            }
        }
        finally
        {
            executor.shutdownNow();
        }

        assertEquals(1, registry.size());
    }
}
