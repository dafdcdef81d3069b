package com.tarterware.devicewatch.components;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tarterware.devicewatch.models.AnalyticsResult;

/**
 * Bounded, lossy hand-off between the classification workers and the anomaly
 * listing endpoint.
 * 
 * <p>
 * Producers never block: once the queue holds {@code capacity} results, newly
 * offered results are dropped. Results leave the queue only through
 * {@link #drain(Duration)}; anything not drained before the queue fills up is
 * lost.
 * </p>
 */
@Component
public class AnomalyEventQueue
{
    private final BlockingQueue<AnalyticsResult> events;

    private final int capacity;

    private static final Logger logger = LoggerFactory.getLogger(AnomalyEventQueue.class);

    /**
     * @param capacity the maximum number of results held
     * @throws IllegalArgumentException if capacity is less than 1
     */
    public AnomalyEventQueue(@Value("${com.tarterware.devicewatch.event-queue-capacity:100}") int capacity)
    {
        if (capacity < 1)
        {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
        this.events = new ArrayBlockingQueue<AnalyticsResult>(capacity);
    }

    /**
     * Offers a result without blocking.
     *
     * @param result the classification result
     * @return true if queued; false if the queue was full and the result dropped
     */
    public boolean tryEnqueue(AnalyticsResult result)
    {
        boolean queued = events.offer(result);
        if (!queued)
        {
            logger.debug("Event queue full; dropping result for device {}", result.getDeviceId());
        }
        return queued;
    }

    /**
     * Removes every queued result in FIFO order, then keeps reading late arrivals
     * until no result is immediately available or {@code gracePeriod} has
     * elapsed. The grace period never holds back results already queued when the
     * drain starts, and the drain never blocks waiting for new ones.
     *
     * @param gracePeriod upper bound on the time spent reading late arrivals
     * @return the drained results, oldest first; never null
     */
    public List<AnalyticsResult> drain(Duration gracePeriod)
    {
        List<AnalyticsResult> drained = new ArrayList<AnalyticsResult>();
        long nsDeadline = System.nanoTime() + gracePeriod.toNanos();

        events.drainTo(drained);

        while (System.nanoTime() - nsDeadline < 0)
        {
            AnalyticsResult result = events.poll();
            if (result == null)
            {
                break;
            }
            drained.add(result);
        }

        return drained;
    }

    /**
     * Returns the number of results currently queued.
     */
    public int size()
    {
        return events.size();
    }

    public int capacity()
    {
        return capacity;
    }
}
