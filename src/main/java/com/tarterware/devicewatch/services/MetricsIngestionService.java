package com.tarterware.devicewatch.services;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.tarterware.devicewatch.components.AnomalyClassifier;
import com.tarterware.devicewatch.components.AnomalyEventQueue;
import com.tarterware.devicewatch.components.BufferRegistry;
import com.tarterware.devicewatch.exceptions.InvalidSampleException;
import com.tarterware.devicewatch.models.AnalyticsResult;
import com.tarterware.devicewatch.models.AnomalyListResponse;
import com.tarterware.devicewatch.models.MetricSample;
import com.tarterware.devicewatch.models.RollingAverageResponse;

/**
 * Entry point for device telemetry. Ingestion validates a sample, appends it to
 * the device's buffer and hands the cache write and the classification to the
 * analytics worker pool without waiting for either.
 * 
 * <p>
 * The service also answers the two read paths: the rolling average of a
 * device, read straight from its buffer, and the list of classification results
 * drained from the {@link AnomalyEventQueue}.
 * </p>
 */
@Service
public class MetricsIngestionService
{
    private final BufferRegistry bufferRegistry;

    private final AnomalyClassifier anomalyClassifier;

    private final AnomalyEventQueue anomalyEventQueue;

    private final SampleCacheService sampleCacheService;

    private final AnalyticsMetrics analyticsMetrics;

    // Worker pool for the fire-and-forget tasks
    private final Executor analyticsExecutor;

    // Grace window granted to each drain of the event queue
    private final Duration drainGracePeriod;

    private static final Logger logger = LoggerFactory.getLogger(MetricsIngestionService.class);

    public MetricsIngestionService(BufferRegistry bufferRegistry, AnomalyClassifier anomalyClassifier,
            AnomalyEventQueue anomalyEventQueue, SampleCacheService sampleCacheService,
            AnalyticsMetrics analyticsMetrics, @Qualifier("analyticsExecutor") Executor analyticsExecutor,
            @Value("${com.tarterware.devicewatch.drain-grace-period:100ms}") String drainGracePeriodString)
    {
        this.bufferRegistry = bufferRegistry;
        this.anomalyClassifier = anomalyClassifier;
        this.anomalyEventQueue = anomalyEventQueue;
        this.sampleCacheService = sampleCacheService;
        this.analyticsMetrics = analyticsMetrics;
        this.analyticsExecutor = analyticsExecutor;
        this.drainGracePeriod = DurationStyle.detect(drainGracePeriodString).parse(drainGracePeriodString);
    }

    /**
     * Accepts a sample. Returns as soon as the sample is buffered; caching and
     * classification complete later on the worker pool.
     *
     * @param sample the sample reported by a device
     * @throws InvalidSampleException if the sample is missing, or lacks a device
     *                                ID, timestamp or CPU value
     */
    public void ingest(MetricSample sample)
    {
        validate(sample);

        bufferRegistry.getOrCreate(sample.getDeviceId()).append(sample.getValue());
        analyticsMetrics.recordSampleProcessed(sample.getRps() != null ? sample.getRps() : 0.0);

        submit("cache", sample, () -> sampleCacheService.cacheSample(sample));
        submit("classification", sample, () -> analyzeSample(sample));
    }

    /**
     * Classifies a buffered sample, counts it if anomalous and publishes the
     * result to the event queue. A full queue drops the result.
     *
     * @param sample a sample already appended to its device buffer
     * @return the classification result
     */
    public AnalyticsResult analyzeSample(MetricSample sample)
    {
        AnalyticsResult result = anomalyClassifier.classify(sample.getDeviceId(), sample.getValue(),
                sample.getTimestamp());
        if (result.isAnomaly())
        {
            analyticsMetrics.recordAnomaly();
        }
        anomalyEventQueue.tryEnqueue(result);
        return result;
    }

    /**
     * Returns the mean of the device's most recent window of values.
     *
     * @param deviceId the device ID
     * @return the rolling average; 0 for a device that has never reported
     * @throws InvalidSampleException if deviceId is null or blank
     */
    public RollingAverageResponse queryRollingAverage(String deviceId)
    {
        if (!StringUtils.hasText(deviceId))
        {
            throw new InvalidSampleException("device_id parameter is required");
        }

        int windowSize = anomalyClassifier.getWindowSize();
        double rollingAverage = bufferRegistry.find(deviceId).map(buffer -> buffer.windowStats(windowSize).getMean())
                .orElse(0.0);

        return new RollingAverageResponse(deviceId, rollingAverage, windowSize);
    }

    /**
     * Drains the classification results queued since the previous call.
     *
     * @return the drained results and their count
     */
    public AnomalyListResponse listAnomalies()
    {
        List<AnalyticsResult> anomalies = anomalyEventQueue.drain(drainGracePeriod);
        return new AnomalyListResponse(anomalies);
    }

    private void validate(MetricSample sample)
    {
        if (sample == null)
        {
            throw new InvalidSampleException("Sample body is empty");
        }
        if (!StringUtils.hasText(sample.getDeviceId()))
        {
            throw new InvalidSampleException("device_id is required");
        }
        if (sample.getTimestamp() == null)
        {
            throw new InvalidSampleException("timestamp is required");
        }
        if (sample.getCpu() == null)
        {
            throw new InvalidSampleException("cpu is required");
        }
    }

    /**
     * Hands a task to the worker pool. Failures are logged and dropped; nothing
     * is retried.
     */
    private void submit(String taskName, MetricSample sample, Runnable task)
    {
        try
        {
            analyticsExecutor.execute(() ->
            {
                try
                {
                    task.run();
                }
                catch (Exception e)
                {
                    logger.error("Unexpected Exception in {} task for device {}", taskName, sample.getDeviceId(), e);
                }
            });
        }
        catch (RejectedExecutionException e)
        {
            logger.warn("Worker pool rejected {} task for device {}", taskName, sample.getDeviceId());
        }
    }

    public Duration getDrainGracePeriod()
    {
        return drainGracePeriod;
    }
}
