package com.tarterware.devicewatch.services;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.springframework.stereotype.Service;

import com.tarterware.devicewatch.components.AnomalyEventQueue;
import com.tarterware.devicewatch.components.BufferRegistry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Meters published for the monitoring system. Nothing here feeds back into the
 * analytics; a registry without a reachable backend simply accumulates.
 */
@Service
public class AnalyticsMetrics
{
    public static final String ENDPOINT_REQUESTS = "devicewatch.requests";
    public static final String ENDPOINT_REQUEST_DURATION = "devicewatch.request.duration";
    public static final String ENDPOINT_ANOMALIES_DETECTED = "devicewatch.anomalies.detected";
    public static final String ENDPOINT_SAMPLES_PROCESSED = "devicewatch.samples.processed";
    public static final String ENDPOINT_CURRENT_RPS = "devicewatch.current.rps";
    public static final String ENDPOINT_DEVICES_TRACKED = "devicewatch.devices.tracked";
    public static final String ENDPOINT_EVENT_QUEUE_SIZE = "devicewatch.event.queue.size";

    public static final String TAG_ENDPOINT = "endpoint";

    private final MeterRegistry meterRegistry;

    private final Counter anomaliesDetected;

    private final Counter samplesProcessed;

    // Last request rate reported by any device.
    private final AtomicReference<Double> currentRps = new AtomicReference<>(0.0);

    public AnalyticsMetrics(MeterRegistry meterRegistry, BufferRegistry bufferRegistry,
            AnomalyEventQueue anomalyEventQueue)
    {
        this.meterRegistry = meterRegistry;

        this.anomaliesDetected = Counter.builder(ENDPOINT_ANOMALIES_DETECTED)
                .description("Total number of anomalies detected").register(meterRegistry);
        this.samplesProcessed = Counter.builder(ENDPOINT_SAMPLES_PROCESSED)
                .description("Total number of metrics processed").register(meterRegistry);

        meterRegistry.gauge(ENDPOINT_CURRENT_RPS, currentRps, AtomicReference::get);
        meterRegistry.gauge(ENDPOINT_DEVICES_TRACKED, bufferRegistry, BufferRegistry::size);
        meterRegistry.gauge(ENDPOINT_EVENT_QUEUE_SIZE, anomalyEventQueue, AnomalyEventQueue::size);
    }

    /**
     * Counts a request against an endpoint and records how long it took.
     *
     * @param endpoint the request path used as the endpoint tag
     * @param request  the request handling
     * @return whatever the request handling returned
     */
    public <T> T timeRequest(String endpoint, Supplier<T> request)
    {
        Counter.builder(ENDPOINT_REQUESTS).description("Total number of requests").tag(TAG_ENDPOINT, endpoint)
                .register(meterRegistry).increment();

        return Timer.builder(ENDPOINT_REQUEST_DURATION).description("Request duration").tag(TAG_ENDPOINT, endpoint)
                .register(meterRegistry).record(request);
    }

    public void recordSampleProcessed(double rps)
    {
        samplesProcessed.increment();
        currentRps.set(rps);
    }

    public void recordAnomaly()
    {
        anomaliesDetected.increment();
    }
}
