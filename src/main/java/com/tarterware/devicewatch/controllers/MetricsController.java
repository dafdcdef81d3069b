package com.tarterware.devicewatch.controllers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.devicewatch.models.AnomalyListResponse;
import com.tarterware.devicewatch.models.ErrorResponse;
import com.tarterware.devicewatch.models.IngestResponse;
import com.tarterware.devicewatch.models.MetricSample;
import com.tarterware.devicewatch.models.RollingAverageResponse;
import com.tarterware.devicewatch.services.AnalyticsMetrics;
import com.tarterware.devicewatch.services.MetricsIngestionService;

@RestController
@RequestMapping("/api")
public class MetricsController
{
    public static final String ENDPOINT_METRICS = "/api/metrics";
    public static final String ENDPOINT_ANALYZE = "/api/analyze";
    public static final String ENDPOINT_ANOMALIES = "/api/anomalies";

    @Autowired
    MetricsIngestionService metricsIngestionService;

    @Autowired
    AnalyticsMetrics analyticsMetrics;

    private static final Logger logger = LoggerFactory.getLogger(MetricsController.class);

    @PostMapping("/metrics")
    ResponseEntity<IngestResponse> ingestMetric(@RequestBody(required = false) MetricSample sample)
    {
        return analyticsMetrics.timeRequest(ENDPOINT_METRICS, () ->
        {
            try
            {
                metricsIngestionService.ingest(sample);
            }
            catch (IllegalArgumentException ex)
            {
                return new ResponseEntity<IngestResponse>(IngestResponse.rejected(ex.getMessage()),
                        HttpStatus.BAD_REQUEST);
            }

            return new ResponseEntity<IngestResponse>(IngestResponse.accepted(), HttpStatus.ACCEPTED);
        });
    }

    @GetMapping("/analyze")
    ResponseEntity<?> analyze(@RequestParam(name = "device_id", required = false) String deviceId)
    {
        return analyticsMetrics.<ResponseEntity<?>> timeRequest(ENDPOINT_ANALYZE, () ->
        {
            RollingAverageResponse response = null;
            try
            {
                response = metricsIngestionService.queryRollingAverage(deviceId);
            }
            catch (IllegalArgumentException ex)
            {
                return new ResponseEntity<ErrorResponse>(new ErrorResponse(ex.getMessage()), HttpStatus.BAD_REQUEST);
            }

            return new ResponseEntity<RollingAverageResponse>(response, HttpStatus.OK);
        });
    }

    @GetMapping("/anomalies")
    ResponseEntity<AnomalyListResponse> listAnomalies()
    {
        return analyticsMetrics.timeRequest(ENDPOINT_ANOMALIES,
                () -> new ResponseEntity<AnomalyListResponse>(metricsIngestionService.listAnomalies(), HttpStatus.OK));
    }

    // Bodies that are not JSON, or carry a field of the wrong type. These never
    // reach the handler method, so the request is counted here.
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<IngestResponse> handleUnreadableBody(HttpMessageNotReadableException ex)
    {
        return analyticsMetrics.timeRequest(ENDPOINT_METRICS, () ->
        {
            logger.debug("Rejecting unreadable request body: {}", ex.getMessage());
            return new ResponseEntity<IngestResponse>(IngestResponse.rejected("Invalid JSON"),
                    HttpStatus.BAD_REQUEST);
        });
    }
}
