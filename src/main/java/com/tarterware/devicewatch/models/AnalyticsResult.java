package com.tarterware.devicewatch.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of classifying one sample against its device's rolling window.
 */
@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyticsResult
{
    @JsonProperty("device_id")
    String deviceId;

    @JsonProperty("rolling_average")
    double rollingAverage;

    @JsonProperty("z_score")
    double zscore;

    @JsonProperty("is_anomaly")
    boolean anomaly;

    long timestamp;

    double value;
}
