package com.tarterware.devicewatch.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A telemetry reading reported by a device. The CPU reading is the value
 * analysed for anomalies; the request rate feeds the current rate gauge.
 */
@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricSample
{
    // Unix seconds
    Long timestamp;

    @JsonProperty("device_id")
    String deviceId;

    Double cpu;

    Double rps;

    Double memory;

    /**
     * Returns the value that is buffered and classified for this sample.
     */
    @JsonIgnore
    public double getValue()
    {
        return cpu;
    }
}
