package com.tarterware.devicewatch.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RollingAverageResponse
{
    @JsonProperty("device_id")
    String deviceId;

    @JsonProperty("rolling_average")
    double rollingAverage;

    @JsonProperty("window_size")
    int windowSize;
}
