package com.tarterware.devicewatch.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthStatus
{
    // "healthy", or "degraded" when the cache is unreachable
    String status;

    // Unix seconds
    long time;

    // "connected" or "disconnected"
    String redis;
}
