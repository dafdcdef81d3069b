package com.tarterware.devicewatch.controllers;

import java.time.Instant;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.devicewatch.models.HealthStatus;
import com.tarterware.devicewatch.services.SampleCacheService;

@RestController
public class HealthController
{
    public static final String STATUS_HEALTHY = "healthy";
    public static final String STATUS_DEGRADED = "degraded";

    @Autowired
    SampleCacheService sampleCacheService;

    @GetMapping("/health")
    ResponseEntity<HealthStatus> getHealth()
    {
        // The service keeps running without Redis, just degraded.
        boolean redisConnected = sampleCacheService.isAvailable();

        HealthStatus healthStatus = new HealthStatus();
        healthStatus.setTime(Instant.now().getEpochSecond());
        healthStatus.setStatus(redisConnected ? STATUS_HEALTHY : STATUS_DEGRADED);
        healthStatus.setRedis(redisConnected ? "connected" : "disconnected");

        return new ResponseEntity<HealthStatus>(healthStatus, HttpStatus.OK);
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    ResponseEntity<String> getBanner()
    {
        return new ResponseEntity<String>("DeviceWatch telemetry analytics - Running", HttpStatus.OK);
    }
}
