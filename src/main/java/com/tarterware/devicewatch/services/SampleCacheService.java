package com.tarterware.devicewatch.services;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import com.tarterware.devicewatch.models.MetricSample;

import jakarta.annotation.PostConstruct;

/**
 * Writes raw samples to Redis with an expiry. The cache is best effort: when
 * Redis is unreachable the write is logged and dropped, and ingestion carries
 * on without it.
 */
@Service
public class SampleCacheService
{
    private final RedisTemplate<String, Object> redisTemplate;

    // How long a cached sample lives.
    private final Duration cacheTtl;

    private static final Logger logger = LoggerFactory.getLogger(SampleCacheService.class);

    /**
     * @param redisTemplate  template with String keys and JSON values
     * @param cacheTtlString expiry of each cached sample, e.g. "10m"
     */
    public SampleCacheService(RedisTemplate<String, Object> redisTemplate,
            @Value("${com.tarterware.devicewatch.cache-ttl:10m}") String cacheTtlString)
    {
        this.redisTemplate = redisTemplate;

        // DurationStyle.detect() accepts both "10m" and ISO-8601 "PT10M"
        this.cacheTtl = DurationStyle.detect(cacheTtlString).parse(cacheTtlString);
    }

    @PostConstruct
    public void init()
    {
        if (isAvailable())
        {
            logger.info("Successfully connected to Redis");
        }
        else
        {
            logger.warn("Redis connection failed. Continuing without Redis.");
        }
    }

    /**
     * Returns the Redis key a sample is cached under, formatted as
     * "metric:{deviceId}:{timestamp}".
     *
     * @param sample the sample
     * @return the cache key
     */
    public String getSampleKey(MetricSample sample)
    {
        return String.format("metric:%s:%d", sample.getDeviceId(), sample.getTimestamp());
    }

    /**
     * Caches a sample. Failures are logged and swallowed; there is no retry.
     *
     * @param sample the sample to cache
     */
    public void cacheSample(MetricSample sample)
    {
        String sampleKey = getSampleKey(sample);
        try
        {
            redisTemplate.opsForValue().set(sampleKey, sample, cacheTtl);
        }
        catch (Exception e)
        {
            logger.warn("Unable to cache sample {}: {}", sampleKey, e.getMessage());
        }
    }

    /**
     * Pings Redis.
     *
     * @return true if Redis answered the ping; false otherwise
     */
    public boolean isAvailable()
    {
        try
        {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return pong != null;
        }
        catch (Exception e)
        {
            logger.debug("Redis ping failed", e);
            return false;
        }
    }

    public Duration getCacheTtl()
    {
        return cacheTtl;
    }
}
