package com.tarterware.devicewatch.configs;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class ExecutorConfig
{
    // Dedicated thread pool for the per-sample cache writes and classifications
    @Bean(destroyMethod = "shutdown")
    ExecutorService analyticsExecutor(@Value("${com.tarterware.devicewatch.analytics-threads:10}") int threadCount)
    {
        return Executors.newFixedThreadPool(threadCount, new CustomizableThreadFactory("analytics-"));
    }
}
