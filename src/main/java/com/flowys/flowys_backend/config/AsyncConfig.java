package com.flowys.flowys_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AsyncConfig {

    /** Worker pool for async workflow runs. Runs beyond the pool size queue up. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workflowRunExecutor(@Value("${flowys.execution.pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize), new CustomizableThreadFactory("flowys-run-"));
    }
}
