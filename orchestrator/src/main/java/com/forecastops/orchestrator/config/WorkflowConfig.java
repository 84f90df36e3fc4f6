package com.forecastops.orchestrator.config;

import com.forecastops.orchestrator.task.RetryPolicy;
import com.forecastops.orchestrator.task.TaskInvoker;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class WorkflowConfig {

    @Bean
    public RetryPolicy taskRetryPolicy(
            @Value("${retrain.retry.max-attempts:3}") int maxAttempts,
            @Value("${retrain.retry.initial-backoff:2s}") Duration initialBackoff,
            @Value("${retrain.retry.multiplier:2.0}") double multiplier) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier);
    }

    @Bean
    public TaskInvoker taskInvoker(RetryPolicy taskRetryPolicy, MeterRegistry meterRegistry) {
        return new TaskInvoker(taskRetryPolicy, meterRegistry);
    }
}
