package com.agentflow.engine.metrics;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration for the agentflow engine.
 *
 * Registers the engine meters, tags them with the application name and
 * publishes percentiles for execution and step durations.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> agentflowCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "agentflow")
            .meterFilter(durationPercentiles());
    }

    @Bean
    public WorkflowMetrics workflowMetrics() {
        return new WorkflowMetrics();
    }

    static MeterFilter durationPercentiles() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                if (!WorkflowMetrics.EXECUTION_DURATION.equals(id.getName())
                        && !WorkflowMetrics.STEP_DURATION.equals(id.getName())) {
                    return config;
                }
                // Agent calls run from milliseconds to several minutes
                return DistributionStatisticConfig.builder()
                    .percentiles(0.5, 0.95, 0.99)
                    .minimumExpectedValue((double) Duration.ofMillis(5).toNanos())
                    .maximumExpectedValue((double) Duration.ofMinutes(10).toNanos())
                    .build()
                    .merge(config);
            }
        };
    }
}
