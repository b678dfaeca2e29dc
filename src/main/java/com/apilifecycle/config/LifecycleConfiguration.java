package com.apilifecycle.config;

import com.apilifecycle.engine.BrownoutSampler;
import com.apilifecycle.engine.LifecycleEvaluator;
import com.apilifecycle.engine.LifecycleHeaderFormatter;
import com.apilifecycle.openapi.SchemaAnnotator;
import com.apilifecycle.policy.PolicyRegistry;
import com.apilifecycle.telemetry.LoggingTelemetryCallback;
import com.apilifecycle.telemetry.TelemetryDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LifecycleProperties.class)
public class LifecycleConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LifecycleConfiguration.class);

    @Bean
    public Clock lifecycleClock() {
        return Clock.systemUTC();
    }

    @Bean
    public BrownoutSampler brownoutSampler() {
        return BrownoutSampler.random();
    }

    @Bean
    public LifecycleEvaluator lifecycleEvaluator(Clock clock, BrownoutSampler brownoutSampler) {
        return new LifecycleEvaluator(clock, brownoutSampler);
    }

    @Bean
    public LifecycleHeaderFormatter lifecycleHeaderFormatter() {
        return new LifecycleHeaderFormatter();
    }

    @Bean
    public SchemaAnnotator schemaAnnotator(Clock clock) {
        return new SchemaAnnotator(clock);
    }

    /**
     * Telemetry slot owned by the application context. The logging sink is installed by default;
     * applications replace it with {@link TelemetryDispatcher#register}.
     */
    @Bean
    public TelemetryDispatcher telemetryDispatcher(LifecycleProperties properties) {
        TelemetryDispatcher dispatcher = new TelemetryDispatcher();
        if (properties.telemetry().logUsage()) {
            dispatcher.register(new LoggingTelemetryCallback());
        }
        return dispatcher;
    }

    /**
     * Builds the registry from {@code lifecycle.policies}. Any invalid entry aborts startup,
     * so a misconfigured route is never served.
     */
    @Bean
    public PolicyRegistry policyRegistry(LifecycleProperties properties) {
        PolicyRegistry registry = new PolicyRegistry();
        for (LifecycleProperties.PolicyEntry entry : properties.policies()) {
            if (entry.isPrefixEntry() == (entry.path() != null && !entry.path().isBlank())) {
                throw new IllegalArgumentException(
                    "lifecycle.policies entries need exactly one of prefix or path: " + entry.describe());
            }
            if (entry.isPrefixEntry()) {
                registry.registerPrefix(entry.prefix(), entry.toPolicy());
            } else {
                registry.register(entry.method(), entry.path(), entry.toPolicy());
            }
            log.info("Registered deprecation policy for {}", entry.describe());
        }
        log.info("Deprecation policy registry ready with {} entries", registry.size());
        return registry;
    }
}
