package com.proofline.core.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Infrastructure beans the pipeline needs outside of Spring Boot's auto-configuration.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * In-process registry, used when no monitoring backend contributes one.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        log.debug("No MeterRegistry configured; using SimpleMeterRegistry");
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(HttpClient.class)
    public HttpClient modelLookupHttpClient(ProoflineProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getModelLookupTimeoutSeconds()))
                .build();
    }
}
