package com.chronicle.config;

import com.chronicle.generation.Generator;
import com.chronicle.generation.OpenAiCompatibleGenerator;
import com.chronicle.generation.RateLimitedGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Text generation backend: an OpenAI-compatible endpoint behind a per-minute
 * request cap.
 */
@Configuration
public class GeneratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GeneratorConfiguration.class);

    @Value("${chronicle.generator.base-url:http://localhost:5001/v1}")
    private String baseUrl;

    @Value("${chronicle.generator.api-key:}")
    private String apiKey;

    @Value("${chronicle.generator.model:default}")
    private String model;

    @Value("${chronicle.generator.timeout-seconds:120}")
    private int timeoutSeconds;

    // 0 disables the cap
    @Value("${chronicle.generator.max-requests-per-minute:0}")
    private int maxRequestsPerMinute;

    @Bean
    public Generator generator(WebClient.Builder webClientBuilder, Clock clock) {
        Generator generator = new OpenAiCompatibleGenerator(webClientBuilder, baseUrl, apiKey, model, timeoutSeconds);
        if (maxRequestsPerMinute > 0) {
            log.info("Generator rate limited to {} requests/minute", maxRequestsPerMinute);
        }
        return new RateLimitedGenerator(generator, maxRequestsPerMinute, clock);
    }
}
