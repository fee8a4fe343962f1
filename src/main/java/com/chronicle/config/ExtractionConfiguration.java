package com.chronicle.config;

import com.chronicle.extractor.events.ChapterDescriptionExtractor;
import com.chronicle.extractor.events.ChapterEndedExtractor;
import com.chronicle.extractor.events.FeelingsChangeExtractor;
import com.chronicle.extractor.events.LocationChangeExtractor;
import com.chronicle.extractor.events.MoodChangeExtractor;
import com.chronicle.extractor.events.NicknameExtractor;
import com.chronicle.extractor.events.OutfitChangeExtractor;
import com.chronicle.extractor.events.PositionActivityChangeExtractor;
import com.chronicle.extractor.events.PresenceChangeExtractor;
import com.chronicle.extractor.events.PropsChangeExtractor;
import com.chronicle.extractor.events.RelationshipStatusExtractor;
import com.chronicle.extractor.events.RelationshipSubjectsExtractor;
import com.chronicle.extractor.events.TensionChangeExtractor;
import com.chronicle.extractor.events.TimeChangeExtractor;
import com.chronicle.generation.PromptBackoff;
import com.chronicle.generation.PromptResultCache;
import com.chronicle.orchestration.BoundedWorkerPool;
import com.chronicle.orchestration.ExtractorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExtractionConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ExtractionConfiguration.class);

    /**
     * Built-in extractors. Within a phase they run in this order.
     */
    @Bean
    public ExtractorRegistry extractorRegistry() {
        ExtractorRegistry registry = new ExtractorRegistry(List.of(
            new TimeChangeExtractor(),
            new LocationChangeExtractor(),
            new PresenceChangeExtractor(),
            new NicknameExtractor(),
            new OutfitChangeExtractor(),
            new PositionActivityChangeExtractor(),
            new MoodChangeExtractor(),
            new PropsChangeExtractor(),
            new RelationshipSubjectsExtractor(),
            new RelationshipStatusExtractor(),
            new FeelingsChangeExtractor(),
            new TensionChangeExtractor(),
            new ChapterEndedExtractor(),
            new ChapterDescriptionExtractor()
        ));
        log.info("Registered extractors: {}", registry.names());
        return registry;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PromptResultCache promptResultCache(ExtractionProperties properties) {
        return new PromptResultCache(properties.getCache().getMaxEntries(),
            properties.getCache().getMaxAge().toMillis());
    }

    @Bean
    public PromptBackoff promptBackoff(ExtractionProperties properties) {
        log.info("Prompt backoff policies: {}", properties.backoffPolicies());
        return new PromptBackoff(properties.backoffPolicies());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor(ExtractionProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "extraction-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), threads);
    }

    @Bean
    public BoundedWorkerPool boundedWorkerPool(ExecutorService extractionExecutor) {
        return new BoundedWorkerPool(extractionExecutor);
    }
}
