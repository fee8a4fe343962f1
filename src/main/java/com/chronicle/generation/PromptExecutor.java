package com.chronicle.generation;

import com.chronicle.prompt.BuiltPrompt;
import com.chronicle.prompt.PromptTemplate;
import com.chronicle.prompt.Reasoned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Generates and validates a prompt response with bounded retries, serving
 * unchanged prompts from {@link PromptResultCache} and skipping prompts that
 * {@link PromptBackoff} has put into cooldown.
 */
@Service
public class PromptExecutor {

    private static final Logger log = LoggerFactory.getLogger(PromptExecutor.class);

    static final int LOGGED_RESPONSE_CHARS = 500;

    private final Generator generator;
    private final PromptResultCache cache;
    private final PromptBackoff backoff;
    private final ExtractionMetricsService metrics;

    public PromptExecutor(Generator generator,
                          PromptResultCache cache,
                          PromptBackoff backoff,
                          ExtractionMetricsService metrics) {
        this.generator = generator;
        this.cache = cache;
        this.backoff = backoff;
        this.metrics = metrics;
    }

    public <T> ParseResult<T> generateAndParse(PromptTemplate<T> template,
                                               BuiltPrompt prompt,
                                               double temperature,
                                               ParseOptions options) {
        CancellationToken cancellation = options.cancellation();
        if (cancellation.isCancelled()) {
            return ParseResult.abortedResult();
        }

        String name = template.name();
        String cacheKey = PromptResultCache.key(name, prompt.system(), prompt.user(), temperature, options.profileId());
        PromptResultCache.CachedResult cached = cache.get(cacheKey).orElse(null);
        if (cached != null) {
            metrics.recordSkip(name, "prompt-cache-hit");
            log.debug("{} served from cache", name);
            @SuppressWarnings("unchecked")
            T data = (T) cached.data();
            return ParseResult.success(data, cached.rawResponse(), cached.reasoning(), true);
        }

        PromptBackoff.Decision decision = backoff.shouldSkip(name);
        if (decision.skip()) {
            metrics.recordSkip(name, "prompt-cooldown");
            log.warn("{} skipped due to cooldown ({}s remaining)", name, (decision.remainingMs() + 999) / 1000);
            return ParseResult.cooldown(decision.remainingMs());
        }

        String lastError = null;
        String lastResponse = null;
        int attempts = options.maxRetries() + 1;
        for (int attempt = 0; attempt < attempts; attempt++) {
            double currentTemperature = attempt == 0 ? temperature : options.retryTemperature();
            metrics.recordAttempt(name, attempt > 0);

            try {
                String response = generator.generate(
                    new GeneratorPrompt(prompt.system(), prompt.user(), name),
                    new GenerationOptions(currentTemperature, options.maxTokens(), cancellation));
                lastResponse = response;

                T parsed = template.parseResponse(response);
                if (parsed != null) {
                    String reasoning = parsed instanceof Reasoned reasoned ? reasoned.reasoning() : null;
                    metrics.recordResult(name, true);
                    backoff.recordSuccess(name);
                    cache.put(cacheKey, new PromptResultCache.CachedResult(parsed, reasoning, response));
                    if (reasoning != null && !reasoning.isBlank()) {
                        log.debug("{} reasoning: {}", name, reasoning);
                    }
                    return ParseResult.success(parsed, response, reasoning, false);
                }
                lastError = "parseResponse returned null";
            } catch (GeneratorException ex) {
                if (cancellation.isCancelled()) {
                    return ParseResult.abortedResult();
                }
                lastError = ex.getMessage();
            } catch (RuntimeException ex) {
                if (cancellation.isCancelled()) {
                    return ParseResult.abortedResult();
                }
                lastError = ex.getClass().getSimpleName() + ": " + ex.getMessage();
            }

            if (cancellation.isCancelled()) {
                return ParseResult.abortedResult();
            }
            if (attempt < attempts - 1) {
                log.warn("{} parse failed (attempt {}/{}): {}", name, attempt + 1, attempts, lastError);
            }
        }

        log.error("{} failed after {} attempts: {}", name, attempts, lastError);
        metrics.recordResult(name, false);
        backoff.recordFailure(name);
        if (lastResponse != null) {
            log.error("{} last response: {}", name,
                lastResponse.substring(0, Math.min(LOGGED_RESPONSE_CHARS, lastResponse.length())));
        }
        return ParseResult.failure(lastError, lastResponse);
    }
}
