package com.chronicle.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Generator for any OpenAI-compatible {@code /chat/completions} endpoint.
 * Cancelling the token disposes the in-flight request.
 */
public class OpenAiCompatibleGenerator implements Generator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleGenerator.class);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiCompatibleGenerator(WebClient.Builder builder, String baseUrl, String apiKey,
                                     String model, int timeoutSeconds) {
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        WebClient.Builder configured = builder.baseUrl(baseUrl);
        if (apiKey != null && !apiKey.isBlank()) {
            configured = configured.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        this.webClient = configured.build();
        log.info("OpenAI-compatible generator initialized: baseUrl={}, model={}", baseUrl, model);
    }

    @Override
    public String generate(GeneratorPrompt prompt, GenerationOptions options) {
        CancellationToken cancellation = options.cancellation();
        if (cancellation.isCancelled()) {
            throw new GeneratorException("generation cancelled before start: " + prompt.promptName());
        }

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        List<Map<String, String>> messages = new ArrayList<>();
        if (prompt.system() != null && !prompt.system().isBlank()) {
            messages.add(Map.of("role", "system", "content", prompt.system()));
        }
        messages.add(Map.of("role", "user", "content", prompt.user()));
        requestBody.put("messages", messages);
        requestBody.put("temperature", options.temperature());
        if (options.maxTokens() != null) {
            requestBody.put("max_tokens", options.maxTokens());
        }

        CompletableFuture<String> call = webClient.post()
            .uri("/chat/completions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(requestBody)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .toFuture();
        Runnable unregister = cancellation.onCancel(() -> call.cancel(true));

        try {
            return extractContent(call.get());
        } catch (CancellationException e) {
            throw new GeneratorException("generation cancelled: " + prompt.promptName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneratorException("interrupted while generating " + prompt.promptName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof WebClientResponseException response) {
                log.error("Generator API error for {}: {} - {}",
                    prompt.promptName(), response.getStatusCode(), response.getResponseBodyAsString());
                throw new GeneratorException("generator API error: " + response.getStatusCode(), response);
            }
            log.error("Failed to generate response for {}", prompt.promptName(), cause);
            throw new GeneratorException("failed to generate response for " + prompt.promptName(), cause);
        } finally {
            unregister.run();
        }
    }

    private String extractContent(String response) {
        try {
            JsonNode responseNode = objectMapper.readTree(response);
            JsonNode choices = responseNode.get("choices");
            if (choices != null && choices.isArray() && choices.size() > 0) {
                JsonNode message = choices.get(0).get("message");
                if (message != null && message.has("content")) {
                    return message.get("content").asText();
                }
            }
        } catch (Exception e) {
            throw new GeneratorException("response is not valid JSON", e);
        }
        throw new GeneratorException("invalid response format from generator API");
    }
}
