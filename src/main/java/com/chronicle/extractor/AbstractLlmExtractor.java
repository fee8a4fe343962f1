package com.chronicle.extractor;

import com.chronicle.generation.ParseResult;
import com.chronicle.prompt.BuiltPrompt;
import com.chronicle.prompt.PromptBuilder;
import com.chronicle.prompt.PromptTemplate;
import com.chronicle.projection.CharacterState;
import com.chronicle.projection.NarrativeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Base for extractors backed by one prompt: resolves the message window,
 * fills the shared placeholders, runs the prompt through the
 * {@link com.chronicle.generation.PromptExecutor} and reports failures to the
 * turn's diagnostics.
 */
public abstract class AbstractLlmExtractor implements Extractor {

    private static final Logger log = LoggerFactory.getLogger(AbstractLlmExtractor.class);

    private final String name;
    private final String displayName;
    private final TrackCategory category;
    private final ExtractionPhase phase;
    private final RunStrategy runStrategy;
    private final MessageWindowStrategy messageStrategy;
    private final double defaultTemperature;

    protected AbstractLlmExtractor(String name,
                                   String displayName,
                                   TrackCategory category,
                                   ExtractionPhase phase,
                                   RunStrategy runStrategy,
                                   MessageWindowStrategy messageStrategy,
                                   double defaultTemperature) {
        this.name = name;
        this.displayName = displayName;
        this.category = category;
        this.phase = phase;
        this.runStrategy = runStrategy;
        this.messageStrategy = messageStrategy;
        this.defaultTemperature = defaultTemperature;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public TrackCategory category() {
        return category;
    }

    @Override
    public ExtractionPhase phase() {
        return phase;
    }

    @Override
    public RunStrategy runStrategy() {
        return runStrategy;
    }

    @Override
    public MessageWindowStrategy messageStrategy() {
        return messageStrategy;
    }

    @Override
    public double defaultTemperature() {
        return defaultTemperature;
    }

    /** Upper bound on messages sent; chapter-level extractors override. */
    protected Integer maxMessages(ExtractionSettings settings) {
        return settings.maxMessagesToSend();
    }

    protected MessageRange window(ExtractionRequest request) {
        return messageStrategy.resolve(request).limit(maxMessages(request.settings()));
    }

    /**
     * Placeholders every prompt can use: {@code messages}, {@code userName},
     * {@code characterName}, {@code characters} and {@code location}.
     */
    protected Map<String, String> baseValues(ExtractionRequest request, NarrativeState state) {
        Map<String, String> values = new HashMap<>();
        values.put("messages", request.context().transcript(window(request)));
        values.put("userName", nullToEmpty(request.context().userName()));
        values.put("characterName", nullToEmpty(request.context().characterName()));
        values.put("characters", String.join(", ", state.charactersPresent()));
        values.put("location", formatLocation(state));
        return values;
    }

    /**
     * Runs {@code template}; on failure records a diagnostic under {@code unit}
     * and returns empty. Aborted calls return empty without a diagnostic.
     */
    protected <T> Optional<T> prompt(ExtractionRequest request,
                                     String unit,
                                     PromptTemplate<T> template,
                                     Map<String, String> values) {
        ExtractionSettings settings = request.settings();
        CustomPrompt override = settings.customPrompt(template.name()).orElse(null);
        BuiltPrompt built = PromptBuilder.build(template, values, override);
        double temperature = settings.temperatureFor(template.name(), category, defaultTemperature);

        ParseResult<T> result = request.promptExecutor().generateAndParse(
            template, built, temperature, settings.parseOptions(request.cancellation()));
        if (result.success()) {
            return Optional.ofNullable(result.data());
        }
        if (result.aborted()) {
            return Optional.empty();
        }
        ErrorKind kind = result.cooldown() ? ErrorKind.COOLDOWN_ACTIVE : ErrorKind.PARSE_FAILURE;
        log.warn("{} extraction failed: {}", unit, result.error());
        request.diagnostics().report(unit, kind, result.error());
        return Optional.empty();
    }

    protected static boolean hasCustomPromptText(ExtractionRequest request, String promptName) {
        return request.settings().customPrompt(promptName).map(CustomPrompt::overridesText).orElse(false);
    }

    protected static String formatLocation(NarrativeState state) {
        String text = List.of(
                Optional.ofNullable(state.location().area()),
                Optional.ofNullable(state.location().place()),
                Optional.ofNullable(state.location().position()))
            .stream()
            .flatMap(Optional::stream)
            .collect(Collectors.joining(" / "));
        return text.isEmpty() ? "unknown" : text;
    }

    protected static String formatCharacter(NarrativeState state, String name) {
        CharacterState character = state.character(name).orElse(CharacterState.named(name));
        StringBuilder out = new StringBuilder();
        out.append("Position: ").append(orUnknown(character.position())).append('\n');
        out.append("Activity: ").append(orUnknown(character.activity())).append('\n');
        out.append("Mood: ").append(character.mood().isEmpty() ? "unknown" : String.join(", ", character.mood()))
            .append('\n');
        out.append("Outfit: ");
        if (character.outfit().isEmpty()) {
            out.append("unknown");
        } else {
            out.append(character.outfit().entrySet().stream()
                .map(e -> e.getKey().getValue() + "=" + e.getValue())
                .collect(Collectors.joining(", ")));
        }
        return out.toString();
    }

    protected static boolean containsIgnoreCase(List<String> values, String value) {
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(value));
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
