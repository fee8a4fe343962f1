package com.chronicle.orchestration;

import com.chronicle.event.CharacterPair;
import com.chronicle.event.EventType;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.BatchAttempt;
import com.chronicle.extractor.BatchCapable;
import com.chronicle.extractor.ErrorKind;
import com.chronicle.extractor.ExtractionDiagnostics;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.Extractor;
import com.chronicle.extractor.ExtractorStateRegistry;
import com.chronicle.extractor.GlobalExtractor;
import com.chronicle.extractor.PerCharacterExtractor;
import com.chronicle.extractor.PerPairExtractor;
import com.chronicle.extractor.RunStrategyContext;
import com.chronicle.generation.ExtractionMetricsService;
import com.chronicle.generation.PromptExecutor;
import com.chronicle.names.TurnNameResolver;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.ProjectionReducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs every extractor of a turn phase by phase, resolves character names
 * across the accumulated events and commits them to the store in one append.
 *
 * A turn either commits everything it produced or, when cancelled, nothing.
 * Failures of single extraction units are collected and never stop their
 * siblings. One orchestrator serves one chat session; run history lives in its
 * {@link ExtractorStateRegistry}.
 */
public class ExtractionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    private final ExtractorRegistry extractors;
    private final ExtractorStateRegistry states;
    private final PromptExecutor promptExecutor;
    private final BoundedWorkerPool workerPool;
    private final BatchFallbackStrategy batchStrategy;
    private final ExtractionMetricsService metrics;
    private final Clock clock;

    public ExtractionOrchestrator(ExtractorRegistry extractors,
                                  ExtractorStateRegistry states,
                                  PromptExecutor promptExecutor,
                                  BoundedWorkerPool workerPool,
                                  ExtractionMetricsService metrics,
                                  Clock clock) {
        this.extractors = extractors;
        this.states = states;
        this.promptExecutor = promptExecutor;
        this.workerPool = workerPool;
        this.batchStrategy = new BatchFallbackStrategy();
        this.metrics = metrics;
        this.clock = clock;
    }

    public ExtractorStateRegistry states() {
        return states;
    }

    public ExtractionResult extractEvents(ExtractionTurn turn) {
        ExtractionDiagnostics diagnostics = new ExtractionDiagnostics();
        long timestamp = clock.millis();
        ExtractionRequest request = new ExtractionRequest(turn.store(), turn.context(), turn.settings(),
            turn.currentMessage(), turn.swipes(), List.of(), turn.cancellation(), promptExecutor,
            diagnostics, timestamp);
        NarrativeState stateBeforeTurn = request.stateBeforeTurn();
        List<NarrativeEvent> turnEvents = new ArrayList<>();

        log.debug("Extraction started message={} swipe={}",
            turn.currentMessage().messageId(), turn.currentMessage().swipeId());

        for (ExtractionPhase phase : ExtractionPhase.values()) {
            if (request.isCancelled()) {
                return abort(turn, diagnostics);
            }
            List<Extractor> inPhase = extractors.inPhase(phase);
            if (inPhase.isEmpty()) {
                continue;
            }
            turn.progress().sectionStarted(phase);
            for (Extractor extractor : inPhase) {
                if (request.isCancelled()) {
                    return abort(turn, diagnostics);
                }
                ExtractionRequest current = request.withTurnEvents(turnEvents);
                if (!extractor.shouldRun(new RunStrategyContext(current, states.get(extractor.name())))) {
                    log.debug("{} skipped at message={}", extractor.name(), turn.currentMessage().messageId());
                    continue;
                }
                turn.progress().label(extractor.displayName());

                List<NarrativeEvent> produced = runExtractor(extractor, current, stateBeforeTurn);
                states.get(extractor.name()).recordRun(turn.currentMessage(), !produced.isEmpty());
                turnEvents.addAll(produced);

                if (request.isCancelled()) {
                    return abort(turn, diagnostics);
                }
            }
            turn.progress().sectionCompleted(phase);
        }

        List<NarrativeEvent> resolved = new TurnNameResolver(turn.disambiguator())
            .resolve(stateBeforeTurn, turnEvents, turn.currentMessage(), timestamp);
        if (request.isCancelled()) {
            return abort(turn, diagnostics);
        }

        turn.store().appendTurn(turn.currentMessage(), resolved);
        boolean chapterEnded = resolved.stream().anyMatch(e -> e.type() == EventType.CHAPTER_ENDED);
        metrics.recordTurn(false, resolved.size());
        log.info("Turn committed message={} swipe={} events={} errors={} chapterEnded={}",
            turn.currentMessage().messageId(), turn.currentMessage().swipeId(),
            resolved.size(), diagnostics.errors().size(), chapterEnded);
        return new ExtractionResult(resolved, chapterEnded, diagnostics.errors(), false);
    }

    private List<NarrativeEvent> runExtractor(Extractor extractor,
                                              ExtractionRequest request,
                                              NarrativeState stateBeforeTurn) {
        if (extractor instanceof GlobalExtractor global) {
            return runUnit(request, extractor.name(), () -> global.run(request));
        }
        // targets include characters that appeared earlier this turn
        List<String> present = request.turnEvents().isEmpty()
            ? stateBeforeTurn.charactersPresent()
            : ProjectionReducer.apply(stateBeforeTurn, request.turnEvents())
                .charactersPresent();

        if (extractor instanceof PerCharacterExtractor perCharacter) {
            if (present.isEmpty()) {
                return List.of();
            }
            if (perCharacter instanceof BatchCapable batchCapable && present.size() >= 2) {
                BatchAttempt attempt = batchStrategy.tryBatch(batchCapable, request, present);
                if (attempt instanceof BatchAttempt.Success success) {
                    return success.events();
                }
            }
            return fanOut(request, present,
                character -> extractor.name() + ":" + character,
                character -> perCharacter.run(request, character));
        }
        if (extractor instanceof PerPairExtractor perPair) {
            List<CharacterPair> pairs = CharacterPair.uniquePairs(present);
            if (pairs.isEmpty()) {
                return List.of();
            }
            return fanOut(request, pairs,
                pair -> extractor.name() + ":" + pair.label(),
                pair -> perPair.run(request, pair));
        }
        throw new IllegalStateException("Unsupported extractor type: " + extractor.getClass().getName());
    }

    private <T> List<NarrativeEvent> fanOut(ExtractionRequest request,
                                            List<T> targets,
                                            Function<T, String> unitName,
                                            Function<T, List<NarrativeEvent>> unit) {
        int maxConcurrency = request.settings().maxConcurrentRequests();
        List<List<NarrativeEvent>> results;
        if (maxConcurrency <= 1 || targets.size() == 1) {
            results = new ArrayList<>(targets.size());
            for (T target : targets) {
                if (request.isCancelled()) {
                    break;
                }
                results.add(runUnit(request, unitName.apply(target), () -> unit.apply(target)));
            }
        } else {
            results = workerPool.map(targets, maxConcurrency, (target, index) -> request.isCancelled()
                ? List.of()
                : runUnit(request, unitName.apply(target), () -> unit.apply(target)));
        }
        List<NarrativeEvent> flattened = new ArrayList<>();
        results.forEach(flattened::addAll);
        return flattened;
    }

    private List<NarrativeEvent> runUnit(ExtractionRequest request, String unitName, Unit unit) {
        try {
            List<NarrativeEvent> events = unit.run();
            return events == null ? List.of() : events;
        } catch (RuntimeException ex) {
            log.error("{} failed", unitName, ex);
            request.diagnostics().report(unitName, ErrorKind.EXTRACTOR_EXCEPTION, BatchFallbackStrategy.describe(ex));
            return List.of();
        }
    }

    private ExtractionResult abort(ExtractionTurn turn, ExtractionDiagnostics diagnostics) {
        metrics.recordTurn(true, 0);
        log.info("Turn aborted message={} swipe={}, nothing committed",
            turn.currentMessage().messageId(), turn.currentMessage().swipeId());
        return ExtractionResult.aborted(diagnostics.errors());
    }

    @FunctionalInterface
    private interface Unit {
        List<NarrativeEvent> run();
    }
}
