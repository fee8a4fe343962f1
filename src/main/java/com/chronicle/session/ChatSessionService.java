package com.chronicle.session;

import com.chronicle.api.SessionNotFoundException;
import com.chronicle.api.TurnInProgressException;
import com.chronicle.config.ExtractionProperties;
import com.chronicle.contract.EventContractValidator;
import com.chronicle.event.EventKind;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.ExtractorStateRegistry;
import com.chronicle.extractor.SettingsProvider;
import com.chronicle.generation.CancellationToken;
import com.chronicle.generation.ExtractionMetricsService;
import com.chronicle.generation.PromptExecutor;
import com.chronicle.names.CachingNameDisambiguator;
import com.chronicle.names.SkippingNameDisambiguator;
import com.chronicle.names.UnresolvedNameMapping;
import com.chronicle.orchestration.BoundedWorkerPool;
import com.chronicle.orchestration.ExtractionOrchestrator;
import com.chronicle.orchestration.ExtractionProgress;
import com.chronicle.orchestration.ExtractionResult;
import com.chronicle.orchestration.ExtractionTurn;
import com.chronicle.orchestration.ExtractorRegistry;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.Projection;
import com.chronicle.store.InMemoryEventStore;
import com.chronicle.store.Snapshot;
import com.chronicle.store.SwipeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Chat sessions and their turns. Committed events are pushed to subscribers
 * of the session.
 */
@Service
public class ChatSessionService {

    private static final Logger log = LoggerFactory.getLogger(ChatSessionService.class);

    private final EventContractValidator validator;
    private final ExtractorRegistry extractors;
    private final PromptExecutor promptExecutor;
    private final BoundedWorkerPool workerPool;
    private final ExtractionMetricsService metrics;
    private final SettingsProvider settings;
    private final ExtractionProperties properties;
    private final Clock clock;
    private final ConcurrentHashMap<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Subscription> subscribers = new ConcurrentHashMap<>();

    private record Subscription(String sessionId, Consumer<NarrativeEvent> consumer) {
    }

    public ChatSessionService(EventContractValidator validator,
                              ExtractorRegistry extractors,
                              PromptExecutor promptExecutor,
                              BoundedWorkerPool workerPool,
                              ExtractionMetricsService metrics,
                              ExtractionProperties properties,
                              Clock clock) {
        this.validator = validator;
        this.extractors = extractors;
        this.promptExecutor = promptExecutor;
        this.workerPool = workerPool;
        this.metrics = metrics;
        this.settings = properties;
        this.properties = properties;
        this.clock = clock;
    }

    public ChatSession createSession(NarrativeState initialState) {
        String id = UUID.randomUUID().toString();
        InMemoryEventStore store = new InMemoryEventStore(validator,
            initialState == null ? NarrativeState.EMPTY : initialState, clock);
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(extractors, new ExtractorStateRegistry(),
            promptExecutor, workerPool, metrics, clock);
        ChatSession session = new ChatSession(id, store, orchestrator,
            new CachingNameDisambiguator(new SkippingNameDisambiguator()), clock.millis());
        sessions.put(id, session);
        log.info("Session created id={}", id);
        return session;
    }

    public ChatSession get(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public ExtractionResult runTurn(String sessionId, TurnRequest request) {
        return runTurn(sessionId, request, null);
    }

    public ExtractionResult runTurn(String sessionId, TurnRequest request, ExtractionProgress progress) {
        if (request.messageId() < 0 || request.swipeId() < 0) {
            throw new IllegalArgumentException("messageId and swipeId must be >= 0");
        }
        ChatSession session = get(sessionId);
        CancellationToken token = new CancellationToken();
        if (!session.beginTurn(token)) {
            throw new TurnInProgressException(sessionId);
        }
        try {
            SwipeContext swipes = request.swipeContext();
            ExtractionResult result = session.orchestrator().extractEvents(new ExtractionTurn(
                session.store(), request.context(), settings.current(), request.currentMessage(), swipes,
                token, session.disambiguator(), progress));
            if (!result.aborted()) {
                maybeCheckpoint(session, request.messageId(), swipes, result.chapterEnded());
                result.newEvents().forEach(event -> notifySubscribers(sessionId, event));
            }
            return result;
        } finally {
            session.endTurn(token);
        }
    }

    /** Cancels the running turn; false when none is running. */
    public boolean cancelTurn(String sessionId) {
        return get(sessionId).runningTurn()
            .map(token -> {
                token.cancel();
                log.info("Turn cancellation requested for session={}", sessionId);
                return true;
            })
            .orElse(false);
    }

    public Snapshot replaceInitialSnapshot(String sessionId, NarrativeState state) {
        ChatSession session = get(sessionId);
        session.store().replaceInitialSnapshot(state);
        session.checkpointTaken(-1);
        return session.store().initialSnapshot();
    }

    public void registerNameMappings(String sessionId, List<UnresolvedNameMapping> mappings) {
        ChatSession session = get(sessionId);
        if (mappings == null) {
            throw new IllegalArgumentException("mappings must not be null");
        }
        for (UnresolvedNameMapping mapping : mappings) {
            if (mapping == null || mapping.unresolvedName() == null || mapping.unresolvedName().isBlank()) {
                throw new IllegalArgumentException("every mapping needs a non-blank unresolvedName");
            }
        }
        mappings.forEach(session.disambiguator()::register);
        log.info("Registered {} name mappings for session={}", mappings.size(), sessionId);
    }

    public List<NarrativeEvent> events(String sessionId, int upToMessage, SwipeContext swipes,
                                       EventKind kind, int limit) {
        List<NarrativeEvent> active = kind == null
            ? get(sessionId).store().getActiveEvents(upToMessage, swipes)
            : get(sessionId).store().getActiveEventsOfKind(upToMessage, swipes, kind);
        int from = Math.max(0, active.size() - limit);
        return active.stream().skip(from).collect(Collectors.toList());
    }

    public Projection projection(String sessionId, int messageId, SwipeContext swipes) {
        return get(sessionId).store().projectStateAtMessage(messageId, swipes);
    }

    public String subscribe(String sessionId, Consumer<NarrativeEvent> consumer) {
        get(sessionId);
        String id = UUID.randomUUID().toString();
        subscribers.put(id, new Subscription(sessionId, consumer));
        return id;
    }

    public void unsubscribe(String subscriptionId) {
        subscribers.remove(subscriptionId);
    }

    private void maybeCheckpoint(ChatSession session, int messageId, SwipeContext swipes, boolean chapterEnded) {
        int interval = properties.getSnapshotInterval();
        boolean due = interval > 0 && messageId - session.lastCheckpointMessage() >= interval;
        if (chapterEnded || due) {
            session.store().addCheckpoint(messageId, swipes);
            session.checkpointTaken(messageId);
            log.debug("Checkpoint taken session={} message={} chapterEnded={}",
                session.id(), messageId, chapterEnded);
        }
    }

    private void notifySubscribers(String sessionId, NarrativeEvent event) {
        subscribers.values().forEach(subscription -> {
            if (!subscription.sessionId().equals(sessionId)) {
                return;
            }
            try {
                subscription.consumer().accept(event);
            } catch (Exception ex) {
                log.warn("Subscriber notification failed for event={}: {}", event.id(), ex.getMessage());
            }
        });
    }
}
