package com.chronicle.api;

import com.chronicle.names.UnresolvedNameMapping;
import com.chronicle.orchestration.ExtractionResult;
import com.chronicle.projection.NarrativeState;
import com.chronicle.session.ChatSession;
import com.chronicle.session.ChatSessionService;
import com.chronicle.session.TurnRequest;
import com.chronicle.store.Snapshot;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/sessions")
public class SessionController {

    private final ChatSessionService sessionService;

    public SessionController(ChatSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> create(@RequestBody(required = false) NarrativeState initialState) {
        ChatSession session = sessionService.createSession(initialState);
        return Map.of(
            "session_id", session.id(),
            "created_at", session.createdAt()
        );
    }

    @PutMapping("/{sessionId}/initial-snapshot")
    public Snapshot replaceInitialSnapshot(@PathVariable String sessionId, @RequestBody NarrativeState state) {
        return sessionService.replaceInitialSnapshot(sessionId, state);
    }

    @PostMapping("/{sessionId}/turns")
    public ExtractionResult runTurn(@PathVariable String sessionId, @RequestBody TurnRequest request) {
        return sessionService.runTurn(sessionId, request);
    }

    @PostMapping("/{sessionId}/turns/cancel")
    public Map<String, Object> cancelTurn(@PathVariable String sessionId) {
        return Map.of("cancelled", sessionService.cancelTurn(sessionId));
    }

    @PostMapping("/{sessionId}/name-mappings")
    public Map<String, Object> registerNameMappings(@PathVariable String sessionId,
                                                    @RequestBody List<UnresolvedNameMapping> mappings) {
        sessionService.registerNameMappings(sessionId, mappings);
        return Map.of("status", "accepted", "registered", mappings.size());
    }
}
