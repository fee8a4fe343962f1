package com.chronicle.api;

import com.chronicle.event.EventKind;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.session.ChatSessionService;
import com.chronicle.store.SwipeContext;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/v1/sessions/{sessionId}/events")
public class EventController {

    private final ChatSessionService sessionService;

    public EventController(ChatSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping
    public List<NarrativeEvent> query(@PathVariable String sessionId,
                                      @RequestParam(defaultValue = "2147483647") int upToMessage,
                                      @RequestParam(required = false) String swipes,
                                      @RequestParam(required = false) String kind,
                                      @RequestParam(defaultValue = "100") int limit) {
        return sessionService.events(sessionId, upToMessage, SwipeContext.parse(swipes), parseKind(kind),
            Math.max(0, Math.min(limit, 1000)));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String sessionId,
                             @RequestParam(name = "kind", required = false) String kindFilter) {
        EventKind kind = parseKind(kindFilter);
        SseEmitter emitter = new SseEmitter(0L);
        String subscriptionId = sessionService.subscribe(sessionId, event -> {
            if (kind != null && kind != event.kind()) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                    .name(event.type().wireName())
                    .data(event));
            } catch (IOException ex) {
                emitter.completeWithError(ex);
            }
        });

        emitter.onCompletion(() -> sessionService.unsubscribe(subscriptionId));
        emitter.onTimeout(() -> sessionService.unsubscribe(subscriptionId));
        emitter.onError(ex -> sessionService.unsubscribe(subscriptionId));
        return emitter;
    }

    private static EventKind parseKind(String kind) {
        return kind == null || kind.isBlank() ? null : EventKind.fromValue(kind);
    }
}
