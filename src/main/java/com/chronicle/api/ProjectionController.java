package com.chronicle.api;

import com.chronicle.projection.Projection;
import com.chronicle.session.ChatSessionService;
import com.chronicle.store.SwipeContext;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Story state at a message, under the given swipe choices.
 *
 * GET /v1/sessions/{sessionId}/projection?messageId=12&swipes=3:1,4:0
 */
@RestController
@RequestMapping("/v1/sessions/{sessionId}/projection")
public class ProjectionController {

    private final ChatSessionService sessionService;

    public ProjectionController(ChatSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping
    public Projection getProjection(@PathVariable String sessionId,
                                    @RequestParam int messageId,
                                    @RequestParam(required = false) String swipes) {
        return sessionService.projection(sessionId, messageId, SwipeContext.parse(swipes));
    }
}
