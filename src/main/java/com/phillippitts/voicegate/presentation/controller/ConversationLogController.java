package com.phillippitts.voicegate.presentation.controller;

import com.phillippitts.voicegate.presentation.dto.CaptureEventRequest;
import com.phillippitts.voicegate.service.capture.EventCaptureRouter;
import com.phillippitts.voicegate.service.capture.RouteOutcome;
import com.phillippitts.voicegate.service.conversation.ConversationLogger;
import com.phillippitts.voicegate.service.conversation.SessionLogStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Capture event ingestion. Always answers 200; {@code accepted=false} tells the client the event was
 * dropped.
 */
@RestController
@RequestMapping("/conversation/log")
class ConversationLogController {

    private final EventCaptureRouter router;
    private final ConversationLogger conversationLogger;

    ConversationLogController(EventCaptureRouter router, ConversationLogger conversationLogger) {
        this.router = router;
        this.conversationLogger = conversationLogger;
    }

    @PostMapping
    ResponseEntity<Map<String, Object>> log(@RequestBody CaptureEventRequest body) {
        RouteOutcome outcome = router.route(body.toEvent());
        return ResponseEntity.ok(Map.of("accepted", outcome.accepted()));
    }

    @GetMapping
    ResponseEntity<SessionLogStats> stats(@RequestParam("session_id") String sessionId) {
        return ResponseEntity.ok(conversationLogger.getSessionStats(sessionId));
    }
}
