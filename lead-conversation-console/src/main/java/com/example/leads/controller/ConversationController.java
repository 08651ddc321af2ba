package com.example.leads.controller;

import com.example.leads.domain.ConversationMessage;
import com.example.leads.domain.ConversationSession;
import com.example.leads.dto.EscalateRequest;
import com.example.leads.service.CountdownTick;
import com.example.leads.service.EscalationService;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import com.example.leads.store.RecordStoreClient;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final EscalationService escalationService;
    private final RecordStoreClient recordStore;

    public ConversationController(EscalationService escalationService, RecordStoreClient recordStore) {
        this.escalationService = escalationService;
        this.recordStore = recordStore;
    }

    @PostMapping("/{sessionId}/escalate")
    public ResponseEntity<ConversationSession> escalate(
            @PathVariable String sessionId,
            @Valid @RequestBody(required = false) EscalateRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(escalationService.escalate(sessionId, reason));
    }

    @PostMapping("/{sessionId}/release")
    public ResponseEntity<ConversationSession> release(@PathVariable String sessionId) {
        return ResponseEntity.ok(escalationService.release(sessionId));
    }

    @PostMapping("/{sessionId}/prolong")
    public ResponseEntity<ConversationSession> prolong(@PathVariable String sessionId) {
        return ResponseEntity.ok(escalationService.prolong(sessionId));
    }

    @GetMapping("/{sessionId}/countdown")
    public ResponseEntity<CountdownTick> countdown(@PathVariable String sessionId) {
        ConversationSession session = recordStore.getSession(sessionId)
                .orElseThrow(() -> ServiceException.notFound("Conversation session " + sessionId + " not found"));
        return ResponseEntity.ok(CountdownTick.of(sessionId, escalationService.timeRemaining(session)));
    }

    @GetMapping("/messages")
    public ResponseEntity<List<ConversationMessage>> latestMessages(@RequestParam String phone) {
        if (!StringUtils.hasText(phone)) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "phone is required");
        }
        return ResponseEntity.ok(recordStore.getLatestMessagesForPhone(phone));
    }
}
