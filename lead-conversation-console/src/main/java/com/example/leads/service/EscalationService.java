package com.example.leads.service;

import com.example.leads.config.LeadConsoleProperties;
import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationSession;
import com.example.leads.event.LeadEventPublisher;
import com.example.leads.event.LeadEventType;
import com.example.leads.event.LeadLifecycleEvent;
import com.example.leads.service.exception.ServiceException;
import com.example.leads.store.RecordStoreClient;
import com.example.leads.store.SessionPatch;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationService {

    private final RecordStoreClient recordStore;
    private final SessionLockManager lockManager;
    private final AutoReleaseSettings autoReleaseSettings;
    private final LeadEventPublisher eventPublisher;
    private final LeadConsoleProperties properties;
    private final Clock clock;

    public ConversationSession escalate(String sessionId, String reason) {
        return lockManager.withSessionLock(sessionId, () -> {
            ConversationSession session = requireSession(sessionId);
            ControlMode mode = session.effectiveControlMode();
            if (mode == ControlMode.HUMAN) {
                log.debug("Session {} already escalated", sessionId);
                return session;
            }
            if (mode != ControlMode.AGENT) {
                throw ServiceException.invalidTransition(
                        "Cannot escalate session %s while it is %s".formatted(sessionId, mode.wireValue()));
            }
            String effectiveReason = StringUtils.hasText(reason)
                    ? reason.trim()
                    : properties.getEscalation().getDefaultReason();
            ConversationSession updated = apply(sessionId, escalationPatch(effectiveReason));
            log.info("Escalated session {} of organization {} to human control", sessionId, updated.getOrganizationId());
            publish(LeadEventType.ESCALATED, updated, Map.of("reason", effectiveReason));
            return updated;
        });
    }

    public ConversationSession release(String sessionId) {
        return lockManager.withSessionLock(sessionId, () -> {
            ConversationSession session = requireSession(sessionId);
            if (session.effectiveControlMode() == ControlMode.AGENT) {
                log.debug("Session {} already under agent control", sessionId);
                return session;
            }
            ConversationSession updated = apply(sessionId, SessionPatch.release());
            log.info("Released session {} of organization {} back to the agent", sessionId, updated.getOrganizationId());
            publish(LeadEventType.RELEASED, updated, Map.of("previousMode", session.effectiveControlMode().wireValue()));
            return updated;
        });
    }

    public ConversationSession prolong(String sessionId) {
        return lockManager.withSessionLock(sessionId, () -> {
            ConversationSession session = requireSession(sessionId);
            if (session.effectiveControlMode() != ControlMode.HUMAN) {
                throw ServiceException.invalidTransition(
                        "Cannot prolong session %s while it is %s"
                                .formatted(sessionId, session.effectiveControlMode().wireValue()));
            }
            ConversationSession updated = apply(sessionId, prolongPatch());
            log.info("Prolonged escalation of session {} until auto-release window restarts at {}",
                    sessionId, updated.getEscalatedAt());
            publish(LeadEventType.PROLONGED, updated, Map.of());
            return updated;
        });
    }

    public Optional<ConversationSession> autoReleaseIfExpired(String sessionId) {
        return lockManager.withSessionLock(sessionId, () -> {
            Optional<ConversationSession> current = recordStore.getSession(sessionId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            ConversationSession session = current.get();
            int hours = autoReleaseSettings.autoReleaseHours(session.getOrganizationId());
            Duration remaining = AutoReleaseTimer.timeRemaining(session, hours, clock.instant());
            if (!AutoReleaseTimer.isExpired(remaining)) {
                return Optional.empty();
            }
            Optional<ConversationSession> released = recordStore.updateSession(sessionId, SessionPatch.release());
            released.ifPresent(updated -> {
                log.info("Auto-released session {} of organization {} after {}h under human control",
                        sessionId, updated.getOrganizationId(), hours);
                Map<String, Object> payload = new HashMap<>();
                payload.put("autoReleaseHours", hours);
                payload.put("escalatedAt", session.getEscalatedAt());
                publish(LeadEventType.AUTO_RELEASED, updated, payload);
            });
            return released;
        });
    }

    public Duration timeRemaining(ConversationSession session) {
        if (session == null) {
            return null;
        }
        int hours = autoReleaseSettings.autoReleaseHours(session.getOrganizationId());
        return AutoReleaseTimer.timeRemaining(session, hours, clock.instant());
    }

    public SessionPatch escalationPatch(String reason) {
        return SessionPatch.escalate(clock.instant(), StringUtils.hasText(reason)
                ? reason.trim()
                : properties.getEscalation().getDefaultReason());
    }

    public SessionPatch prolongPatch() {
        return SessionPatch.prolong(clock.instant());
    }

    private ConversationSession requireSession(String sessionId) {
        return recordStore.getSession(sessionId)
                .orElseThrow(() -> ServiceException.notFound("Conversation session " + sessionId + " not found"));
    }

    private ConversationSession apply(String sessionId, SessionPatch patch) {
        return recordStore.updateSession(sessionId, patch)
                .orElseThrow(() -> ServiceException.notFound("Conversation session " + sessionId + " was removed"));
    }

    private void publish(LeadEventType type, ConversationSession session, Map<String, Object> payload) {
        eventPublisher.publish(LeadLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .organizationId(session.getOrganizationId())
                .phone(session.getPhone())
                .subjectId(session.getId())
                .occurredAt(Instant.now(clock))
                .payload(payload)
                .build());
    }
}
