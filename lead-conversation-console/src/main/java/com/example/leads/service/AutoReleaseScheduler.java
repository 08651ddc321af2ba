package com.example.leads.service;

import com.example.leads.config.LeadConsoleProperties;
import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationSession;
import com.example.leads.service.exception.ServiceException;
import com.example.leads.store.RecordStoreClient;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class AutoReleaseScheduler {

    private final LeadConsoleProperties properties;
    private final RecordStoreClient recordStore;
    private final AutoReleaseSettings autoReleaseSettings;
    private final EscalationService escalationService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${leads.housekeeping.interval:PT1M}').toMillis()}")
    public void enforceAutoRelease() {
        if (!properties.getEscalation().isEnforceAutoRelease()) {
            return;
        }
        List<ConversationSession> escalated;
        try {
            escalated = recordStore.listSessionsByControlMode(ControlMode.HUMAN);
        } catch (ServiceException ex) {
            log.warn("Skipping auto-release cycle, escalated sessions unavailable", ex);
            return;
        }
        if (CollectionUtils.isEmpty(escalated)) {
            return;
        }

        Instant now = clock.instant();
        Map<String, Integer> hoursByOrganization = new HashMap<>();
        int released = 0;
        for (ConversationSession session : escalated) {
            try {
                int hours = hoursByOrganization.computeIfAbsent(
                        session.getOrganizationId(), autoReleaseSettings::autoReleaseHours);
                if (!AutoReleaseTimer.isExpired(session, hours, now)) {
                    continue;
                }
                if (escalationService.autoReleaseIfExpired(session.getId()).isPresent()) {
                    released++;
                }
            } catch (ServiceException ex) {
                log.trace("Session {} changed before housekeeping processed it", session.getId(), ex);
            } catch (Exception ex) {
                log.warn("Failed to auto-release session {}", session.getId(), ex);
            }
        }
        if (released > 0) {
            log.info("Auto-released {} expired escalation(s)", released);
        }
    }
}
