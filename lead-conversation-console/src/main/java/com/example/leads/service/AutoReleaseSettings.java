package com.example.leads.service;

import com.example.leads.config.LeadConsoleProperties;
import com.example.leads.store.RecordStoreClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AutoReleaseSettings {

    private final RecordStoreClient recordStore;
    private final LeadConsoleProperties properties;

    public int autoReleaseHours(String organizationId) {
        int configured = recordStore.findAutoReleaseHours(organizationId)
                .orElse(properties.getEscalation().getDefaultAutoReleaseHours());
        if (configured < 0 || configured > LeadConsoleProperties.Escalation.MAX_AUTO_RELEASE_HOURS) {
            int clamped = Math.max(0, Math.min(configured, LeadConsoleProperties.Escalation.MAX_AUTO_RELEASE_HOURS));
            log.warn("Organization {} has hitl_auto_release_hours={} outside 0..{}, using {}",
                    organizationId, configured, LeadConsoleProperties.Escalation.MAX_AUTO_RELEASE_HOURS, clamped);
            return clamped;
        }
        return configured;
    }
}
