package com.example.leads.service;

import com.example.leads.config.LeadConsoleProperties;
import com.example.leads.domain.LeadFilters;
import com.example.leads.event.LeadEventListener;
import com.example.leads.event.LeadLifecycleEvent;
import com.example.leads.store.RecordStoreClient;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class MergeSessionRegistry implements LeadEventListener {

    private final Map<String, MergeSession> sessions = new ConcurrentHashMap<>();

    private final RecordStoreClient recordStore;
    private final LeadViewService viewService;
    private final LeadMergeEngine mergeEngine;
    private final EscalationService escalationService;
    private final CascadeDeleteOrchestrator deleteOrchestrator;
    private final AutoReleaseSettings autoReleaseSettings;
    private final TaskScheduler taskScheduler;
    private final Executor mergeExecutor;
    private final Clock clock;
    private final LeadConsoleProperties properties;

    public MergeSessionRegistry(RecordStoreClient recordStore,
                                LeadViewService viewService,
                                LeadMergeEngine mergeEngine,
                                EscalationService escalationService,
                                CascadeDeleteOrchestrator deleteOrchestrator,
                                AutoReleaseSettings autoReleaseSettings,
                                TaskScheduler taskScheduler,
                                @Qualifier("mergeExecutor") Executor mergeExecutor,
                                Clock clock,
                                LeadConsoleProperties properties) {
        this.recordStore = recordStore;
        this.viewService = viewService;
        this.mergeEngine = mergeEngine;
        this.escalationService = escalationService;
        this.deleteOrchestrator = deleteOrchestrator;
        this.autoReleaseSettings = autoReleaseSettings;
        this.taskScheduler = taskScheduler;
        this.mergeExecutor = mergeExecutor;
        this.clock = clock;
        this.properties = properties;
    }

    public MergeSession open(String clientKey, String organizationId, LeadFilters filters, MergeSessionListener listener) {
        MergeSession session = new MergeSession(
                organizationId,
                filters,
                recordStore,
                viewService,
                mergeEngine,
                escalationService,
                deleteOrchestrator,
                autoReleaseSettings,
                new CountdownClock(taskScheduler, properties.getEscalation().getCountdownInterval(), clock),
                mergeExecutor,
                clock,
                listener);
        MergeSession previous = sessions.put(clientKey, session);
        if (previous != null) {
            previous.close();
            log.debug("Client {} switched scope from organization {} to {}",
                    clientKey, previous.getOrganizationId(), organizationId);
        }
        session.open();
        return session;
    }

    public Optional<MergeSession> find(String clientKey) {
        return Optional.ofNullable(sessions.get(clientKey));
    }

    public void close(String clientKey) {
        MergeSession session = sessions.remove(clientKey);
        if (session != null) {
            session.close();
        }
    }

    public int size() {
        return sessions.size();
    }

    @Override
    public void onLifecycleEvent(LeadLifecycleEvent event) {
        List<MergeSession> affected = sessions.values().stream()
                .filter(session -> session.getOrganizationId().equals(event.getOrganizationId()))
                .toList();
        affected.forEach(MergeSession::requestMerge);
        if (!affected.isEmpty()) {
            log.debug("{} event for organization {} re-merging {} view(s)",
                    event.getType(), event.getOrganizationId(), affected.size());
        }
    }

    @PreDestroy
    public void closeAll() {
        sessions.keySet().forEach(this::close);
    }
}
