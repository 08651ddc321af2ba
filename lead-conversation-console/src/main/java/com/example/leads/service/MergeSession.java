package com.example.leads.service;

import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationSession;
import com.example.leads.domain.LeadFilters;
import com.example.leads.domain.MergedLeadView;
import com.example.leads.domain.PhoneNumbers;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import com.example.leads.store.ChangeEvent;
import com.example.leads.store.ChangeFeed;
import com.example.leads.store.ChangeListener;
import com.example.leads.store.RecordStoreClient;
import com.example.leads.store.RecordTable;
import com.example.leads.store.SessionPatch;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class MergeSession implements AutoCloseable {

    private static final List<RecordTable> WATCHED_TABLES =
            List.of(RecordTable.LEADS, RecordTable.CONVERSATION_SESSIONS);

    private final String organizationId;
    private final RecordStoreClient recordStore;
    private final LeadViewService viewService;
    private final LeadMergeEngine mergeEngine;
    private final EscalationService escalationService;
    private final CascadeDeleteOrchestrator deleteOrchestrator;
    private final AutoReleaseSettings autoReleaseSettings;
    private final CountdownClock countdownClock;
    private final Executor executor;
    private final Clock clock;
    private final MergeSessionListener listener;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean pending = new AtomicBoolean();
    private final Map<RecordTable, ChangeFeed> feeds = new EnumMap<>(RecordTable.class);
    private final Set<String> autoReleaseRequested = ConcurrentHashMap.newKeySet();
    private final ChangeListener changeListener = new FeedListener();

    private volatile boolean closed;
    private volatile LeadFilters filters;
    private volatile List<MergedLeadView> views = List.of();
    private volatile boolean stale;
    private volatile boolean loaded;
    private volatile int autoReleaseHours;
    private volatile String selectedLeadId;

    public MergeSession(String organizationId,
                        LeadFilters filters,
                        RecordStoreClient recordStore,
                        LeadViewService viewService,
                        LeadMergeEngine mergeEngine,
                        EscalationService escalationService,
                        CascadeDeleteOrchestrator deleteOrchestrator,
                        AutoReleaseSettings autoReleaseSettings,
                        CountdownClock countdownClock,
                        Executor executor,
                        Clock clock,
                        MergeSessionListener listener) {
        this.organizationId = Objects.requireNonNull(organizationId, "organizationId");
        this.filters = LeadFilters.orNone(filters);
        this.recordStore = recordStore;
        this.viewService = viewService;
        this.mergeEngine = mergeEngine;
        this.escalationService = escalationService;
        this.deleteOrchestrator = deleteOrchestrator;
        this.autoReleaseSettings = autoReleaseSettings;
        this.countdownClock = countdownClock;
        this.executor = executor;
        this.clock = clock;
        this.listener = listener;
    }

    public void open() {
        ensureFeeds();
        requestMerge();
    }

    public void requestMerge() {
        if (closed) {
            return;
        }
        pending.set(true);
        if (running.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    public void updateFilters(LeadFilters next) {
        LeadFilters resolved = LeadFilters.orNone(next);
        LeadFilters previous = this.filters;
        this.filters = resolved;
        if (loaded && resolved.sameStorePredicates(previous)) {
            publishSnapshot();
        } else {
            requestMerge();
        }
    }

    public void select(String leadId) {
        this.selectedLeadId = leadId;
        refreshSelection();
    }

    public boolean escalate(String sessionId, String reason) {
        Optional<ConversationSession> current = findSession(sessionId);
        if (current.isPresent() && current.get().effectiveControlMode() == ControlMode.AGENT) {
            project(sessionId, escalationService.escalationPatch(reason)::applyTo);
        }
        return runTransition(sessionId, () -> escalationService.escalate(sessionId, reason));
    }

    public boolean release(String sessionId) {
        Optional<ConversationSession> current = findSession(sessionId);
        if (current.isPresent() && current.get().effectiveControlMode() != ControlMode.AGENT) {
            project(sessionId, SessionPatch.release()::applyTo);
        }
        return runTransition(sessionId, () -> escalationService.release(sessionId));
    }

    public boolean prolong(String sessionId) {
        Optional<ConversationSession> current = findSession(sessionId);
        if (current.isPresent() && current.get().effectiveControlMode() == ControlMode.HUMAN) {
            project(sessionId, escalationService.prolongPatch()::applyTo);
        }
        return runTransition(sessionId, () -> escalationService.prolong(sessionId));
    }

    public DeletionResult deleteLead(String leadId) {
        MergedLeadView target = views.stream()
                .filter(view -> view.getId().equals(leadId))
                .findFirst()
                .orElseThrow(() -> ServiceException.notFound("Lead " + leadId + " is not in the current view"));
        views = views.stream()
                .filter(view -> !view.getId().equals(leadId))
                .filter(view -> !PhoneNumbers.correlates(target.getPhone(), view.getPhone()))
                .toList();
        publishSnapshot();
        refreshSelection();
        try {
            DeletionResult result = deleteOrchestrator.deleteLead(organizationId, target);
            if (result.isFailed()) {
                listener.onError(result.getFailure());
            }
            return result;
        } finally {
            requestMerge();
        }
    }

    public LeadViewSnapshot snapshot() {
        LeadFilters current = filters;
        return LeadViewSnapshot.builder()
                .organizationId(organizationId)
                .filters(current)
                .leads(mergeEngine.applyViewFilters(views, current))
                .stale(stale)
                .selectedLeadId(selectedLeadId)
                .generatedAt(clock.instant())
                .build();
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isStale() {
        return stale;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        synchronized (feeds) {
            feeds.values().forEach(this::closeQuietly);
            feeds.clear();
        }
        countdownClock.stop();
        log.debug("Closed merge session for organization {}", organizationId);
    }

    private void drain() {
        do {
            try {
                while (!closed && pending.getAndSet(false)) {
                    runPass();
                }
            } finally {
                running.set(false);
            }
        } while (!closed && pending.get() && running.compareAndSet(false, true));
    }

    private void runPass() {
        boolean live = ensureFeeds();
        LeadFilters current = filters;
        try {
            List<MergedLeadView> merged = viewService.mergePass(organizationId, current);
            int hours = autoReleaseSettings.autoReleaseHours(organizationId);
            if (closed) {
                log.debug("Discarding merge pass of closed session for organization {}", organizationId);
                return;
            }
            views = merged;
            autoReleaseHours = hours;
            stale = !live;
            loaded = true;
        } catch (RuntimeException ex) {
            if (closed) {
                return;
            }
            stale = true;
            log.warn("Merge pass for organization {} failed, keeping last snapshot of {} lead(s)",
                    organizationId, views.size(), ex);
            listener.onError(asServiceException(ex));
        }
        publishSnapshot();
        refreshSelection();
    }

    private boolean ensureFeeds() {
        boolean live = true;
        synchronized (feeds) {
            for (RecordTable table : WATCHED_TABLES) {
                if (closed) {
                    return false;
                }
                ChangeFeed existing = feeds.get(table);
                if (existing != null && existing.isActive()) {
                    continue;
                }
                if (existing != null) {
                    closeQuietly(existing);
                    feeds.remove(table);
                }
                try {
                    feeds.put(table, recordStore.subscribe(table, organizationId, changeListener));
                    log.debug("Subscribed to {} changes of organization {}", table, organizationId);
                } catch (RuntimeException ex) {
                    live = false;
                    stale = true;
                    log.warn("Could not subscribe to {} changes of organization {}", table, organizationId, ex);
                    listener.onError(new ServiceException(ErrorCode.SUBSCRIPTION_LOST,
                            "Change feed for " + table.qualifiedName() + " unavailable", ex));
                }
            }
        }
        return live;
    }

    private boolean runTransition(String sessionId, Runnable transition) {
        try {
            transition.run();
            return true;
        } catch (ServiceException ex) {
            log.info("Transition on session {} of organization {} failed: {}", sessionId, organizationId, ex.getMessage());
            listener.onError(ex);
            return false;
        } finally {
            requestMerge();
        }
    }

    private void project(String sessionId, UnaryOperator<ConversationSession> change) {
        views = views.stream()
                .map(view -> view.hasSession() && sessionId.equals(view.getSession().getId())
                        ? view.withSession(change.apply(view.getSession()))
                        : view)
                .toList();
        publishSnapshot();
        refreshSelection();
    }

    private Optional<ConversationSession> findSession(String sessionId) {
        return views.stream()
                .filter(MergedLeadView::hasSession)
                .map(MergedLeadView::getSession)
                .filter(session -> sessionId.equals(session.getId()))
                .findFirst();
    }

    private void refreshSelection() {
        if (closed) {
            return;
        }
        String leadId = selectedLeadId;
        Optional<ConversationSession> session = leadId == null
                ? Optional.empty()
                : views.stream()
                        .filter(view -> view.getId().equals(leadId))
                        .findFirst()
                        .map(MergedLeadView::getSession);
        if (session.isEmpty()) {
            countdownClock.stop();
            return;
        }
        countdownClock.track(session.get(), autoReleaseHours, this::onTick);
    }

    private void onTick(CountdownTick tick) {
        if (closed) {
            return;
        }
        listener.onCountdown(tick);
        if (tick.isExpired() && autoReleaseRequested.add(tick.getSessionId())) {
            executor.execute(() -> autoRelease(tick.getSessionId()));
        }
    }

    private void autoRelease(String sessionId) {
        try {
            escalationService.autoReleaseIfExpired(sessionId)
                    .ifPresent(released -> project(sessionId, SessionPatch.release()::applyTo));
        } catch (RuntimeException ex) {
            log.warn("Auto-release of session {} failed, will retry on next expiry signal", sessionId, ex);
            listener.onError(asServiceException(ex));
        } finally {
            autoReleaseRequested.remove(sessionId);
            requestMerge();
        }
    }

    private void publishSnapshot() {
        if (closed) {
            return;
        }
        try {
            listener.onSnapshot(snapshot());
        } catch (RuntimeException ex) {
            log.warn("Snapshot listener failed for organization {}", organizationId, ex);
        }
    }

    private void closeQuietly(ChangeFeed feed) {
        try {
            feed.close();
        } catch (RuntimeException ex) {
            log.debug("Failed to close {} feed of organization {}", feed.table(), organizationId, ex);
        }
    }

    private static ServiceException asServiceException(RuntimeException ex) {
        if (ex instanceof ServiceException se) {
            return se;
        }
        return ServiceException.transientStore(ex.getMessage(), ex);
    }

    private class FeedListener implements ChangeListener {

        @Override
        public void onChange(ChangeEvent event) {
            log.debug("{} on {} ({}) for organization {}", event.getType(), event.getTable(),
                    event.getRecordId(), organizationId);
            requestMerge();
        }

        @Override
        public void onFeedLost(RecordTable table, String lostOrganizationId) {
            if (closed) {
                return;
            }
            stale = true;
            listener.onError(new ServiceException(ErrorCode.SUBSCRIPTION_LOST,
                    "Change feed for " + table.qualifiedName() + " was lost, resubscribing"));
            requestMerge();
        }
    }
}
