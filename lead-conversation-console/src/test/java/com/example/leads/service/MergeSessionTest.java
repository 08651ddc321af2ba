package com.example.leads.service;

import static com.example.leads.support.TestRecords.ORG;
import static com.example.leads.support.TestRecords.T0;
import static com.example.leads.support.TestRecords.escalated;
import static com.example.leads.support.TestRecords.lead;
import static com.example.leads.support.TestRecords.session;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.leads.config.LeadConsoleProperties;
import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationStatusFilter;
import com.example.leads.domain.LeadFilters;
import com.example.leads.domain.MergedLeadView;
import com.example.leads.domain.QualificationScore;
import com.example.leads.event.LeadEventPublisher;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import com.example.leads.store.RecordTable;
import com.example.leads.store.SessionPatch;
import com.example.leads.support.InMemoryRecordStore;
import com.example.leads.support.ManualExecutor;
import com.example.leads.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class MergeSessionTest {

    private static final String P1 = "+15550001";
    private static final String P2 = "+15550002";

    @Mock
    private EscalationService escalationService;

    @Mock
    private LeadEventPublisher eventPublisher;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> future;

    private final InMemoryRecordStore store = new InMemoryRecordStore();
    private final MutableClock clock = new MutableClock(T0);
    private final RecordingListener listener = new RecordingListener();
    private final LeadMergeEngine mergeEngine = new LeadMergeEngine();

    private MergeSession mergeSession;

    @BeforeEach
    void setUp() {
        store.withLead(lead("A", P1, T0)).withSession(session("S2", P2, T0.plusSeconds(30)));
    }

    @Test
    void opensBothFeedsForTheOrganizationAndPublishesTheMerge() {
        open(Runnable::run);

        assertEquals(1, store.activeFeeds(RecordTable.LEADS).size());
        assertEquals(1, store.activeFeeds(RecordTable.CONVERSATION_SESSIONS).size());
        assertTrue(store.feeds().stream().allMatch(feed -> ORG.equals(feed.organizationId())));
        assertEquals(List.of("virtual-S2", "A"), lastIds());
        assertFalse(listener.last().isStale());
    }

    @Test
    void changeOnEitherFeedTriggersARemerge() {
        open(Runnable::run);
        store.withLead(lead("B", "+15550003", T0.plusSeconds(60)));

        store.emit(RecordTable.LEADS, ORG, "B");

        assertEquals(List.of("B", "virtual-S2", "A"), lastIds());

        store.withSession(session("S1", P1, T0.plusSeconds(90)));
        store.emit(RecordTable.CONVERSATION_SESSIONS, ORG, "S1");

        assertEquals("A", lastIds().get(0));
        assertEquals(3, store.sessionListings());
    }

    @Test
    void changesOfOtherOrganizationsAreNotDelivered() {
        open(Runnable::run);

        store.emit(RecordTable.LEADS, "org-2", "X");

        assertEquals(1, store.sessionListings());
    }

    @Test
    void coalescesTriggersWhileAPassIsQueued() {
        ManualExecutor executor = new ManualExecutor();
        open(executor);

        mergeSession.requestMerge();
        mergeSession.requestMerge();
        store.emit(RecordTable.LEADS, ORG, "A");

        assertEquals(1, executor.queued());
        executor.runAll();
        assertEquals(1, store.sessionListings());
    }

    @Test
    void triggersDuringAPassCollapseIntoOneFollowUp() {
        store.beforeListSessions(() -> {
            mergeSession.requestMerge();
            mergeSession.requestMerge();
        });

        open(Runnable::run);

        assertEquals(2, store.sessionListings());
    }

    @Test
    void storeFailureKeepsLastSnapshotAndMarksItStale() {
        open(Runnable::run);
        store.setFailReads(true);

        store.emit(RecordTable.LEADS, ORG, "A");

        assertEquals(List.of("virtual-S2", "A"), lastIds());
        assertTrue(listener.last().isStale());
        assertEquals(ErrorCode.TRANSIENT_STORE_ERROR, listener.lastError().getErrorCode());

        store.setFailReads(false);
        store.emit(RecordTable.LEADS, ORG, "A");

        assertFalse(listener.last().isStale());
    }

    @Test
    void closeTearsDownBothFeedsAndDiscardsThePassInFlight() {
        open(Runnable::run);
        int published = listener.snapshots.size();
        store.beforeListSessions(() -> mergeSession.close());

        mergeSession.requestMerge();

        assertEquals(published, listener.snapshots.size());
        assertTrue(store.activeFeeds(RecordTable.LEADS).isEmpty());
        assertTrue(store.activeFeeds(RecordTable.CONVERSATION_SESSIONS).isEmpty());
        int listings = store.sessionListings();
        store.emit(RecordTable.LEADS, ORG, "A");
        mergeSession.requestMerge();
        assertEquals(listings, store.sessionListings());
    }

    @Test
    void lostFeedIsResubscribed() {
        open(Runnable::run);

        store.loseFeeds(RecordTable.LEADS);

        assertEquals(1, store.activeFeeds(RecordTable.LEADS).size());
        assertEquals(3, store.feeds().size());
        assertTrue(listener.errors.stream().anyMatch(error -> error.is(ErrorCode.SUBSCRIPTION_LOST)));
        assertFalse(listener.last().isStale());
    }

    @Test
    void viewStaysStaleWhileFeedsCannotBeOpened() {
        store.setFailSubscriptions(true);

        open(Runnable::run);

        assertEquals(List.of("virtual-S2", "A"), lastIds());
        assertTrue(listener.last().isStale());

        store.setFailSubscriptions(false);
        mergeSession.requestMerge();

        assertFalse(listener.last().isStale());
        assertEquals(1, store.activeFeeds(RecordTable.LEADS).size());
    }

    @Test
    void viewOnlyFilterChangesDoNotRefetch() {
        open(Runnable::run);

        mergeSession.updateFilters(LeadFilters.builder().conversationStatus(ConversationStatusFilter.NONE).build());

        assertEquals(List.of("A"), lastIds());
        assertEquals(1, store.sessionListings());

        mergeSession.updateFilters(LeadFilters.builder()
                .qualificationScore(QualificationScore.HOT)
                .build());

        assertEquals(2, store.sessionListings());
        assertTrue(lastIds().isEmpty());
    }

    @Test
    void escalationIsProjectedBeforeTheStoreAnswers() {
        store.withSession(session("S1", P1, T0));
        open(Runnable::run);
        when(escalationService.escalationPatch("pricing")).thenReturn(SessionPatch.escalate(T0, "pricing"));
        List<ControlMode> shownDuringCall = new ArrayList<>();
        when(escalationService.escalate("S1", "pricing")).thenAnswer(invocation -> {
            shownDuringCall.add(view("A").getSession().getControlMode());
            return store.updateSession("S1", SessionPatch.escalate(T0, "pricing")).orElseThrow();
        });

        assertTrue(mergeSession.escalate("S1", "pricing"));

        assertEquals(List.of(ControlMode.HUMAN), shownDuringCall);
        assertEquals(ControlMode.HUMAN, view("A").getSession().getControlMode());
    }

    @Test
    void rejectedTransitionIsReconciledByTheNextMerge() {
        store.withSession(session("S1", P1, T0));
        open(Runnable::run);
        when(escalationService.escalationPatch(null)).thenReturn(SessionPatch.escalate(T0, "default"));
        when(escalationService.escalate("S1", null)).thenThrow(ServiceException.notFound("gone"));

        assertFalse(mergeSession.escalate("S1", null));

        assertEquals(ControlMode.AGENT, view("A").getSession().getControlMode());
        assertEquals(ErrorCode.NOT_FOUND, listener.lastError().getErrorCode());
        assertTrue(listener.snapshots.stream()
                .flatMap(snapshot -> snapshot.getLeads().stream())
                .anyMatch(view -> view.hasSession() && view.getSession().getControlMode() == ControlMode.HUMAN));
    }

    @Test
    void deleteRemovesOptimisticallyAndBlockedLeadComesBack() {
        store.withSession(session("S1", P1, T0));
        store.setBlockLeadDeletes(true);
        open(Runnable::run);
        int before = listener.snapshots.size();

        DeletionResult result = mergeSession.deleteLead("A");

        assertTrue(result.isFailed());
        assertEquals(ErrorCode.BLOCKED_DELETION, result.getFailureCode());
        assertFalse(ids(listener.snapshots.get(before)).contains("A"));
        assertTrue(lastIds().contains("A"));
        assertNull(view("A").getSession());
        assertEquals(ErrorCode.BLOCKED_DELETION, listener.lastError().getErrorCode());
    }

    @Test
    void deletedLeadStaysGone() {
        store.withSession(session("S1", P1, T0));
        open(Runnable::run);

        DeletionResult result = mergeSession.deleteLead("A");

        assertTrue(result.isLeadDeleted());
        assertEquals(List.of("virtual-S2"), lastIds());
        assertTrue(store.lead("A").isEmpty());
    }

    @Test
    void differentlyFormattedPhonesStaySeparateInViewAndDelete() {
        store.withLead(lead("F", "+1 555-0100", T0.plusSeconds(40)))
                .withSession(session("S5", "+15550100", T0.plusSeconds(50)));
        open(Runnable::run);

        assertEquals(List.of("virtual-S5", "F", "virtual-S2", "A"), lastIds());
        assertNull(view("F").getSession());

        DeletionResult result = mergeSession.deleteLead("F");

        assertTrue(result.isLeadDeleted());
        assertEquals(List.of("virtual-S5", "virtual-S2", "A"), lastIds());
        assertTrue(store.session("S5").isPresent());
        assertTrue(store.lead("F").isEmpty());
    }

    @Test
    void selectingAnEscalatedLeadStartsTheCountdownAndReleaseStopsIt() {
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        store.withSession(escalated("S1", P1, T0));
        clock.advance(Duration.ofHours(1));
        open(Runnable::run);

        mergeSession.select("A");

        assertEquals("23h 0m remaining", listener.ticks.get(0).getLabel());
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        when(escalationService.release("S1"))
                .thenAnswer(invocation -> store.updateSession("S1", SessionPatch.release()).orElseThrow());
        assertTrue(mergeSession.release("S1"));

        verify(future, times(1)).cancel(false);
        assertEquals(ControlMode.AGENT, view("A").getSession().getControlMode());
    }

    @Test
    void changingTheSelectionStopsTheCountdown() {
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        store.withSession(escalated("S1", P1, T0));
        open(Runnable::run);
        mergeSession.select("A");

        mergeSession.select("virtual-S2");

        verify(future).cancel(false);
    }

    @Test
    void closingStopsTheCountdown() {
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        store.withSession(escalated("S1", P1, T0));
        open(Runnable::run);
        mergeSession.select("A");

        mergeSession.close();

        verify(future).cancel(false);
    }

    @Test
    void expiredCountdownRequestsAutoRelease() {
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        store.withSession(escalated("S1", P1, T0));
        clock.advance(Duration.ofHours(25));
        open(Runnable::run);

        mergeSession.select("A");

        assertTrue(listener.ticks.get(0).isExpired());
        assertEquals("Auto-releasing...", listener.ticks.get(0).getLabel());
        verify(escalationService).autoReleaseIfExpired("S1");
    }

    @Test
    void disabledWindowNeverStartsTheCountdown() {
        store.withSession(escalated("S1", P1, T0));
        store.setAutoReleaseHours(ORG, 0);
        open(Runnable::run);

        mergeSession.select("A");

        assertTrue(listener.ticks.isEmpty());
        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    private void open(Executor executor) {
        LeadConsoleProperties properties = new LeadConsoleProperties();
        mergeSession = new MergeSession(
                ORG,
                LeadFilters.none(),
                store,
                new LeadViewService(store, mergeEngine),
                mergeEngine,
                escalationService,
                new CascadeDeleteOrchestrator(store, eventPublisher, clock),
                new AutoReleaseSettings(store, properties),
                new CountdownClock(taskScheduler, Duration.ofSeconds(1), clock),
                executor,
                clock,
                listener);
        mergeSession.open();
    }

    private MergedLeadView view(String id) {
        return listener.last().getLeads().stream()
                .filter(view -> view.getId().equals(id))
                .findFirst()
                .orElseThrow();
    }

    private List<String> lastIds() {
        return ids(listener.last());
    }

    private static List<String> ids(LeadViewSnapshot snapshot) {
        return snapshot.getLeads().stream().map(MergedLeadView::getId).collect(Collectors.toList());
    }

    private static final class RecordingListener implements MergeSessionListener {

        private final List<LeadViewSnapshot> snapshots = new ArrayList<>();
        private final List<CountdownTick> ticks = new ArrayList<>();
        private final List<ServiceException> errors = new ArrayList<>();

        @Override
        public void onSnapshot(LeadViewSnapshot snapshot) {
            snapshots.add(snapshot);
        }

        @Override
        public void onCountdown(CountdownTick tick) {
            ticks.add(tick);
        }

        @Override
        public void onError(ServiceException error) {
            errors.add(error);
        }

        LeadViewSnapshot last() {
            return snapshots.get(snapshots.size() - 1);
        }

        ServiceException lastError() {
            return errors.get(errors.size() - 1);
        }
    }
}
