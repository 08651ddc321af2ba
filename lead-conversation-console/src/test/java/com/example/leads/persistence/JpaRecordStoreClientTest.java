package com.example.leads.persistence;

import static com.example.leads.support.TestRecords.ORG;
import static com.example.leads.support.TestRecords.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationMessage;
import com.example.leads.domain.ConversationSession;
import com.example.leads.domain.Lead;
import com.example.leads.domain.LeadFilters;
import com.example.leads.domain.MergedLeadView;
import com.example.leads.domain.SenderType;
import com.example.leads.service.LeadMergeEngine;
import com.example.leads.service.RedisChangeFeedBroker;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import com.example.leads.store.ChangeEvent;
import com.example.leads.store.ChangeType;
import com.example.leads.store.DeleteCriteria;
import com.example.leads.store.RecordTable;
import com.example.leads.store.SessionPatch;
import com.example.leads.support.MutableClock;
import com.example.leads.support.TestRecords;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaDelete;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class JpaRecordStoreClientTest {

    private static final String FORMATTED_PHONE = "+1 555-0100";

    @Mock
    private LeadJpaRepository leadRepository;

    @Mock
    private ConversationSessionJpaRepository sessionRepository;

    @Mock
    private AgentSessionJpaRepository agentSessionRepository;

    @Mock
    private OrganizationConfigJpaRepository organizationConfigRepository;

    @Mock
    private RedisChangeFeedBroker changeFeedBroker;

    @Mock
    private EntityManager entityManager;

    @Mock
    private CriteriaBuilder cb;

    @Mock
    private CriteriaDelete<ConversationSessionEntity> sessionDelete;

    @Mock
    private Root<ConversationSessionEntity> sessionRoot;

    @Mock
    private CriteriaDelete<AgentSessionEntity> agentSessionDelete;

    @Mock
    private Root<AgentSessionEntity> agentSessionRoot;

    @Mock
    private Path<Object> phonePath;

    @Mock
    private Path<Object> organizationPath;

    @Mock
    private Query query;

    private final MutableClock clock = new MutableClock(T0);
    private JpaRecordStoreClient client;

    @BeforeEach
    void setUp() {
        client = new JpaRecordStoreClient(leadRepository, sessionRepository, agentSessionRepository,
                organizationConfigRepository, new RecordEntityMapper(new ObjectMapper()), changeFeedBroker, clock);
        ReflectionTestUtils.setField(client, "entityManager", entityManager);
    }

    @Test
    void updateSessionPatchesHandOffStateAndBumpsUpdatedAt() {
        ConversationSessionEntity entity = sessionEntity("S1", FORMATTED_PHONE);
        when(sessionRepository.findById("S1")).thenReturn(Optional.of(entity));
        when(sessionRepository.saveAndFlush(entity)).thenReturn(entity);
        clock.advance(Duration.ofMinutes(5));

        ConversationSession updated = client.updateSession("S1", SessionPatch.escalate(T0, "pricing question"))
                .orElseThrow();

        assertEquals(ControlMode.HUMAN, updated.getControlMode());
        assertEquals(T0, updated.getEscalatedAt());
        assertEquals("pricing question", updated.getReason());
        assertEquals(T0.plus(Duration.ofMinutes(5)), updated.getUpdatedAt());
        assertEquals(ControlMode.HUMAN, entity.getControlMode());

        ArgumentCaptor<ChangeEvent> event = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(changeFeedBroker).publishAfterCommit(event.capture());
        assertEquals(RecordTable.CONVERSATION_SESSIONS, event.getValue().getTable());
        assertEquals(ORG, event.getValue().getOrganizationId());
        assertEquals(ChangeType.UPDATE, event.getValue().getType());
        assertEquals("S1", event.getValue().getRecordId());
    }

    @Test
    void updateOfVanishedSessionReturnsEmpty() {
        when(sessionRepository.findById("GONE")).thenReturn(Optional.empty());

        assertTrue(client.updateSession("GONE", SessionPatch.release()).isEmpty());

        verify(sessionRepository, never()).saveAndFlush(any());
        verifyNoInteractions(changeFeedBroker);
    }

    @Test
    void sessionDeleteMatchesTheMergedPhoneExactly() {
        Lead lead = TestRecords.lead("L1", FORMATTED_PHONE, T0);
        ConversationSession session = TestRecords.session("S1", FORMATTED_PHONE, T0);
        List<MergedLeadView> merged = new LeadMergeEngine().merge(List.of(lead), List.of(session), LeadFilters.none());
        assertEquals(1, merged.size());
        MergedLeadView view = merged.get(0);
        assertEquals("S1", view.getSession().getId());
        stubSessionDelete(1);

        int removed = client.deleteWhere(RecordTable.CONVERSATION_SESSIONS,
                DeleteCriteria.where(DeleteCriteria.PHONE, view.getPhone())
                        .and(DeleteCriteria.ORGANIZATION_ID, ORG));

        assertEquals(1, removed);
        verify(cb).equal(phonePath, session.getPhone());
        verify(cb).equal(organizationPath, ORG);

        ArgumentCaptor<ChangeEvent> event = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(changeFeedBroker).publishAfterCommit(event.capture());
        assertEquals(ChangeType.DELETE, event.getValue().getType());
        assertEquals(ORG, event.getValue().getOrganizationId());
        assertNull(event.getValue().getRecordId());
    }

    @Test
    void emptySessionDeleteIsNotBroadcast() {
        stubSessionDelete(0);

        int removed = client.deleteWhere(RecordTable.CONVERSATION_SESSIONS,
                DeleteCriteria.where(DeleteCriteria.PHONE, FORMATTED_PHONE)
                        .and(DeleteCriteria.ORGANIZATION_ID, ORG));

        assertEquals(0, removed);
        verifyNoInteractions(changeFeedBroker);
    }

    @Test
    void agentSessionDeleteHasNoOrganizationFeed() {
        when(entityManager.getCriteriaBuilder()).thenReturn(cb);
        when(cb.createCriteriaDelete(AgentSessionEntity.class)).thenReturn(agentSessionDelete);
        when(agentSessionDelete.from(AgentSessionEntity.class)).thenReturn(agentSessionRoot);
        doReturn(phonePath).when(agentSessionRoot).get("contactPhone");
        when(entityManager.createQuery(agentSessionDelete)).thenReturn(query);
        when(query.executeUpdate()).thenReturn(2);

        int removed = client.deleteWhere(RecordTable.AGENT_SESSIONS,
                DeleteCriteria.where(DeleteCriteria.CONTACT_PHONE, FORMATTED_PHONE));

        assertEquals(2, removed);
        verify(cb).equal(phonePath, FORMATTED_PHONE);
        verifyNoInteractions(changeFeedBroker);
    }

    @Test
    void deleteRejectsColumnsTheTableDoesNotHave() {
        ServiceException ex = assertThrows(ServiceException.class, () -> client.deleteWhere(
                RecordTable.AGENT_SESSIONS, DeleteCriteria.where(DeleteCriteria.ORGANIZATION_ID, ORG)));

        assertEquals(ErrorCode.BAD_REQUEST, ex.getErrorCode());
        verifyNoInteractions(entityManager, changeFeedBroker);
    }

    @Test
    void transcriptIsLoadedByTheExactPhone() {
        AgentSessionEntity agentSession = new AgentSessionEntity();
        agentSession.setId("AS1");
        agentSession.setContactPhone(FORMATTED_PHONE);
        agentSession.setMessages("[{\"role\":\"user\",\"content\":\"hi\"},{\"role\":\"assistant\",\"content\":\"hello\"}]");
        agentSession.setCreatedAt(T0);
        when(agentSessionRepository.findFirstByContactPhoneOrderByUpdatedAtDesc(FORMATTED_PHONE))
                .thenReturn(Optional.of(agentSession));

        List<ConversationMessage> messages = client.getLatestMessagesForPhone(FORMATTED_PHONE);

        assertEquals(2, messages.size());
        assertEquals(SenderType.LEAD, messages.get(0).getSenderType());
        assertEquals(FORMATTED_PHONE, messages.get(0).getFromPhone());
        assertEquals("AS1-1", messages.get(1).getId());
    }

    @Test
    void blankPhoneHasNoTranscript() {
        assertTrue(client.getLatestMessagesForPhone("  ").isEmpty());

        verifyNoInteractions(agentSessionRepository);
    }

    @Test
    void autoReleaseHoursComeFromTheSalesAgentConfig() {
        OrganizationConfigEntity config = new OrganizationConfigEntity();
        config.setOrganizationId(ORG);
        config.setAgentType(OrganizationConfigEntity.SALES_AGENT);
        config.setHitlAutoReleaseHours(0);
        when(organizationConfigRepository.findByOrganizationIdAndAgentType(ORG, OrganizationConfigEntity.SALES_AGENT))
                .thenReturn(Optional.of(config));
        when(organizationConfigRepository.findByOrganizationIdAndAgentType("org-2", OrganizationConfigEntity.SALES_AGENT))
                .thenReturn(Optional.empty());

        assertEquals(Optional.of(0), client.findAutoReleaseHours(ORG));
        assertTrue(client.findAutoReleaseHours("org-2").isEmpty());
    }

    @Test
    void readFailuresAreTransient() {
        when(sessionRepository.findByOrganizationIdOrderByUpdatedAtDesc(ORG))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        ServiceException ex = assertThrows(ServiceException.class, () -> client.listSessions(ORG));

        assertEquals(ErrorCode.TRANSIENT_STORE_ERROR, ex.getErrorCode());
    }

    private void stubSessionDelete(int rows) {
        when(entityManager.getCriteriaBuilder()).thenReturn(cb);
        when(cb.createCriteriaDelete(ConversationSessionEntity.class)).thenReturn(sessionDelete);
        when(sessionDelete.from(ConversationSessionEntity.class)).thenReturn(sessionRoot);
        doReturn(phonePath).when(sessionRoot).get("phone");
        doReturn(organizationPath).when(sessionRoot).get("organizationId");
        when(entityManager.createQuery(sessionDelete)).thenReturn(query);
        when(query.executeUpdate()).thenReturn(rows);
    }

    private static ConversationSessionEntity sessionEntity(String id, String phone) {
        ConversationSessionEntity entity = new ConversationSessionEntity();
        entity.setId(id);
        entity.setOrganizationId(ORG);
        entity.setPhone(phone);
        entity.setControlMode(ControlMode.AGENT);
        entity.setCreatedAt(T0.minus(Duration.ofHours(1)));
        entity.setUpdatedAt(T0.minus(Duration.ofHours(1)));
        return entity;
    }
}
