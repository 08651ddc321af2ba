package com.example.leads.persistence;

import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationMessage;
import com.example.leads.domain.ConversationSession;
import com.example.leads.domain.Lead;
import com.example.leads.domain.LeadFilters;
import com.example.leads.domain.PhoneNumbers;
import com.example.leads.service.RedisChangeFeedBroker;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import com.example.leads.store.ChangeEvent;
import com.example.leads.store.ChangeFeed;
import com.example.leads.store.ChangeListener;
import com.example.leads.store.ChangeType;
import com.example.leads.store.DeleteCriteria;
import com.example.leads.store.RecordStoreClient;
import com.example.leads.store.RecordTable;
import com.example.leads.store.SessionPatch;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaDelete;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaRecordStoreClient implements RecordStoreClient {

    private static final Map<RecordTable, Class<?>> ENTITY_TYPES = new EnumMap<>(Map.of(
            RecordTable.LEADS, LeadEntity.class,
            RecordTable.CONVERSATION_SESSIONS, ConversationSessionEntity.class,
            RecordTable.CONVERSATION_MESSAGES, ConversationMessageEntity.class,
            RecordTable.AGENT_SESSIONS, AgentSessionEntity.class));

    // deletable column -> entity attribute, per table
    private static final Map<RecordTable, Map<String, String>> DELETE_COLUMNS = new EnumMap<>(Map.of(
            RecordTable.LEADS, Map.of(
                    DeleteCriteria.ID, "id",
                    DeleteCriteria.ORGANIZATION_ID, "organizationId",
                    DeleteCriteria.PHONE, "phone"),
            RecordTable.CONVERSATION_SESSIONS, Map.of(
                    DeleteCriteria.ID, "id",
                    DeleteCriteria.ORGANIZATION_ID, "organizationId",
                    DeleteCriteria.PHONE, "phone"),
            RecordTable.CONVERSATION_MESSAGES, Map.of(
                    DeleteCriteria.ID, "id",
                    DeleteCriteria.SESSION_ID, "sessionId"),
            RecordTable.AGENT_SESSIONS, Map.of(
                    DeleteCriteria.ID, "id",
                    DeleteCriteria.CONTACT_PHONE, "contactPhone")));

    private final LeadJpaRepository leadRepository;
    private final ConversationSessionJpaRepository sessionRepository;
    private final AgentSessionJpaRepository agentSessionRepository;
    private final OrganizationConfigJpaRepository organizationConfigRepository;
    private final RecordEntityMapper mapper;
    private final RedisChangeFeedBroker changeFeedBroker;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public List<Lead> listLeads(String organizationId, LeadFilters filters) {
        if (!StringUtils.hasText(organizationId)) {
            return Collections.emptyList();
        }
        LeadFilters resolved = LeadFilters.orNone(filters);
        return read("list leads", () -> leadRepository
                .findForOrganization(organizationId, resolved.getStatus(), resolved.getQualificationScore())
                .stream()
                .map(mapper::toLead)
                .toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationSession> listSessions(String organizationId) {
        if (!StringUtils.hasText(organizationId)) {
            return Collections.emptyList();
        }
        return read("list sessions", () -> sessionRepository
                .findByOrganizationIdOrderByUpdatedAtDesc(organizationId)
                .stream()
                .map(mapper::toSession)
                .toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationSession> getSession(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        return read("get session", () -> sessionRepository.findById(sessionId).map(mapper::toSession));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationSession> listSessionsByControlMode(ControlMode controlMode) {
        return read("list sessions by mode", () -> sessionRepository.findByControlMode(controlMode).stream()
                .map(mapper::toSession)
                .toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationMessage> getLatestMessagesForPhone(String phone) {
        String contactPhone = PhoneNumbers.correlationKey(phone);
        if (contactPhone == null) {
            return Collections.emptyList();
        }
        return read("load transcript", () -> agentSessionRepository
                .findFirstByContactPhoneOrderByUpdatedAtDesc(contactPhone)
                .map(mapper::toAgentSession)
                .map(AgentTranscriptMapper::toMessages)
                .orElse(Collections.emptyList()));
    }

    @Override
    @Transactional
    public Optional<ConversationSession> updateSession(String sessionId, SessionPatch patch) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        Optional<ConversationSessionEntity> existing = read("load session for update", () -> sessionRepository.findById(sessionId));
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        ConversationSessionEntity entity = existing.get();
        ConversationSession patched = patch.applyTo(mapper.toSession(entity));
        mapper.copyHandOffState(patched, entity);
        entity.setUpdatedAt(clock.instant());
        ConversationSessionEntity saved = write("update session", () -> sessionRepository.saveAndFlush(entity));

        changeFeedBroker.publishAfterCommit(change(RecordTable.CONVERSATION_SESSIONS, saved.getOrganizationId(), ChangeType.UPDATE, sessionId));
        return Optional.of(mapper.toSession(saved));
    }

    @Override
    @Transactional
    public int deleteWhere(RecordTable table, DeleteCriteria criteria) {
        Map<String, String> columns = DELETE_COLUMNS.get(table);
        for (String column : criteria.equalities().keySet()) {
            if (!columns.containsKey(column)) {
                throw new ServiceException(ErrorCode.BAD_REQUEST, "Column %s cannot be used to delete from %s".formatted(column, table.qualifiedName()));
            }
        }
        int count = write("delete from " + table.qualifiedName(), () -> executeDelete(ENTITY_TYPES.get(table), columns, criteria));
        log.debug("Deleted {} row(s) from {} where {}", count, table.qualifiedName(), criteria);

        if (count > 0 && table.isOrganizationScoped() && criteria.has(DeleteCriteria.ORGANIZATION_ID)) {
            changeFeedBroker.publishAfterCommit(change(table, criteria.get(DeleteCriteria.ORGANIZATION_ID), ChangeType.DELETE, criteria.get(DeleteCriteria.ID)));
        }
        return count;
    }

    @Override
    public ChangeFeed subscribe(RecordTable table, String organizationId, ChangeListener listener) {
        if (!table.isOrganizationScoped()) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, table.qualifiedName() + " has no organization scoped change feed");
        }
        try {
            return changeFeedBroker.subscribe(table, organizationId, listener);
        } catch (RuntimeException ex) {
            throw new ServiceException(ErrorCode.SUBSCRIPTION_LOST, "Unable to subscribe to " + table.qualifiedName(), ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Integer> findAutoReleaseHours(String organizationId) {
        return read("load organization config", () -> organizationConfigRepository
                .findByOrganizationIdAndAgentType(organizationId, OrganizationConfigEntity.SALES_AGENT)
                .map(OrganizationConfigEntity::getHitlAutoReleaseHours));
    }

    private <T> int executeDelete(Class<T> entityType, Map<String, String> columns, DeleteCriteria criteria) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaDelete<T> delete = cb.createCriteriaDelete(entityType);
        Root<T> root = delete.from(entityType);
        List<Predicate> predicates = new ArrayList<>();
        criteria.equalities().forEach((column, value) -> predicates.add(cb.equal(root.get(columns.get(column)), value)));
        delete.where(predicates.toArray(new Predicate[0]));
        return entityManager.createQuery(delete).executeUpdate();
    }

    private ChangeEvent change(RecordTable table, String organizationId, ChangeType type, String recordId) {
        return ChangeEvent.builder()
                .table(table)
                .organizationId(organizationId)
                .type(type)
                .recordId(recordId)
                .occurredAt(Instant.now(clock))
                .build();
    }

    private <T> T read(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException | PersistenceException ex) {
            throw ServiceException.transientStore("Record store unavailable (" + operation + ")", ex);
        }
    }

    private <T> T write(String operation, Supplier<T> statement) {
        try {
            return statement.get();
        } catch (DataAccessException | PersistenceException ex) {
            throw ServiceException.transientStore("Record store rejected " + operation, ex);
        }
    }
}
