package com.example.leads.service;

import com.example.leads.domain.MergedLeadView;
import com.example.leads.domain.PhoneNumbers;
import com.example.leads.domain.RealLeadView;
import com.example.leads.event.LeadEventPublisher;
import com.example.leads.event.LeadEventType;
import com.example.leads.event.LeadLifecycleEvent;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import com.example.leads.store.DeleteCriteria;
import com.example.leads.store.RecordStoreClient;
import com.example.leads.store.RecordTable;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CascadeDeleteOrchestrator {

    private final RecordStoreClient recordStore;
    private final LeadEventPublisher eventPublisher;
    private final Clock clock;

    public DeletionResult deleteLead(String organizationId, MergedLeadView view) {
        if (view == null) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Lead to delete is required");
        }
        DeletionResult.DeletionResultBuilder result = DeletionResult.builder().leadId(view.getId());
        String phone = PhoneNumbers.correlationKey(view.getPhone());

        boolean sessionsDeleted = true;
        if (phone != null) {
            sessionsDeleted = bestEffort(result, DeletionResult.SESSION_DELETE_FAILED, view,
                    RecordTable.CONVERSATION_SESSIONS,
                    DeleteCriteria.where(DeleteCriteria.PHONE, phone)
                            .and(DeleteCriteria.ORGANIZATION_ID, organizationId));
            // agent sessions carry no organization, so every organization's history for this phone goes
            bestEffort(result, DeletionResult.AGENT_SESSION_DELETE_FAILED, view,
                    RecordTable.AGENT_SESSIONS,
                    DeleteCriteria.where(DeleteCriteria.CONTACT_PHONE, phone));
        } else {
            log.warn("Lead {} has no phone, skipping session cleanup", view.getId());
        }
        if (view.hasSession()) {
            bestEffort(result, DeletionResult.MESSAGE_DELETE_FAILED, view,
                    RecordTable.CONVERSATION_MESSAGES,
                    DeleteCriteria.where(DeleteCriteria.SESSION_ID, view.getSession().getId()));
        }

        if (!(view instanceof RealLeadView realView)) {
            DeletionResult outcome = result.leadDeleted(sessionsDeleted).build();
            log.info("Removed virtual lead {} of organization {} (sessions deleted: {})",
                    view.getId(), organizationId, sessionsDeleted);
            if (sessionsDeleted) {
                publishDeleted(organizationId, view, outcome);
            }
            return outcome;
        }

        try {
            int removed = recordStore.deleteWhere(RecordTable.LEADS,
                    DeleteCriteria.where(DeleteCriteria.ID, realView.getLeadId())
                            .and(DeleteCriteria.ORGANIZATION_ID, organizationId));
            if (removed == 0) {
                log.warn("Deletion of lead {} of organization {} was blocked, no rows affected",
                        realView.getLeadId(), organizationId);
                return result.leadDeleted(false)
                        .failure(new ServiceException(ErrorCode.BLOCKED_DELETION,
                                "Lead deletion was blocked - no rows affected"))
                        .build();
            }
        } catch (ServiceException ex) {
            log.warn("Failed to delete lead {} of organization {}", realView.getLeadId(), organizationId, ex);
            return result.leadDeleted(false).failure(ex).build();
        } catch (RuntimeException ex) {
            log.warn("Failed to delete lead {} of organization {}", realView.getLeadId(), organizationId, ex);
            return result.leadDeleted(false)
                    .failure(ServiceException.transientStore("Failed to delete lead " + realView.getLeadId(), ex))
                    .build();
        }

        DeletionResult outcome = result.leadDeleted(true).build();
        log.info("Deleted lead {} of organization {} with {} warning(s)",
                realView.getLeadId(), organizationId, outcome.getWarnings().size());
        publishDeleted(organizationId, view, outcome);
        return outcome;
    }

    private boolean bestEffort(DeletionResult.DeletionResultBuilder result, String warning, MergedLeadView view,
                               RecordTable table, DeleteCriteria criteria) {
        try {
            int removed = recordStore.deleteWhere(table, criteria);
            log.debug("Removed {} row(s) from {} for lead {}", removed, table.qualifiedName(), view.getId());
            return true;
        } catch (RuntimeException ex) {
            log.warn("Cascade step on {} failed for lead {}: {}", table.qualifiedName(), view.getId(), warning, ex);
            result.warning(warning);
            return false;
        }
    }

    private void publishDeleted(String organizationId, MergedLeadView view, DeletionResult outcome) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("virtual", view.isVirtual());
        payload.put("warnings", outcome.getWarnings());
        eventPublisher.publish(LeadLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(LeadEventType.LEAD_DELETED)
                .organizationId(organizationId)
                .phone(view.getPhone())
                .subjectId(view.getId())
                .occurredAt(clock.instant())
                .payload(payload)
                .build());
    }
}
