package com.example.leads.store;

import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationMessage;
import com.example.leads.domain.ConversationSession;
import com.example.leads.domain.Lead;
import com.example.leads.domain.LeadFilters;
import java.util.List;
import java.util.Optional;

/**
 * Remote record store the engine reconciles against. Implementations throw
 * {@link com.example.leads.service.exception.ServiceException} with
 * {@code TRANSIENT_STORE_ERROR} when the store cannot be reached.
 */
public interface RecordStoreClient {

    /**
     * Leads of an organization, newest first, with {@code status} and {@code qualificationScore}
     * applied by the store. Other filter fields are ignored.
     */
    List<Lead> listLeads(String organizationId, LeadFilters filters);

    /**
     * All sessions of an organization ordered by {@code updatedAt} descending.
     */
    List<ConversationSession> listSessions(String organizationId);

    Optional<ConversationSession> getSession(String sessionId);

    /**
     * Sessions in the given mode across all organizations.
     */
    List<ConversationSession> listSessionsByControlMode(ControlMode controlMode);

    /**
     * Transcript of the most recently updated agent session for a phone, oldest turn first.
     */
    List<ConversationMessage> getLatestMessagesForPhone(String phone);

    /**
     * @return the updated session, or empty when the session no longer exists
     */
    Optional<ConversationSession> updateSession(String sessionId, SessionPatch patch);

    /**
     * @return number of rows removed
     */
    int deleteWhere(RecordTable table, DeleteCriteria criteria);

    ChangeFeed subscribe(RecordTable table, String organizationId, ChangeListener listener);

    /**
     * Raw {@code hitl_auto_release_hours} of the organization's sales agent configuration.
     */
    Optional<Integer> findAutoReleaseHours(String organizationId);
}
