package com.example.leads.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * One row of the unified lead list: a lead decorated with the freshest conversation session on its
 * phone. Either a {@link RealLeadView} backed by a persisted lead, or a {@link VirtualLeadView}
 * synthesized for a session that has no lead yet. Only real views expose a persisted lead id.
 */
public abstract class MergedLeadView {

    public static final String VIRTUAL_ID_PREFIX = "virtual-";

    private final ConversationSession session;

    MergedLeadView(ConversationSession session) {
        this.session = session;
    }

    public abstract String getId();

    public abstract String getOrganizationId();

    public abstract String getPhone();

    public abstract String getContactName();

    public abstract String getCompanyName();

    public abstract QualificationScore getQualificationScore();

    public abstract LeadStatus getStatus();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();

    @JsonProperty("virtual")
    public abstract boolean isVirtual();

    /**
     * Returns a copy of this view with the session replaced, used for optimistic projections.
     */
    public abstract MergedLeadView withSession(ConversationSession replacement);

    public ConversationSession getSession() {
        return session;
    }

    public boolean hasSession() {
        return session != null;
    }

    /**
     * Latest of the lead's and the session's {@code updatedAt}; either side being fresh moves the
     * row up.
     */
    public Instant lastActivityAt() {
        Instant leadTime = getUpdatedAt();
        Instant sessionTime = session != null ? session.getUpdatedAt() : null;
        if (leadTime == null) {
            return sessionTime;
        }
        if (sessionTime == null) {
            return leadTime;
        }
        return sessionTime.isAfter(leadTime) ? sessionTime : leadTime;
    }

    public static RealLeadView real(Lead lead, ConversationSession session) {
        return new RealLeadView(lead, session);
    }

    public static VirtualLeadView virtual(ConversationSession session) {
        return new VirtualLeadView(session);
    }

    public static boolean isVirtualId(String id) {
        return id != null && id.startsWith(VIRTUAL_ID_PREFIX);
    }
}
