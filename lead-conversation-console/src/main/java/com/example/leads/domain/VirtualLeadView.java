package com.example.leads.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Objects;

/**
 * View-only lead for a session whose phone has no lead. Never persisted and never the target of a
 * lead delete; its id is derived from the session id so it is stable across merge passes.
 */
public final class VirtualLeadView extends MergedLeadView {

    VirtualLeadView(ConversationSession session) {
        super(Objects.requireNonNull(session, "session"));
    }

    @JsonIgnore
    public String getSourceSessionId() {
        return getSession().getId();
    }

    @Override
    public String getId() {
        return VIRTUAL_ID_PREFIX + getSession().getId();
    }

    @Override
    public String getOrganizationId() {
        return getSession().getOrganizationId();
    }

    @Override
    public String getPhone() {
        return getSession().getPhone();
    }

    @Override
    public String getContactName() {
        LeadSummary summary = getSession().getLead();
        return summary != null ? summary.getContactName() : null;
    }

    @Override
    public String getCompanyName() {
        LeadSummary summary = getSession().getLead();
        return summary != null ? summary.getCompanyName() : null;
    }

    @Override
    public QualificationScore getQualificationScore() {
        return QualificationScore.NEW;
    }

    @Override
    public LeadStatus getStatus() {
        return LeadStatus.NEW;
    }

    @Override
    public Instant getCreatedAt() {
        return getSession().getCreatedAt();
    }

    @Override
    public Instant getUpdatedAt() {
        return getSession().getUpdatedAt();
    }

    @Override
    public boolean isVirtual() {
        return true;
    }

    @Override
    public VirtualLeadView withSession(ConversationSession replacement) {
        return new VirtualLeadView(replacement);
    }

    @Override
    public String toString() {
        return "VirtualLeadView{id=" + getId() + ", phone=" + getPhone() + "}";
    }
}
