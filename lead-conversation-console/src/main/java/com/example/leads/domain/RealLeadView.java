package com.example.leads.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Objects;

public final class RealLeadView extends MergedLeadView {

    private final Lead lead;

    RealLeadView(Lead lead, ConversationSession session) {
        super(session);
        this.lead = Objects.requireNonNull(lead, "lead");
    }

    @JsonIgnore
    public Lead getLead() {
        return lead;
    }

    /**
     * Id of the persisted lead row this view targets.
     */
    @JsonIgnore
    public String getLeadId() {
        return lead.getId();
    }

    @Override
    public String getId() {
        return lead.getId();
    }

    @Override
    public String getOrganizationId() {
        return lead.getOrganizationId();
    }

    @Override
    public String getPhone() {
        return lead.getPhone();
    }

    @Override
    public String getContactName() {
        return lead.getContactName();
    }

    @Override
    public String getCompanyName() {
        return lead.getCompanyName();
    }

    @Override
    public QualificationScore getQualificationScore() {
        return lead.getQualificationScore();
    }

    @Override
    public LeadStatus getStatus() {
        return lead.getStatus();
    }

    public String getUseCase() {
        return lead.getUseCase();
    }

    public String getCurrentStack() {
        return lead.getCurrentStack();
    }

    public String getExpectedVolume() {
        return lead.getExpectedVolume();
    }

    public String getTimeline() {
        return lead.getTimeline();
    }

    public String getNotes() {
        return lead.getNotes();
    }

    public String getAssignedRepId() {
        return lead.getAssignedRepId();
    }

    @Override
    public Instant getCreatedAt() {
        return lead.getCreatedAt();
    }

    @Override
    public Instant getUpdatedAt() {
        return lead.getUpdatedAt();
    }

    @Override
    public boolean isVirtual() {
        return false;
    }

    @Override
    public RealLeadView withSession(ConversationSession replacement) {
        return new RealLeadView(lead, replacement);
    }

    @Override
    public String toString() {
        return "RealLeadView{id=" + lead.getId() + ", phone=" + lead.getPhone() + "}";
    }
}
