package com.example.leads.persistence;

import com.example.leads.domain.LeadStatus;
import com.example.leads.domain.QualificationScore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "sales_leads",
        uniqueConstraints = @UniqueConstraint(name = "uk_sales_leads_org_phone", columnNames = {"organization_id", "phone"}),
        indexes = @Index(name = "idx_sales_leads_org_created", columnList = "organization_id, created_at"))
public class LeadEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "organization_id", nullable = false, length = 64)
    private String organizationId;

    @Column(name = "phone", nullable = false, length = 32)
    private String phone;

    @Column(name = "contact_name", length = 255)
    private String contactName;

    @Column(name = "company_name", length = 255)
    private String companyName;

    @Column(name = "use_case", columnDefinition = "text")
    private String useCase;

    @Column(name = "current_stack", columnDefinition = "text")
    private String currentStack;

    @Column(name = "expected_volume", length = 255)
    private String expectedVolume;

    @Column(name = "timeline", length = 255)
    private String timeline;

    @Enumerated(EnumType.STRING)
    @Column(name = "qualification_score", nullable = false, length = 16)
    private QualificationScore qualificationScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private LeadStatus status;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "assigned_rep_id", length = 64)
    private String assignedRepId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
