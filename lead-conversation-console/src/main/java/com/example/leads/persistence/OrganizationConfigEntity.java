package com.example.leads.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "organization_configs",
        uniqueConstraints = @UniqueConstraint(name = "uk_organization_configs_org_agent", columnNames = {"organization_id", "agent_type"}))
public class OrganizationConfigEntity {

    public static final String SALES_AGENT = "sales";

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "organization_id", nullable = false, length = 64)
    private String organizationId;

    @Column(name = "agent_type", nullable = false, length = 32)
    private String agentType;

    @Column(name = "hitl_auto_release_hours")
    private Integer hitlAutoReleaseHours;
}
