package com.example.leads.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "agent_sessions", indexes = @Index(name = "idx_agent_sessions_contact_phone", columnList = "contact_phone, updated_at"))
public class AgentSessionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "contact_phone", length = 32)
    private String contactPhone;

    // JSON array of {role, content} turns written by the agent
    @Column(name = "messages", columnDefinition = "text")
    private String messages;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
