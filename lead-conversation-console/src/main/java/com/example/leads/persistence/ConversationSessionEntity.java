package com.example.leads.persistence;

import com.example.leads.domain.ControlMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "conversation_sessions",
        indexes = {
            @Index(name = "idx_conversation_sessions_org_updated", columnList = "organization_id, updated_at"),
            @Index(name = "idx_conversation_sessions_phone", columnList = "phone")
        })
public class ConversationSessionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "organization_id", nullable = false, length = 64)
    private String organizationId;

    @Column(name = "team_id", length = 64)
    private String teamId;

    @Column(name = "phone", length = 32)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(name = "control_mode", nullable = false, length = 16)
    private ControlMode controlMode;

    @Column(name = "reason", length = 512)
    private String reason;

    @Column(name = "source", length = 64)
    private String source;

    @Column(name = "unread_count", nullable = false)
    private int unreadCount;

    @Column(name = "escalated_at")
    private Instant escalatedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "lead_summary", columnDefinition = "text")
    private String leadSummary;

    @Version
    @Column(name = "version")
    private Long version;
}
