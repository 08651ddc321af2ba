package com.example.leads.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSession implements Serializable {

    private String id;
    private String organizationId;
    private String teamId;
    private String phone;
    private ControlMode controlMode;
    private String reason;
    private String source;
    private int unreadCount;
    // set iff controlMode == HUMAN
    private Instant escalatedAt;
    private Instant createdAt;
    private Instant updatedAt;
    private LeadSummary lead;

    public ControlMode effectiveControlMode() {
        return controlMode != null ? controlMode : ControlMode.AGENT;
    }
}
