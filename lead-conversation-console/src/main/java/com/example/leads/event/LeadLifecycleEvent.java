package com.example.leads.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadLifecycleEvent implements Serializable {

    private String eventId;
    private LeadEventType type;
    private String organizationId;
    private String phone;
    // session id for hand-off events, lead view id for deletions
    private String subjectId;
    private Instant occurredAt;
    private Map<String, Object> payload;
}
