package com.example.leads.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent-side transcript for a phone number. Lives outside the organization schema and is keyed by
 * phone only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSession implements Serializable {

    private String id;
    private String contactPhone;
    private List<Map<String, Object>> messages;
    private Instant createdAt;
    private Instant updatedAt;
}
