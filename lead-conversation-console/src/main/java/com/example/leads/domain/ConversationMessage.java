package com.example.leads.domain;

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
public class ConversationMessage implements Serializable {

    private String id;
    private String sessionId;
    private String content;
    private String fromPhone;
    private SenderType senderType;
    private Map<String, Object> metadata;
    private Instant createdAt;
}
