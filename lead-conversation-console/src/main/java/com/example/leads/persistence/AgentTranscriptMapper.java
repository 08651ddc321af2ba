package com.example.leads.persistence;

import com.example.leads.domain.AgentSession;
import com.example.leads.domain.ConversationMessage;
import com.example.leads.domain.SenderType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns the agent's {@code {role, content}} transcript into conversation messages. Content is
 * either a plain string or a list of blocks of which only {@code text} blocks are kept.
 */
public final class AgentTranscriptMapper {

    private AgentTranscriptMapper() {}

    public static List<ConversationMessage> toMessages(AgentSession agentSession) {
        if (agentSession == null || agentSession.getMessages() == null) {
            return List.of();
        }
        List<ConversationMessage> messages = new ArrayList<>(agentSession.getMessages().size());
        int index = 0;
        for (Map<String, Object> turn : agentSession.getMessages()) {
            if (turn == null) {
                index++;
                continue;
            }
            messages.add(ConversationMessage.builder()
                    .id(agentSession.getId() + "-" + index)
                    .sessionId(agentSession.getId())
                    .content(extractText(turn.get("content")))
                    .fromPhone("user".equals(turn.get("role")) ? agentSession.getContactPhone() : null)
                    .senderType("user".equals(turn.get("role")) ? SenderType.LEAD : SenderType.AGENT)
                    // turns carry no timestamp of their own
                    .createdAt(agentSession.getCreatedAt())
                    .build());
            index++;
        }
        return messages;
    }

    static String extractText(Object content) {
        if (content instanceof String text) {
            return text;
        }
        if (content instanceof List<?> blocks) {
            return blocks.stream()
                    .filter(Map.class::isInstance)
                    .map(Map.class::cast)
                    .filter(block -> "text".equals(block.get("type")))
                    .map(block -> Objects.toString(block.get("text"), ""))
                    .collect(Collectors.joining("\n"));
        }
        return "";
    }
}
