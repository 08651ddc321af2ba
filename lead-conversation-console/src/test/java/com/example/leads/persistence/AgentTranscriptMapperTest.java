package com.example.leads.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.leads.domain.AgentSession;
import com.example.leads.domain.ConversationMessage;
import com.example.leads.domain.SenderType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AgentTranscriptMapperTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T09:00:00Z");

    @Test
    void mapsTurnsInOrder() {
        AgentSession session = AgentSession.builder()
                .id("as-1")
                .contactPhone("+15550001")
                .createdAt(CREATED)
                .messages(List.of(
                        Map.of("role", "user", "content", "Hi, I need pricing"),
                        Map.of("role", "assistant", "content", List.of(
                                Map.of("type", "text", "text", "Sure."),
                                Map.of("type", "tool_use", "name", "lookup"),
                                Map.of("type", "text", "text", "Which plan?")))))
                .build();

        List<ConversationMessage> messages = AgentTranscriptMapper.toMessages(session);

        assertEquals(2, messages.size());
        ConversationMessage first = messages.get(0);
        assertEquals("as-1-0", first.getId());
        assertEquals(SenderType.LEAD, first.getSenderType());
        assertEquals("+15550001", first.getFromPhone());
        assertEquals("Hi, I need pricing", first.getContent());
        assertEquals(CREATED, first.getCreatedAt());

        ConversationMessage second = messages.get(1);
        assertEquals("as-1-1", second.getId());
        assertEquals(SenderType.AGENT, second.getSenderType());
        assertNull(second.getFromPhone());
        assertEquals("Sure.\nWhich plan?", second.getContent());
    }

    @Test
    void emptyWhenThereIsNoTranscript() {
        assertTrue(AgentTranscriptMapper.toMessages(null).isEmpty());
        assertTrue(AgentTranscriptMapper.toMessages(AgentSession.builder().id("as-2").build()).isEmpty());
    }

    @Test
    void unknownContentBecomesEmptyText() {
        assertEquals("", AgentTranscriptMapper.extractText(42));
        assertEquals("", AgentTranscriptMapper.extractText(null));
    }
}
