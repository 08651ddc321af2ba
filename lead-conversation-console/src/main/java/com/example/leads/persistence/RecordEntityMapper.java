package com.example.leads.persistence;

import com.example.leads.domain.AgentSession;
import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationSession;
import com.example.leads.domain.Lead;
import com.example.leads.domain.LeadStatus;
import com.example.leads.domain.LeadSummary;
import com.example.leads.domain.QualificationScore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class RecordEntityMapper {

    private static final TypeReference<List<Map<String, Object>>> TURN_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public Lead toLead(LeadEntity entity) {
        if (entity == null) {
            return null;
        }
        return Lead.builder()
                .id(entity.getId())
                .organizationId(entity.getOrganizationId())
                .phone(entity.getPhone())
                .contactName(entity.getContactName())
                .companyName(entity.getCompanyName())
                .useCase(entity.getUseCase())
                .currentStack(entity.getCurrentStack())
                .expectedVolume(entity.getExpectedVolume())
                .timeline(entity.getTimeline())
                .qualificationScore(entity.getQualificationScore() != null ? entity.getQualificationScore() : QualificationScore.NEW)
                .status(entity.getStatus() != null ? entity.getStatus() : LeadStatus.NEW)
                .notes(entity.getNotes())
                .assignedRepId(entity.getAssignedRepId())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public ConversationSession toSession(ConversationSessionEntity entity) {
        if (entity == null) {
            return null;
        }
        return ConversationSession.builder()
                .id(entity.getId())
                .organizationId(entity.getOrganizationId())
                .teamId(entity.getTeamId())
                .phone(entity.getPhone())
                .controlMode(entity.getControlMode() != null ? entity.getControlMode() : ControlMode.AGENT)
                .reason(entity.getReason())
                .source(entity.getSource())
                .unreadCount(entity.getUnreadCount())
                .escalatedAt(entity.getEscalatedAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .lead(readSummary(entity.getLeadSummary()))
                .build();
    }

    /**
     * Copies the hand-off fields of {@code session} onto the entity. Other columns belong to the
     * agent and are never written from here.
     */
    public void copyHandOffState(ConversationSession session, ConversationSessionEntity entity) {
        entity.setControlMode(session.getControlMode());
        entity.setEscalatedAt(session.getEscalatedAt());
        entity.setReason(session.getReason());
    }

    public AgentSession toAgentSession(AgentSessionEntity entity) {
        if (entity == null) {
            return null;
        }
        return AgentSession.builder()
                .id(entity.getId())
                .contactPhone(entity.getContactPhone())
                .messages(readTurns(entity.getId(), entity.getMessages()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private LeadSummary readSummary(String json) {
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, LeadSummary.class);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unreadable lead summary on session: {}", e.getOriginalMessage());
            return null;
        }
    }

    private List<Map<String, Object>> readTurns(String agentSessionId, String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyList();
        }
        try {
            List<Map<String, Object>> turns = objectMapper.readValue(json, TURN_LIST_TYPE);
            return turns != null ? turns : Collections.emptyList();
        } catch (JsonProcessingException e) {
            log.warn("Agent session {} has an unreadable transcript: {}", agentSessionId, e.getOriginalMessage());
            return Collections.emptyList();
        }
    }
}
