package com.example.leads.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Conversation column filter of the lead list. {@link #NONE} keeps only entries without any session.
 */
public enum ConversationStatusFilter {
    NONE(null),
    AGENT(ControlMode.AGENT),
    HUMAN(ControlMode.HUMAN),
    PAUSED(ControlMode.PAUSED);

    private final ControlMode controlMode;

    ConversationStatusFilter(ControlMode controlMode) {
        this.controlMode = controlMode;
    }

    public boolean matches(ConversationSession session) {
        if (this == NONE) {
            return session == null;
        }
        return session != null && session.effectiveControlMode() == controlMode;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConversationStatusFilter fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported conversation status filter: " + value, ex);
        }
    }
}
