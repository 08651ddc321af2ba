package com.example.leads.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Who is driving a conversation. {@link #AGENT} is the initial mode; {@link #PAUSED} is only ever
 * set out of band.
 */
public enum ControlMode {
    AGENT,
    HUMAN,
    PAUSED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ControlMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported control mode: " + value, ex);
        }
    }
}
