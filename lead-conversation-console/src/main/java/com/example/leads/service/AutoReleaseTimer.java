package com.example.leads.service;

import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationSession;
import java.time.Duration;
import java.time.Instant;

public final class AutoReleaseTimer {

    public static final String EXPIRED_LABEL = "Auto-releasing...";

    private AutoReleaseTimer() {}

    public static Duration timeRemaining(ConversationSession session, int autoReleaseHours, Instant now) {
        if (session == null
                || session.getControlMode() != ControlMode.HUMAN
                || session.getEscalatedAt() == null
                || autoReleaseHours <= 0) {
            return null;
        }
        Instant releaseAt = session.getEscalatedAt().plus(Duration.ofHours(autoReleaseHours));
        return Duration.between(now, releaseAt);
    }

    public static boolean isExpired(Duration remaining) {
        return remaining != null && (remaining.isZero() || remaining.isNegative());
    }

    public static boolean isExpired(ConversationSession session, int autoReleaseHours, Instant now) {
        return isExpired(timeRemaining(session, autoReleaseHours, now));
    }

    public static String describe(Duration remaining) {
        if (remaining == null) {
            return "";
        }
        if (isExpired(remaining)) {
            return EXPIRED_LABEL;
        }
        long seconds = remaining.getSeconds();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return "%dh %dm remaining".formatted(hours, minutes);
        }
        if (minutes > 0) {
            return "%dm %ds remaining".formatted(minutes, secs);
        }
        return "%ds remaining".formatted(secs);
    }
}
