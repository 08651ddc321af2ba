package com.example.leads.store;

import com.example.leads.domain.ControlMode;
import com.example.leads.domain.ConversationSession;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Partial update of a conversation session's hand-off fields. The same patch is applied by the
 * store and, optimistically, to the local merged view.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SessionPatch {

    private final ControlMode controlMode;
    private final Instant escalatedAt;
    private final String reason;
    private final boolean clearEscalation;

    public static SessionPatch escalate(Instant now, String reason) {
        return new SessionPatch(ControlMode.HUMAN, now, reason, false);
    }

    public static SessionPatch release() {
        return new SessionPatch(ControlMode.AGENT, null, null, true);
    }

    public static SessionPatch prolong(Instant now) {
        return new SessionPatch(null, now, null, false);
    }

    /**
     * Returns a patched copy; the argument is left untouched.
     */
    public ConversationSession applyTo(ConversationSession session) {
        ConversationSession.ConversationSessionBuilder builder = session.toBuilder();
        if (controlMode != null) {
            builder.controlMode(controlMode);
        }
        if (clearEscalation) {
            builder.escalatedAt(null).reason(null);
        } else {
            if (escalatedAt != null) {
                builder.escalatedAt(escalatedAt);
            }
            if (reason != null) {
                builder.reason(reason);
            }
        }
        return builder.build();
    }
}
