package com.example.leads.service;

import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CountdownTick {

    private String sessionId;
    private boolean active;
    private Long remainingSeconds;
    private boolean expired;
    private String label;

    public static CountdownTick of(String sessionId, Duration remaining) {
        if (remaining == null) {
            return CountdownTick.builder().sessionId(sessionId).active(false).label("").build();
        }
        boolean expired = AutoReleaseTimer.isExpired(remaining);
        return CountdownTick.builder()
                .sessionId(sessionId)
                .active(true)
                .remainingSeconds(expired ? 0L : remaining.getSeconds())
                .expired(expired)
                .label(AutoReleaseTimer.describe(remaining))
                .build();
    }
}
