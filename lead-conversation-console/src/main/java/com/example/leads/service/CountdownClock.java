package com.example.leads.service;

import com.example.leads.domain.ConversationSession;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

@Slf4j
public class CountdownClock {

    private final TaskScheduler taskScheduler;
    private final Duration interval;
    private final Clock clock;

    private ScheduledFuture<?> future;
    private String sessionId;
    private Instant escalatedAt;
    private int autoReleaseHours;

    public CountdownClock(TaskScheduler taskScheduler, Duration interval, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.interval = interval;
        this.clock = clock;
    }

    public synchronized boolean track(ConversationSession session, int hours, Consumer<CountdownTick> onTick) {
        if (AutoReleaseTimer.timeRemaining(session, hours, clock.instant()) == null) {
            stop();
            return false;
        }
        if (isRunning()
                && session.getId().equals(sessionId)
                && Objects.equals(session.getEscalatedAt(), escalatedAt)
                && hours == autoReleaseHours) {
            return true;
        }
        stop();
        ConversationSession tracked = session;
        this.sessionId = session.getId();
        this.escalatedAt = session.getEscalatedAt();
        this.autoReleaseHours = hours;
        Runnable tick = () -> onTick.accept(
                CountdownTick.of(tracked.getId(), AutoReleaseTimer.timeRemaining(tracked, hours, clock.instant())));
        // first scheduled run one interval out; the immediate tick goes out once the state is in place
        this.future = taskScheduler.scheduleAtFixedRate(tick, clock.instant().plus(interval), interval);
        log.debug("Started countdown for session {} ({}h window)", sessionId, hours);
        tick.run();
        return true;
    }

    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            log.debug("Stopped countdown for session {}", sessionId);
        }
        future = null;
        sessionId = null;
        escalatedAt = null;
        autoReleaseHours = 0;
    }

    public synchronized boolean isRunning() {
        return future != null && !future.isCancelled();
    }

    public synchronized String trackedSessionId() {
        return sessionId;
    }
}
