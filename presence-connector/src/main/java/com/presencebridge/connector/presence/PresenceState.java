package com.presencebridge.connector.presence;

import com.presencebridge.common.model.ActivityPayload;
import com.presencebridge.common.model.ProcessDetectedEvent;
import com.presencebridge.connector.payload.ActivityPayloads;

import java.util.Optional;

/**
 * Which process-detected session clients currently display, and its pid.
 *
 * <p>
 * Turns the watcher's repeated "still running" reports into change
 * notifications: a session is announced once, and every way out of a live
 * session (clear or switch) emits an empty payload for it first.
 * {@code activeSession} is set exactly while an announced session has not
 * been closed.
 *
 * <p>
 * Repeats are detected on session id alone; a changed name under the same id
 * is not re-announced.
 */
public class PresenceState {

    private String activeSession;
    private Long lastProcessId;

    /**
     * Apply one event atomically and return what must be broadcast.
     */
    public synchronized PresenceTransition apply(ProcessDetectedEvent event) {
        if (event.isNone()) {
            if (activeSession == null) {
                return PresenceTransition.idle();
            }
            ActivityPayload closing = ActivityPayloads.closing(lastProcessId, activeSession);
            activeSession = null;
            lastProcessId = null;
            return PresenceTransition.cleared(closing);
        }

        if (event.id().equals(activeSession)) {
            return PresenceTransition.repeat();
        }

        ActivityPayload closing = activeSession != null
                ? ActivityPayloads.closing(lastProcessId, activeSession)
                : null;
        ActivityPayload opening = ActivityPayloads.fromProcess(event);
        lastProcessId = event.pid();
        activeSession = event.id();
        return closing != null
                ? PresenceTransition.switched(closing, opening)
                : PresenceTransition.opened(opening);
    }

    public synchronized Optional<String> getActiveSession() {
        return Optional.ofNullable(activeSession);
    }

    public synchronized Optional<Long> getLastProcessId() {
        return Optional.ofNullable(lastProcessId);
    }

    public synchronized boolean isIdle() {
        return activeSession == null;
    }
}
