package com.presencebridge.connector.presence;

import com.presencebridge.common.model.ActivityPayload;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of feeding one process-detection event to {@link PresenceState}.
 *
 * @param kind    what happened
 * @param closing empty payload for the session that ended, if any
 * @param opening populated payload for the session that started, if any
 */
public record PresenceTransition(Kind kind, ActivityPayload closing, ActivityPayload opening) {

    public enum Kind {
        /** "Nothing detected" while already idle. */
        IDLE,
        /** Same session reported again. */
        REPEAT,
        /** Live session ended. */
        CLEARED,
        /** Session started from idle. */
        OPENED,
        /** One session replaced another without an intervening clear. */
        SWITCHED
    }

    static PresenceTransition idle() {
        return new PresenceTransition(Kind.IDLE, null, null);
    }

    static PresenceTransition repeat() {
        return new PresenceTransition(Kind.REPEAT, null, null);
    }

    static PresenceTransition cleared(ActivityPayload closing) {
        return new PresenceTransition(Kind.CLEARED, closing, null);
    }

    static PresenceTransition opened(ActivityPayload opening) {
        return new PresenceTransition(Kind.OPENED, null, opening);
    }

    static PresenceTransition switched(ActivityPayload closing, ActivityPayload opening) {
        return new PresenceTransition(Kind.SWITCHED, closing, opening);
    }

    /**
     * Payloads to broadcast, closing before opening.
     */
    public List<ActivityPayload> payloads() {
        List<ActivityPayload> out = new ArrayList<>(2);
        if (closing != null)
            out.add(closing);
        if (opening != null)
            out.add(opening);
        return out;
    }

    boolean isSuppressed() {
        return closing == null && opening == null;
    }
}
