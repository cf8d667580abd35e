package com.phillippitts.surveyprogress.service.progress.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a new survey session replaces the previous one.
 *
 * @param sessionId         id of the new session
 * @param previousSessionId id of the superseded session, or {@code null} for the first session
 * @param at                when the session was started
 */
public record SessionStartedEvent(UUID sessionId, UUID previousSessionId, Instant at) {
    public SessionStartedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
