package com.phillippitts.surveyprogress.service.progress.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the session worker fails to apply a command.
 *
 * <p>PII note: Do not include answer values. Restrict to technical diagnostics.
 */
public record CommandFailedEvent(
        UUID sessionId,
        String command,
        Instant at,
        Throwable cause
) {
    public CommandFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
