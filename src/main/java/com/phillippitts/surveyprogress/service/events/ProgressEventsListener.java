package com.phillippitts.surveyprogress.service.events;

import com.phillippitts.surveyprogress.exception.UnsupportedCommandException;
import com.phillippitts.surveyprogress.service.progress.event.CommandFailedEvent;
import com.phillippitts.surveyprogress.service.progress.event.SessionStartedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for survey progress events. Throttled to avoid log spam when a caller
 * keeps submitting a failing command.
 */
@Component
class ProgressEventsListener {
    private static final Logger LOG = LogManager.getLogger(ProgressEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSessionStarted(SessionStartedEvent e) {
        if (e.previousSessionId() != null) {
            LOG.info("Survey session {} superseded by {}", e.previousSessionId(), e.sessionId());
        }
    }

    @EventListener
    void onCommandFailed(CommandFailedEvent e) {
        String reason = e.cause() == null ? "unknown" : e.cause().getClass().getSimpleName();
        String key = "command-" + e.command() + '-' + reason;
        if (!shouldLog(key)) {
            return;
        }
        if (e.cause() instanceof UnsupportedCommandException) {
            LOG.warn("Unsupported survey command received: command={}, session={}", e.command(), e.sessionId());
        } else {
            LOG.warn("Survey command failed: command={}, session={}, reason={}",
                    e.command(), e.sessionId(), reason);
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
