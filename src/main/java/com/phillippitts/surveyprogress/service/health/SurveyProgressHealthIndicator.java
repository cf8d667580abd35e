package com.phillippitts.surveyprogress.service.health;

import com.phillippitts.surveyprogress.domain.AsyncResult;
import com.phillippitts.surveyprogress.domain.EphemeralSurveyQuestion;
import com.phillippitts.surveyprogress.service.progress.SurveyProgressController;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Health indicator for the survey progress controller.
 *
 * <ul>
 *   <li>UNKNOWN: No session started yet</li>
 *   <li>UP: A session is active; details carry its id and current question state</li>
 * </ul>
 *
 * <p>A failed current question does not make the indicator DOWN: failures are per operation,
 * never terminal for the controller.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SurveyProgressHealthIndicator implements HealthIndicator {

    private final SurveyProgressController controller;

    public SurveyProgressHealthIndicator(SurveyProgressController controller) {
        this.controller = controller;
    }

    @Override
    public Health health() {
        Optional<UUID> sessionId = controller.getActiveSessionId();
        if (sessionId.isEmpty()) {
            return Health.unknown()
                    .withDetail("status", "No survey session started")
                    .build();
        }
        return Health.up()
                .withDetail("session", sessionId.get().toString())
                .withDetail("currentQuestion", describe(controller.currentQuestionSnapshot()))
                .build();
    }

    private static String describe(AsyncResult<EphemeralSurveyQuestion> current) {
        if (current instanceof AsyncResult.Success<EphemeralSurveyQuestion> success) {
            return "ready:" + success.value().question().questionId();
        }
        if (current instanceof AsyncResult.Failure<EphemeralSurveyQuestion> failure) {
            return "failed:" + failure.error().getClass().getSimpleName();
        }
        return "pending";
    }
}
