package com.phillippitts.surveyprogress.service.health;

import com.phillippitts.surveyprogress.service.metrics.ProgressMetrics;
import com.phillippitts.surveyprogress.service.progress.SurveyProgressController;
import com.phillippitts.surveyprogress.testutil.EventCapturingPublisher;
import com.phillippitts.surveyprogress.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Flux;

import java.util.List;

import static com.phillippitts.surveyprogress.testutil.TestQuestions.threeQuestions;
import static org.assertj.core.api.Assertions.assertThat;

class SurveyProgressHealthIndicatorTest {

    private SurveyProgressController controller;
    private SurveyProgressHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        controller = new SurveyProgressController(new SyncExecutor(), new EventCapturingPublisher(),
                new ProgressMetrics(new SimpleMeterRegistry()), 64);
        indicator = new SurveyProgressHealthIndicator(controller);
    }

    @Test
    void shouldReportUnknownBeforeAnySession() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(health.getDetails()).containsEntry("status", "No survey session started");
    }

    @Test
    void shouldReportPendingWhileWaitingForQuestions() {
        controller.beginSurveySession(Flux.never());

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("currentQuestion", "pending");
        assertThat(health.getDetails())
                .containsEntry("session", controller.getActiveSessionId().orElseThrow().toString());
    }

    @Test
    void shouldReportCurrentQuestionId() {
        controller.beginSurveySession(Flux.just(threeQuestions()));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("currentQuestion", "ready:q0");
    }

    @Test
    void shouldStayUpWhenQuestionListIsEmpty() {
        controller.beginSurveySession(Flux.just(List.of()));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("currentQuestion", "failed:IllegalStateException");
    }
}
