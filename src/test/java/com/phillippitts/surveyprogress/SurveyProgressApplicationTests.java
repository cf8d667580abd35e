package com.phillippitts.surveyprogress;

import com.phillippitts.surveyprogress.domain.AsyncResult;
import com.phillippitts.surveyprogress.domain.EphemeralSurveyQuestion;
import com.phillippitts.surveyprogress.domain.SurveyQuestion;
import com.phillippitts.surveyprogress.service.health.SurveyProgressHealthIndicator;
import com.phillippitts.surveyprogress.service.progress.SurveyProgressController;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(
    properties = {
        "survey.progress.auto-start=true",
        "survey.progress.drain-batch-size=16"
    }
)
class SurveyProgressApplicationTests {

    @Autowired
    private SurveyProgressController controller;

    @Autowired
    private SurveyProgressHealthIndicator healthIndicator;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void contextLoads() {
        assertThat(controller).isNotNull();
    }

    @Test
    void shouldStartSessionFromCatalogAtStartup() {
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.currentQuestionSnapshot().isSuccess());

        assertThat(controller.currentQuestionSnapshot()).isEqualTo(
                AsyncResult.success(new EphemeralSurveyQuestion(new SurveyQuestion("user-type", "USER_TYPE"))));
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void shouldExposePendingCommandsGauge() {
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.currentQuestionSnapshot().isSuccess());

        assertThat(meterRegistry.get("progress.session.pending").gauge().value())
                .isEqualTo(controller.pendingCommandCount());
    }
}
