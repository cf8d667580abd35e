package com.phillippitts.surveyprogress.config.progress;

import com.phillippitts.surveyprogress.domain.AsyncResult;
import com.phillippitts.surveyprogress.domain.EphemeralSurveyQuestion;
import com.phillippitts.surveyprogress.service.metrics.ProgressMetrics;
import com.phillippitts.surveyprogress.service.progress.SurveyProgressController;
import com.phillippitts.surveyprogress.service.progress.event.SessionStartedEvent;
import com.phillippitts.surveyprogress.service.question.InMemoryQuestionListProvider;
import com.phillippitts.surveyprogress.testutil.EventCapturingPublisher;
import com.phillippitts.surveyprogress.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static com.phillippitts.surveyprogress.testutil.TestQuestions.Q0;
import static com.phillippitts.surveyprogress.testutil.TestQuestions.Q2;
import static com.phillippitts.surveyprogress.testutil.TestQuestions.threeQuestions;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

class SurveyAutoStarterTest {

    private EventCapturingPublisher publisher;
    private SurveyProgressController controller;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        controller = new SurveyProgressController(new SyncExecutor(), publisher,
                new ProgressMetrics(new SimpleMeterRegistry()), 64);
    }

    @Test
    void shouldBeginSessionFromProvider() {
        InMemoryQuestionListProvider provider = new InMemoryQuestionListProvider(threeQuestions());
        SurveyAutoStarter starter = new SurveyAutoStarter(controller, provider);

        starter.run(new DefaultApplicationArguments());

        assertThat(publisher.eventsOfType(SessionStartedEvent.class)).hasSize(1);
        assertThat(starter.isObservingCurrentQuestion()).isTrue();
        assertThat(controller.currentQuestionSnapshot())
                .isEqualTo(AsyncResult.success(new EphemeralSurveyQuestion(Q0)));
    }

    @Test
    void shouldFollowListsPublishedAfterStartup() {
        InMemoryQuestionListProvider provider = new InMemoryQuestionListProvider(threeQuestions());
        new SurveyAutoStarter(controller, provider).run(new DefaultApplicationArguments());

        provider.publish(List.of(Q2));

        assertThat(controller.currentQuestionSnapshot())
                .isEqualTo(AsyncResult.success(new EphemeralSurveyQuestion(Q2)));
    }
}
