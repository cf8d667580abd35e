package com.phillippitts.surveyprogress.config.progress;

import com.phillippitts.surveyprogress.domain.AsyncResult;
import com.phillippitts.surveyprogress.domain.EphemeralSurveyQuestion;
import com.phillippitts.surveyprogress.service.progress.SurveyProgressController;
import com.phillippitts.surveyprogress.service.question.QuestionListProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import reactor.core.Disposable;

import java.util.Objects;

/**
 * Begins a survey session from the configured question source once the application has started,
 * and logs every change of the current question.
 */
public class SurveyAutoStarter implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(SurveyAutoStarter.class);

    private final SurveyProgressController controller;
    private final QuestionListProvider questionListProvider;
    private Disposable currentQuestionSubscription;

    public SurveyAutoStarter(SurveyProgressController controller, QuestionListProvider questionListProvider) {
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
        this.questionListProvider = Objects.requireNonNull(questionListProvider,
                "questionListProvider must not be null");
    }

    @Override
    public void run(ApplicationArguments args) {
        controller.beginSurveySession(questionListProvider.questions())
                .filter(AsyncResult::isFailure)
                .take(1)
                .subscribe(result -> LOG.warn("Survey session failed to start: {}",
                        ((AsyncResult.Failure<Void>) result).error().toString()));

        currentQuestionSubscription = controller.getCurrentQuestion()
                .distinctUntilChanged()
                .subscribe(SurveyAutoStarter::logCurrentQuestion);
    }

    boolean isObservingCurrentQuestion() {
        return currentQuestionSubscription != null && !currentQuestionSubscription.isDisposed();
    }

    private static void logCurrentQuestion(AsyncResult<EphemeralSurveyQuestion> current) {
        if (current instanceof AsyncResult.Success<EphemeralSurveyQuestion> success) {
            LOG.info("Current survey question: id={}, name={}",
                    success.value().question().questionId(), success.value().question().questionName());
        } else if (current instanceof AsyncResult.Failure<EphemeralSurveyQuestion> failure) {
            LOG.warn("Current survey question unavailable: {}", failure.error().getMessage());
        } else {
            LOG.debug("Current survey question pending");
        }
    }
}
