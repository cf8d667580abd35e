package com.phillippitts.surveyprogress.service.question;

import com.phillippitts.surveyprogress.domain.SurveyQuestion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Objects;

/**
 * {@link QuestionListProvider} backed by an in-memory list that can be replaced at runtime.
 *
 * <p>Late subscribers receive the most recently published list. {@link #publish(List)} is
 * thread-safe; every call re-emits, even if the list is unchanged.
 */
public class InMemoryQuestionListProvider implements QuestionListProvider {

    private static final Logger LOG = LogManager.getLogger(InMemoryQuestionListProvider.class);

    private final Sinks.Many<List<SurveyQuestion>> sink = Sinks.many().replay().latest();

    public InMemoryQuestionListProvider(List<SurveyQuestion> initialQuestions) {
        publish(initialQuestions);
    }

    /**
     * Replaces the current list and pushes it to subscribers.
     *
     * @param questions new list (copied; must not be null)
     */
    public synchronized void publish(List<SurveyQuestion> questions) {
        Objects.requireNonNull(questions, "questions must not be null");
        Sinks.EmitResult result = sink.tryEmitNext(List.copyOf(questions));
        if (result.isFailure()) {
            LOG.warn("Question list not published: result={}, size={}", result, questions.size());
        }
    }

    @Override
    public Flux<List<SurveyQuestion>> questions() {
        return sink.asFlux();
    }
}
