package com.phillippitts.surveyprogress.service.question;

import com.phillippitts.surveyprogress.domain.SurveyQuestion;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Push-based source of the ordered question list for a survey session.
 *
 * <p>Implementations re-emit the whole list whenever it changes. Re-emitting an equal list is
 * allowed; the progress controller compares lists by value and ignores unchanged ones.
 */
public interface QuestionListProvider {

    /**
     * Returns a stream of question lists. New subscribers should receive the latest list first.
     */
    Flux<List<SurveyQuestion>> questions();
}
