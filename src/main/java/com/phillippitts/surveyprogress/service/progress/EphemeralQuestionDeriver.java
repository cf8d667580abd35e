package com.phillippitts.surveyprogress.service.progress;

import com.phillippitts.surveyprogress.domain.EphemeralSurveyQuestion;
import com.phillippitts.surveyprogress.domain.SurveyQuestion;

import java.util.List;

/**
 * Pure derivation of the question currently shown from a session's question list.
 *
 * <p>Always surfaces the first question: sessions do not track a position yet, so
 * advancing through the list is left to the reserved navigation commands.
 */
final class EphemeralQuestionDeriver {

    private EphemeralQuestionDeriver() {}

    /**
     * Derives the ephemeral question for {@code state}.
     *
     * @throws IllegalStateException if the list is not initialized or is empty
     */
    static EphemeralSurveyQuestion deriveEphemeralQuestion(SessionState state) {
        return deriveEphemeralQuestion(state.questionsList());
    }

    static EphemeralSurveyQuestion deriveEphemeralQuestion(List<SurveyQuestion> questionsList) {
        if (questionsList.isEmpty()) {
            throw new IllegalStateException("Cannot derive a question from an empty questions list");
        }
        return new EphemeralSurveyQuestion(questionsList.get(0));
    }
}
