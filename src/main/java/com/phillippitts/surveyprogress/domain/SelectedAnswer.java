package com.phillippitts.surveyprogress.domain;

import java.util.Objects;

/**
 * Answer chosen by the user for a single question.
 *
 * @param questionId id of the answered {@link SurveyQuestion}
 * @param answer     the selected answer value
 */
public record SelectedAnswer(String questionId, String answer) {

    public SelectedAnswer {
        Objects.requireNonNull(questionId, "questionId must not be null");
        Objects.requireNonNull(answer, "answer must not be null");
    }
}
