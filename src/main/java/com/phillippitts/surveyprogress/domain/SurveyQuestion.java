package com.phillippitts.surveyprogress.domain;

import java.util.Objects;

/**
 * Immutable survey question as delivered by a question list provider.
 *
 * <p>Equality is by value so that re-emitted question lists can be compared cheaply.
 *
 * @param questionId   stable identifier of the question (must not be blank)
 * @param questionName short name used for display and logging (must not be null)
 */
public record SurveyQuestion(String questionId, String questionName) {

    public SurveyQuestion {
        Objects.requireNonNull(questionId, "questionId must not be null");
        if (questionId.isBlank()) {
            throw new IllegalArgumentException("questionId must not be blank");
        }
        Objects.requireNonNull(questionName, "questionName must not be null");
    }
}
