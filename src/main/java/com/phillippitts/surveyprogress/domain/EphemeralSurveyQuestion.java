package com.phillippitts.surveyprogress.domain;

import java.util.Objects;

/**
 * The question currently shown to the user, derived from the session's question list.
 *
 * @param question the wrapped question (must not be null)
 */
public record EphemeralSurveyQuestion(SurveyQuestion question) {

    public EphemeralSurveyQuestion {
        Objects.requireNonNull(question, "question must not be null");
    }
}
