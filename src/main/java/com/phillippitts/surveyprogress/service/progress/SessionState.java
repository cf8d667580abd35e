package com.phillippitts.surveyprogress.service.progress;

import com.phillippitts.surveyprogress.domain.EphemeralSurveyQuestion;
import com.phillippitts.surveyprogress.domain.SurveyQuestion;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Mutable state of one survey session.
 *
 * <p>An instance is tied to a single session and is <b>not</b> thread-safe: it is created and
 * mutated only by the worker of the session's {@link CommandQueue}.
 *
 * @since 0.1
 */
final class SessionState {

    private final UUID sessionId;
    private final ResultCell<EphemeralSurveyQuestion> ephemeralQuestionCell;
    private List<SurveyQuestion> questionsList;

    SessionState(UUID sessionId, ResultCell<EphemeralSurveyQuestion> ephemeralQuestionCell) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.ephemeralQuestionCell = Objects.requireNonNull(ephemeralQuestionCell,
                "ephemeralQuestionCell must not be null");
    }

    UUID sessionId() {
        return sessionId;
    }

    ResultCell<EphemeralSurveyQuestion> ephemeralQuestionCell() {
        return ephemeralQuestionCell;
    }

    /**
     * Indicates whether a question list has been received. Callers must check this before
     * reading {@link #questionsList()}.
     */
    boolean isQuestionsListInitialized() {
        return questionsList != null;
    }

    /**
     * Returns the question list.
     *
     * @throws IllegalStateException if no list has been received yet
     */
    List<SurveyQuestion> questionsList() {
        if (questionsList == null) {
            throw new IllegalStateException("Questions list is not initialized for session " + sessionId);
        }
        return questionsList;
    }

    void setQuestionsList(List<SurveyQuestion> questionsList) {
        this.questionsList = List.copyOf(questionsList);
    }
}
