package com.phillippitts.surveyprogress.service.progress;

import com.phillippitts.surveyprogress.domain.EphemeralSurveyQuestion;
import com.phillippitts.surveyprogress.domain.SelectedAnswer;
import com.phillippitts.surveyprogress.domain.SurveyQuestion;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of work submitted to a session's {@link CommandQueue} to read or mutate its
 * {@link SessionState}.
 *
 * <p>Commands are resolved serially by the session worker, although they may be submitted from
 * any thread. Every command names the session it targets; the worker ignores commands whose
 * session is no longer active.
 *
 * @since 0.1
 */
public sealed interface ControllerCommand permits
        ControllerCommand.InitializeController,
        ControllerCommand.ReceiveQuestionList,
        ControllerCommand.RecomputeQuestionAndNotify,
        ControllerCommand.FinishSurveySession,
        ControllerCommand.MoveToNextQuestion,
        ControllerCommand.MoveToPreviousQuestion,
        ControllerCommand.SubmitAnswer,
        ControllerCommand.SavePartialCompletion,
        ControllerCommand.SaveFullCompletion {

    /**
     * Session this command belongs to.
     */
    UUID sessionId();

    /**
     * Cell receiving the outcome of this command, or {@code null} if the caller does not observe it.
     */
    ResultCell<Void> resultCell();

    /**
     * Short name used in logs, metrics and error messages.
     */
    default String commandName() {
        return getClass().getSimpleName();
    }

    /** Creates the session state and publishes the first ephemeral question. */
    record InitializeController(ResultCell<EphemeralSurveyQuestion> ephemeralQuestionCell,
                                UUID sessionId,
                                ResultCell<Void> resultCell) implements ControllerCommand {
        public InitializeController {
            Objects.requireNonNull(ephemeralQuestionCell, "ephemeralQuestionCell must not be null");
            Objects.requireNonNull(sessionId, "sessionId must not be null");
            Objects.requireNonNull(resultCell, "resultCell must not be null");
        }
    }

    /** Delivers a (possibly unchanged) question list from the upstream provider. */
    record ReceiveQuestionList(List<SurveyQuestion> questionsList,
                               UUID sessionId,
                               ResultCell<Void> resultCell) implements ControllerCommand {
        public ReceiveQuestionList {
            questionsList = List.copyOf(questionsList);
            Objects.requireNonNull(sessionId, "sessionId must not be null");
        }

        public ReceiveQuestionList(List<SurveyQuestion> questionsList, UUID sessionId) {
            this(questionsList, sessionId, null);
        }
    }

    /**
     * Recomputes the current question and notifies observers. Used when an external change is
     * only reflected once the question is recomputed.
     */
    record RecomputeQuestionAndNotify(UUID sessionId, ResultCell<Void> resultCell) implements ControllerCommand {
        public RecomputeQuestionAndNotify {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
        }
    }

    /** Ends the current survey session. Reserved. */
    record FinishSurveySession(UUID sessionId, ResultCell<Void> resultCell) implements ControllerCommand {
        public FinishSurveySession {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
        }
    }

    /** Moves to the next question. Reserved. */
    record MoveToNextQuestion(UUID sessionId, ResultCell<Void> resultCell) implements ControllerCommand {
        public MoveToNextQuestion {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
        }
    }

    /** Moves to the previous question. Reserved. */
    record MoveToPreviousQuestion(UUID sessionId, ResultCell<Void> resultCell) implements ControllerCommand {
        public MoveToPreviousQuestion {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
        }
    }

    /** Submits an answer for the current question. Reserved. */
    record SubmitAnswer(SelectedAnswer selectedAnswer,
                        UUID sessionId,
                        ResultCell<Void> resultCell) implements ControllerCommand {
        public SubmitAnswer {
            Objects.requireNonNull(selectedAnswer, "selectedAnswer must not be null");
            Objects.requireNonNull(sessionId, "sessionId must not be null");
        }
    }

    /** The mandatory part of the survey is complete and should be saved. Reserved. */
    record SavePartialCompletion(UUID sessionId, ResultCell<Void> resultCell) implements ControllerCommand {
        public SavePartialCompletion {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
        }
    }

    /** The optional part of the survey is complete and should be saved. Reserved. */
    record SaveFullCompletion(UUID sessionId, ResultCell<Void> resultCell) implements ControllerCommand {
        public SaveFullCompletion {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
        }
    }
}
