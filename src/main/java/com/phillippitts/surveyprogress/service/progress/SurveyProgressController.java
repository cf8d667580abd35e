package com.phillippitts.surveyprogress.service.progress;

import com.phillippitts.surveyprogress.domain.AsyncResult;
import com.phillippitts.surveyprogress.domain.EphemeralSurveyQuestion;
import com.phillippitts.surveyprogress.domain.SelectedAnswer;
import com.phillippitts.surveyprogress.domain.SurveyQuestion;
import com.phillippitts.surveyprogress.exception.CommandSubmissionException;
import com.phillippitts.surveyprogress.exception.SessionNotInitializedException;
import com.phillippitts.surveyprogress.exception.UnsupportedCommandException;
import com.phillippitts.surveyprogress.service.metrics.ProgressMetrics;
import com.phillippitts.surveyprogress.service.progress.ControllerCommand.InitializeController;
import com.phillippitts.surveyprogress.service.progress.ControllerCommand.ReceiveQuestionList;
import com.phillippitts.surveyprogress.service.progress.ControllerCommand.RecomputeQuestionAndNotify;
import com.phillippitts.surveyprogress.service.progress.event.CommandFailedEvent;
import com.phillippitts.surveyprogress.service.progress.event.SessionStartedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;

/**
 * Controller for tracking the non-persisted progress of a survey.
 *
 * <p>Each call to {@link #beginSurveySession(Flux)} mints a new session id together with a fresh
 * {@link CommandQueue} and a fresh ephemeral-question {@link ResultCell}, and swaps all three in
 * atomically. Every change to session state goes through the queue, whose single worker applies
 * commands in the order they were accepted; callers on any thread only enqueue.
 *
 * <p><b>Session replacement:</b> the previous queue is closed but not stopped. Whatever it still
 * holds drains into the previous session's cell, which new subscribers no longer see. Commands
 * tagged with a superseded session id are dropped by the worker.
 *
 * <p><b>Error Handling:</b> no operation throws across this class's boundary. Submission faults
 * are returned immediately as {@link AsyncResult.Failure}; faults raised while applying a command
 * are caught per command, logged, published as {@link CommandFailedEvent} and written to that
 * command's result cell. The worker keeps processing subsequent commands.
 *
 * @since 0.1
 */
public class SurveyProgressController {

    private static final Logger LOG = LogManager.getLogger(SurveyProgressController.class);
    private static final String SESSION_ID_KEY = "sessionId";

    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final ProgressMetrics metrics;
    private final int drainBatchSize;

    private final Object sessionLock = new Object();
    private final ResultCell<EphemeralSurveyQuestion> uninitializedQuestionCell =
            new ResultCell<>(AsyncResult.failure(new SessionNotInitializedException()));
    private final MonitoredQuestionList monitoredQuestionList =
            new MonitoredQuestionList(Flux.just(List.of()));

    private volatile ActiveSession activeSession;

    /**
     * Constructs a SurveyProgressController.
     *
     * @param executor       pool lending threads to session workers
     * @param publisher      receives session and failure events
     * @param metrics        command and session counters
     * @param drainBatchSize maximum commands a worker applies before yielding its thread
     * @throws NullPointerException if any reference parameter is null
     */
    public SurveyProgressController(Executor executor,
                                    ApplicationEventPublisher publisher,
                                    ProgressMetrics metrics,
                                    int drainBatchSize) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        if (drainBatchSize < 1) {
            throw new IllegalArgumentException("drainBatchSize must be >= 1, got: " + drainBatchSize);
        }
        this.drainBatchSize = drainBatchSize;
    }

    /**
     * Begins a survey session based on a source of question lists.
     *
     * <p>Every list {@code questionsSource} emits is forwarded to the new session as a
     * {@link ReceiveQuestionList} command. The previous source, if any, is cancelled.
     *
     * @param questionsSource push-based provider of the ordered question list
     * @return latest-value view resolving to {@code Success(null)} once the session is initialized,
     *         or {@code Failure} if initialization could not be scheduled or failed
     */
    public Flux<AsyncResult<Void>> beginSurveySession(Flux<List<SurveyQuestion>> questionsSource) {
        Objects.requireNonNull(questionsSource, "questionsSource must not be null");

        UUID sessionId = UUID.randomUUID();
        ResultCell<EphemeralSurveyQuestion> ephemeralQuestionCell = new ResultCell<>();
        ResultCell<Void> beginSessionResult = new ResultCell<>();
        UUID previousSessionId;

        synchronized (sessionLock) {
            ActiveSession previous = activeSession;
            previousSessionId = previous == null ? null : previous.sessionId();

            SessionWorker worker = new SessionWorker(sessionId);
            CommandQueue commandQueue = new CommandQueue(executor, worker::process,
                    this::abandon, drainBatchSize);

            // Initialize is queued before the session is published so that it is always the first
            // command the new worker sees.
            InitializeController initialize =
                    new InitializeController(ephemeralQuestionCell, sessionId, beginSessionResult);
            if (!commandQueue.offer(initialize)) {
                metrics.incrementRejected(initialize.commandName());
                LOG.warn("Failed to schedule {} (session={})", initialize.commandName(), sessionId);
                beginSessionResult.set(AsyncResult.failure(new CommandSubmissionException(
                        initialize.commandName())));
            }

            activeSession = new ActiveSession(sessionId, ephemeralQuestionCell, commandQueue);
            if (previous != null) {
                previous.commandQueue().close();
            }
            monitoredQuestionList.rebind(questionsSource, questions -> forwardQuestionList(sessionId, questions));
        }

        metrics.incrementSessionsStarted();
        LOG.info("Survey session started (session={}, previous={})", sessionId, previousSessionId);
        try {
            publisher.publishEvent(new SessionStartedEvent(sessionId, previousSessionId, Instant.now()));
        } catch (RuntimeException e) {
            LOG.warn("SessionStartedEvent listener failed: {}", e.toString());
        }
        return beginSessionResult.asFlux();
    }

    /**
     * Returns the question currently shown in the active session.
     *
     * <p>The result combines the monitored question list with the session's ephemeral question, so
     * a change to either republishes. Subscribers bind to the session active at call time; call again
     * after starting a new session. Before any session the view holds
     * {@code Failure(SessionNotInitializedException)}.
     */
    public Flux<AsyncResult<EphemeralSurveyQuestion>> getCurrentQuestion() {
        return monitoredQuestionList.combineWith(ephemeralQuestionCell().asFlux(),
                (questions, currentQuestion) -> currentQuestion);
    }

    /**
     * Returns the latest ephemeral question of the active session without subscribing.
     */
    public AsyncResult<EphemeralSurveyQuestion> currentQuestionSnapshot() {
        return ephemeralQuestionCell().current();
    }

    /**
     * Returns the id of the active session, if one was started.
     */
    public Optional<UUID> getActiveSessionId() {
        ActiveSession session = activeSession;
        return session == null ? Optional.empty() : Optional.of(session.sessionId());
    }

    /**
     * Returns the number of commands accepted for the active session but not yet applied.
     */
    public int pendingCommandCount() {
        ActiveSession session = activeSession;
        return session == null ? 0 : session.commandQueue().pendingCount();
    }

    /**
     * Forces the active session to recompute its current question and notify observers.
     */
    public Flux<AsyncResult<Void>> recomputeCurrentQuestion() {
        return submitForResult(RecomputeQuestionAndNotify::new, "RecomputeQuestionAndNotify");
    }

    /** Submits an answer for the current question. Not supported yet. */
    public Flux<AsyncResult<Void>> submitAnswer(SelectedAnswer selectedAnswer) {
        Objects.requireNonNull(selectedAnswer, "selectedAnswer must not be null");
        return submitForResult((id, cell) -> new ControllerCommand.SubmitAnswer(selectedAnswer, id, cell),
                "SubmitAnswer");
    }

    /** Moves to the next question. Not supported yet. */
    public Flux<AsyncResult<Void>> moveToNextQuestion() {
        return submitForResult(ControllerCommand.MoveToNextQuestion::new, "MoveToNextQuestion");
    }

    /** Moves to the previous question. Not supported yet. */
    public Flux<AsyncResult<Void>> moveToPreviousQuestion() {
        return submitForResult(ControllerCommand.MoveToPreviousQuestion::new, "MoveToPreviousQuestion");
    }

    /** Ends the active session. Not supported yet. */
    public Flux<AsyncResult<Void>> finishSurveySession() {
        return submitForResult(ControllerCommand.FinishSurveySession::new, "FinishSurveySession");
    }

    /** Saves the mandatory part of the survey. Not supported yet. */
    public Flux<AsyncResult<Void>> savePartialCompletion() {
        return submitForResult(ControllerCommand.SavePartialCompletion::new, "SavePartialCompletion");
    }

    /** Saves the completed survey. Not supported yet. */
    public Flux<AsyncResult<Void>> saveFullCompletion() {
        return submitForResult(ControllerCommand.SaveFullCompletion::new, "SaveFullCompletion");
    }

    /**
     * Enqueues a command for the active session without blocking.
     *
     * <p>The command's result cell, if any, is set to {@code Pending} before the enqueue and is
     * resolved later by the worker. If there is no active session, or the enqueue is rejected, the
     * cell is set to {@code Failure} immediately.
     *
     * @param command command to enqueue (must not be null)
     * @return the immediate acknowledgment: {@code Pending} if accepted, otherwise {@code Failure}
     */
    public AsyncResult<Void> submit(ControllerCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        ResultCell<Void> resultCell = command.resultCell();

        AsyncResult<Void> acknowledgment;
        try {
            ActiveSession session = activeSession;
            if (session == null) {
                acknowledgment = AsyncResult.failure(new SessionNotInitializedException());
            } else {
                if (resultCell != null) {
                    // Reset first: the worker may resolve the command before offer() returns.
                    resultCell.set(AsyncResult.pending());
                }
                acknowledgment = session.commandQueue().offer(command)
                        ? AsyncResult.pending()
                        : AsyncResult.failure(new CommandSubmissionException(command.commandName()));
            }
        } catch (RuntimeException e) {
            acknowledgment = AsyncResult.failure(new CommandSubmissionException(command.commandName(), e));
        }

        if (acknowledgment.isFailure()) {
            metrics.incrementRejected(command.commandName());
            LOG.warn("Failed to schedule {} (session={})", command.commandName(), command.sessionId());
            if (resultCell != null) {
                resultCell.set(acknowledgment);
            }
        }
        return acknowledgment;
    }

    private Flux<AsyncResult<Void>> submitForResult(
            BiFunction<UUID, ResultCell<Void>, ControllerCommand> commandFactory, String commandName) {
        ResultCell<Void> resultCell = new ResultCell<>();
        ActiveSession session = activeSession;
        if (session == null) {
            metrics.incrementRejected(commandName);
            LOG.warn("Failed to schedule {}: no active session", commandName);
            resultCell.set(AsyncResult.failure(new SessionNotInitializedException()));
            return resultCell.asFlux();
        }
        submit(commandFactory.apply(session.sessionId(), resultCell));
        return resultCell.asFlux();
    }

    // Package-private for tests
    ResultCell<EphemeralSurveyQuestion> ephemeralQuestionCell() {
        ActiveSession session = activeSession;
        return session == null ? uninitializedQuestionCell : session.ephemeralQuestionCell();
    }

    private void forwardQuestionList(UUID sessionId, List<SurveyQuestion> questions) {
        LOG.debug("Question list received: size={}, session={}", questions.size(), sessionId);
        submit(new ReceiveQuestionList(questions, sessionId));
    }

    private void abandon(ControllerCommand command) {
        metrics.incrementRejected(command.commandName());
        LOG.warn("Queued {} abandoned; worker could not be scheduled (session={})",
                command.commandName(), command.sessionId());
        if (command.resultCell() != null) {
            command.resultCell().set(AsyncResult.failure(new CommandSubmissionException(command.commandName())));
        }
    }

    private UUID activeSessionIdOrNull() {
        ActiveSession session = activeSession;
        return session == null ? null : session.sessionId();
    }

    /**
     * Applies commands to one session's state. Only ever invoked by the session's
     * {@link CommandQueue}, one command at a time.
     */
    private final class SessionWorker {

        private final UUID sessionId;
        private SessionState state;

        SessionWorker(UUID sessionId) {
            this.sessionId = sessionId;
        }

        void process(ControllerCommand command) {
            ThreadContext.put(SESSION_ID_KEY, command.sessionId().toString());
            try {
                if (command instanceof InitializeController initialize) {
                    // Only the session's own first Initialize may create its state.
                    if (state != null || !sessionId.equals(initialize.sessionId())) {
                        dropStale(command);
                        return;
                    }
                    initialize(initialize);
                } else {
                    if (state == null) {
                        throw new SessionNotInitializedException(
                                "Session state not created before " + command.commandName());
                    }
                    if (isStale(command)) {
                        dropStale(command);
                        return;
                    }
                    dispatch(command);
                    if (command.resultCell() != null) {
                        command.resultCell().set(AsyncResult.success(null));
                    }
                }
                metrics.incrementProcessed(command.commandName());
            } catch (RuntimeException e) {
                fail(command, e);
            } finally {
                ThreadContext.remove(SESSION_ID_KEY);
            }
        }

        private void initialize(InitializeController command) {
            state = new SessionState(command.sessionId(), command.ephemeralQuestionCell());
            recomputeCurrentQuestionAndNotify();
            command.resultCell().set(AsyncResult.success(null));
        }

        private void dispatch(ControllerCommand command) {
            if (command instanceof ReceiveQuestionList receive) {
                handleUpdatedQuestionsList(receive.questionsList());
            } else if (command instanceof RecomputeQuestionAndNotify) {
                recomputeCurrentQuestionAndNotify();
            } else {
                throw new UnsupportedCommandException(command.commandName());
            }
        }

        private void dropStale(ControllerCommand command) {
            LOG.debug("Dropping {} for inactive session {} (active={})",
                    command.commandName(), command.sessionId(), activeSessionIdOrNull());
            metrics.incrementStale(command.commandName());
        }

        private boolean isStale(ControllerCommand command) {
            UUID target = command.sessionId();
            return !target.equals(state.sessionId()) || !target.equals(activeSessionIdOrNull());
        }

        private void handleUpdatedQuestionsList(List<SurveyQuestion> questionsList) {
            // Re-emissions of an unchanged list must not trigger another notification.
            if (!state.isQuestionsListInitialized() || !state.questionsList().equals(questionsList)) {
                state.setQuestionsList(questionsList);
                recomputeCurrentQuestionAndNotify();
            } else {
                LOG.debug("Question list unchanged ({} questions); skipping recompute", questionsList.size());
            }
        }

        private void recomputeCurrentQuestionAndNotify() {
            state.ephemeralQuestionCell().set(retrieveCurrentQuestion());
        }

        private AsyncResult<EphemeralSurveyQuestion> retrieveCurrentQuestion() {
            if (!state.isQuestionsListInitialized()) {
                return AsyncResult.pending();
            }
            try {
                return AsyncResult.success(EphemeralQuestionDeriver.deriveEphemeralQuestion(state));
            } catch (IllegalStateException e) {
                LOG.warn("Could not derive current question: {}", e.getMessage());
                return AsyncResult.failure(e);
            }
        }

        private void fail(ControllerCommand command, RuntimeException e) {
            if (e instanceof UnsupportedCommandException) {
                LOG.debug("Rejected unsupported command {} (session={})", command.commandName(), command.sessionId());
            } else {
                LOG.error("Failed to process {} (session={})", command.commandName(), command.sessionId(), e);
            }
            metrics.incrementFailed(command.commandName(), e.getClass().getSimpleName());
            if (command.resultCell() != null) {
                command.resultCell().set(AsyncResult.failure(e));
            }
            try {
                publisher.publishEvent(new CommandFailedEvent(command.sessionId(), command.commandName(),
                        Instant.now(), e));
            } catch (RuntimeException listenerFailure) {
                LOG.warn("CommandFailedEvent listener failed: {}", listenerFailure.toString());
            }
        }
    }

    private record ActiveSession(UUID sessionId,
                                 ResultCell<EphemeralSurveyQuestion> ephemeralQuestionCell,
                                 CommandQueue commandQueue) {
    }
}
