package com.phillippitts.surveyprogress.exception;

/**
 * Thrown (or reported as a failed result) when an operation needs a survey session
 * but none has been started, or the session's state has not been created yet.
 */
public class SessionNotInitializedException extends SurveyProgressException {

    public static final String DEFAULT_MESSAGE = "session not initialized";

    public SessionNotInitializedException() {
        super(DEFAULT_MESSAGE);
    }

    public SessionNotInitializedException(String message) {
        super(message);
    }
}
