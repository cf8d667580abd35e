package com.phillippitts.surveyprogress.exception;

/**
 * Base exception for all survey progress errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SurveyProgressException extends RuntimeException {

    public SurveyProgressException(String message) {
        super(message);
    }

    public SurveyProgressException(String message, Throwable cause) {
        super(message, cause);
    }

    public SurveyProgressException(Throwable cause) {
        super(cause);
    }
}
