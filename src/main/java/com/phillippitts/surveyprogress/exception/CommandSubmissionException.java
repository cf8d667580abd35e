package com.phillippitts.surveyprogress.exception;

/**
 * Reported when a command could not be enqueued for the active session
 * (queue closed or the worker pool rejected the drain task).
 */
public class CommandSubmissionException extends SurveyProgressException {

    private final String commandName;

    public CommandSubmissionException(String commandName) {
        super("Failed to schedule command " + commandName);
        this.commandName = commandName;
    }

    public CommandSubmissionException(String commandName, Throwable cause) {
        super("Failed to schedule command " + commandName, cause);
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }
}
