package com.phillippitts.surveyprogress.exception;

/**
 * Raised by the session worker for command variants that are reserved but not wired to behavior yet.
 *
 * <p>Kept distinct from processing faults so callers can tell "not supported yet" from a bug.
 */
public class UnsupportedCommandException extends SurveyProgressException {

    private final String commandName;

    public UnsupportedCommandException(String commandName) {
        super("Command not implemented: " + commandName);
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }
}
