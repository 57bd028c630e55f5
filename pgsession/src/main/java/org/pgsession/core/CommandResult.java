/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * Outcome of {@link CommandRunner#run(BaseConnection, String)}. A failed outcome carries either
 * the backend result describing the error, or the wire client's error text when no result was
 * produced.
 */
public final class CommandResult {
    private static final CommandResult SUCCESS = new CommandResult(true, null, null);

    private final boolean ok;
    private final WireResult result;
    private final String errorMessage;

    private CommandResult(boolean ok, WireResult result, String errorMessage) {
        this.ok = ok;
        this.result = result;
        this.errorMessage = errorMessage;
    }

    public static CommandResult success() {
        return SUCCESS;
    }

    public static CommandResult failure(WireResult result) {
        return new CommandResult(false, result, null);
    }

    public static CommandResult failure(String errorMessage) {
        return new CommandResult(false, null, errorMessage);
    }

    public boolean isOk() {
        return ok;
    }

    public WireResult getResult() {
        return result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
