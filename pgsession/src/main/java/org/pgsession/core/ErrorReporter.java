/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.log.Log;
import org.pgsession.log.Logger;
import org.pgsession.util.ErrorClassifier;
import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

/**
 * Builds the exceptions raised by the engine entry points. Whenever an error is built while the
 * wire is broken, the connection is marked {@link BaseConnection#CLOSED_NEEDS_CLEANUP}.
 */
public final class ErrorReporter {
    private static final Log LOGGER = Logger.getLogger(ErrorReporter.class);

    private ErrorReporter() {
    }

    /**
     * Classifies the error carried by {@code result}. Without a result the wire client's last
     * error is reported as {@link ErrorKind#OPERATIONAL}. The result is not released.
     */
    public static PSQLException fromResult(BaseConnection connection, WireResult result) {
        WireClient wire = connection.getWireClient();
        if (result == null) {
            return operational(connection, wire.getErrorMessage());
        }
        markBrokenIfBad(connection);

        String message = result.getErrorMessage();
        String code = connection.getProtocolVersion() >= 3 ? result.getSQLState() : null;
        if (message == null || message.isEmpty()) {
            message = wire.getErrorMessage();
        }
        if (message == null || message.isEmpty()) {
            return new PSQLException(GT.tr("The backend reported an error without a message."),
                    ErrorKind.OPERATIONAL, PSQLState.UNEXPECTED_ERROR);
        }
        PSQLException error = ErrorClassifier.toException(message, code, connection.isExtendedErrors());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("backend error " + code + " classified as " + error.getKind());
        }
        return error;
    }

    /**
     * Reports a failed {@link CommandResult}, releasing the result it carries. Without a result
     * the pending critical condition wins over the recorded error text.
     */
    public static PSQLException fromCommand(BaseConnection connection, CommandResult outcome) {
        WireResult result = outcome.getResult();
        if (result != null) {
            PSQLException error = fromResult(connection, result);
            result.clear();
            return error;
        }
        PSQLException critical = connection.resolveCritical(false);
        if (critical != null) {
            markBrokenIfBad(connection);
            return critical;
        }
        return operational(connection, outcome.getErrorMessage());
    }

    /**
     * An error of the wire layer that no backend result describes.
     */
    public static PSQLException operational(BaseConnection connection, String message) {
        markBrokenIfBad(connection);
        if (message == null || message.isEmpty()) {
            return new PSQLException(GT.tr("unknown error"), ErrorKind.OPERATIONAL, PSQLState.UNEXPECTED_ERROR);
        }
        return new PSQLException(ErrorClassifier.stripSeverity(message), ErrorKind.OPERATIONAL, message, null);
    }

    private static void markBrokenIfBad(BaseConnection connection) {
        if (connection.getWireClient().getStatus() == WireStatus.CONNECTION_BAD
                && connection.getClosed() == BaseConnection.OPEN) {
            LOGGER.debug("wire connection is bad, marking the connection closed");
            connection.setClosed(BaseConnection.CLOSED_NEEDS_CLEANUP);
        }
    }
}
