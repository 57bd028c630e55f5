/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.log.Log;
import org.pgsession.log.Logger;

import java.sql.SQLException;

/**
 * Runs a single statement whose only expected outcome is "command completed".
 *
 * <p>Must be called with the {@link ConnectionGuard} held. Never throws: the outcome is returned
 * so that several commands can be chained and reported once, after the guard was released.</p>
 */
public final class CommandRunner {
    private static final Log LOGGER = Logger.getLogger(CommandRunner.class);

    private CommandRunner() {
    }

    /**
     * Runs {@code query}. On success the result is released. A statement producing no result at
     * all poisons the connection with the wire client's error text.
     */
    public static CommandResult run(BaseConnection connection, String query) {
        connection.getGuard().assertHeld();
        WireClient wire = connection.getWireClient();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("running command: " + Utils.abbreviate(query));
        }

        WireResult result;
        if (connection.getWaitCallback() == null) {
            result = wire.exec(query);
        } else {
            try {
                result = GreenExecutor.exec(connection, query);
            } catch (SQLException e) {
                LOGGER.debug("wait callback failed while running " + Utils.abbreviate(query), e);
                return CommandResult.failure(e.getMessage());
            }
        }

        if (result == null) {
            String error = wire.getErrorMessage();
            connection.setCritical(error);
            return CommandResult.failure(error);
        }
        if (result.getStatus() != ExecStatus.COMMAND_OK) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("command failed with status " + result.getStatus());
            }
            return CommandResult.failure(result);
        }
        result.clear();
        return CommandResult.success();
    }
}
