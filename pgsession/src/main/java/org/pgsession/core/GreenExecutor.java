/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.log.Log;
import org.pgsession.log.Logger;

import java.sql.SQLException;

/**
 * Runs a statement through the connection's {@link WaitCallback} instead of blocking in
 * {@link WireClient#exec(String)}.
 */
public final class GreenExecutor {
    private static final Log LOGGER = Logger.getLogger(GreenExecutor.class);

    private GreenExecutor() {
    }

    /**
     * Sends {@code query}, lets the callback wait for it and returns its last result. Must be
     * called with the guard held.
     *
     * @return the result, or null if the query could not be sent
     * @throws SQLException if the callback failed; the statement state on the wire is then unknown
     *         and the connection is marked {@link BaseConnection#CLOSED_NEEDS_CLEANUP}
     */
    public static WireResult exec(BaseConnection connection, String query) throws SQLException {
        WireClient wire = connection.getWireClient();
        if (!wire.sendQuery(query)) {
            return null;
        }
        connection.setAsyncStatus(AsyncStatus.WRITE);
        try {
            connection.getWaitCallback().waitFor(connection);
        } catch (SQLException e) {
            LOGGER.warn("wait callback failed, closing the connection: " + e.getMessage());
            connection.setAsyncStatus(AsyncStatus.DONE);
            connection.setClosed(BaseConnection.CLOSED_NEEDS_CLEANUP);
            throw e;
        }
        WireResult result = QueryExecutorImpl.getLastResult(wire);
        connection.setAsyncStatus(AsyncStatus.DONE);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("green execution completed: " + Utils.abbreviate(query));
        }
        return result;
    }
}
