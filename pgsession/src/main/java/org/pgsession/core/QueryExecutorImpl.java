/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.log.Log;
import org.pgsession.log.Logger;
import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

import java.sql.SQLException;

/**
 * QueryExecutor implementation driving a {@link WireClient}.
 */
public class QueryExecutorImpl implements QueryExecutor {
    private static final Log LOGGER = Logger.getLogger(QueryExecutorImpl.class);

    private final BaseConnection connection;
    private final ResultFetcher resultFetcher;

    public QueryExecutorImpl(BaseConnection connection, ResultFetcher resultFetcher) {
        this.connection = connection;
        this.resultFetcher = resultFetcher;
    }

    @Override
    public void execute(BaseCursor cursor, String query, boolean async) throws SQLException {
        connection.checkCritical(true);

        WireClient wire = connection.getWireClient();
        if (wire.getStatus() != WireStatus.CONNECTION_OK) {
            throw ErrorReporter.operational(connection, wire.getErrorMessage());
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace((async ? "async" : "sync") + " execute: " + Utils.abbreviate(query));
        }

        ConnectionGuard guard = connection.getGuard();
        AsyncStatus asyncStatus = AsyncStatus.WRITE;
        String wireError = null;
        boolean sent = false;
        CommandResult begin;

        guard.lock();
        try {
            if (connection.getAsyncCursor() != null) {
                throw new PSQLException(GT.tr("asynchronous query already in execution"),
                        ErrorKind.PROGRAMMING, PSQLState.OBJECT_IN_USE);
            }
            begin = connection.getTransactionManager().beginLocked();
            if (begin.isOk()) {
                cursor.clearResult();
                if (!async) {
                    WireResult result = connection.getWaitCallback() == null
                            ? wire.exec(query)
                            : GreenExecutor.exec(connection, query);
                    if (result == null) {
                        wireError = wire.getErrorMessage();
                        connection.setCritical(wireError);
                    } else {
                        cursor.setResult(result);
                        sent = true;
                    }
                } else if (!wire.sendQuery(query)) {
                    wireError = wire.getErrorMessage();
                } else {
                    int ret = wire.flush();
                    if (ret < 0) {
                        wireError = wire.getErrorMessage();
                    } else {
                        if (ret == 0) {
                            asyncStatus = AsyncStatus.READ;
                        }
                        connection.setAsyncStatus(asyncStatus);
                        connection.setAsyncCursor(cursor);
                        sent = true;
                    }
                }
            }
        } finally {
            guard.unlock();
        }

        if (!begin.isOk()) {
            throw ErrorReporter.fromCommand(connection, begin);
        }
        if (!sent) {
            PSQLException critical = connection.resolveCritical(true);
            throw critical != null ? critical : ErrorReporter.operational(connection, wireError);
        }
        if (!async) {
            resultFetcher.fetch(cursor);
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("async query dispatched, waiting to " + asyncStatus);
        }
    }

    @Override
    public void fetchAsyncResult(BaseCursor cursor) throws SQLException {
        connection.checkCritical(true);
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            if (connection.getAsyncCursor() != cursor) {
                throw new PSQLException(GT.tr("no asynchronous query in execution for this cursor"),
                        ErrorKind.PROGRAMMING, PSQLState.OBJECT_NOT_IN_STATE);
            }
            if (connection.getAsyncStatus() == AsyncStatus.WRITE) {
                throw new PSQLException(
                        GT.tr("the asynchronous query is not completely sent yet, flush the connection first"),
                        ErrorKind.PROGRAMMING, PSQLState.OBJECT_NOT_IN_STATE);
            }
            WireResult result = getLastResult(connection.getWireClient());
            connection.setAsyncCursor(null);
            connection.setAsyncStatus(AsyncStatus.DONE);
            cursor.setResult(result);
        } finally {
            guard.unlock();
        }
        resultFetcher.fetch(cursor);
    }

    @Override
    public boolean isBusy() throws SQLException {
        connection.checkCritical(false);
        WireClient wire = connection.getWireClient();
        boolean busy;
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            if (!wire.consumeInput()) {
                throw ErrorReporter.operational(connection, wire.getErrorMessage());
            }
            busy = wire.isBusy();
        } finally {
            guard.unlock();
        }
        connection.processNotices();
        connection.processNotifies();
        return busy;
    }

    @Override
    public int flush() throws SQLException {
        WireClient wire = connection.getWireClient();
        int ret;
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            ret = wire.flush();
            if (ret == 0 && connection.getAsyncStatus() == AsyncStatus.WRITE) {
                connection.setAsyncStatus(AsyncStatus.READ);
            }
        } finally {
            guard.unlock();
        }
        if (ret < 0) {
            throw ErrorReporter.operational(connection, wire.getErrorMessage());
        }
        return ret;
    }

    @Override
    public PollStatus pollLocked() throws SQLException {
        connection.getGuard().assertHeld();
        WireClient wire = connection.getWireClient();
        switch (connection.getAsyncStatus()) {
            case WRITE:
                int ret = wire.flush();
                if (ret == 0) {
                    connection.setAsyncStatus(AsyncStatus.READ);
                    return PollStatus.READ;
                }
                if (ret == 1) {
                    return PollStatus.WRITE;
                }
                throw ErrorReporter.operational(connection, wire.getErrorMessage());
            case READ:
                if (!wire.consumeInput()) {
                    throw ErrorReporter.operational(connection, wire.getErrorMessage());
                }
                return wire.isBusy() ? PollStatus.READ : PollStatus.OK;
            default:
                return PollStatus.OK;
        }
    }

    @Override
    public void clearAsync() throws SQLException {
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            clearAsyncLocked();
        } finally {
            guard.unlock();
        }
    }

    @Override
    public void clearAsyncLocked() {
        WireClient wire = connection.getWireClient();
        WireResult result;
        while ((result = wire.getResult()) != null) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("discarding pending result with status " + result.getStatus());
            }
            result.clear();
        }
        connection.setAsyncCursor(null);
        connection.setAsyncStatus(AsyncStatus.DONE);
    }

    @Override
    public void setNonBlocking(boolean nonBlocking) throws SQLException {
        WireClient wire = connection.getWireClient();
        boolean ok;
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            ok = wire.setNonBlocking(nonBlocking);
        } finally {
            guard.unlock();
        }
        if (!ok) {
            throw new PSQLException(GT.tr("could not set the connection blocking mode to {0}", nonBlocking),
                    ErrorKind.OPERATIONAL, PSQLState.CONNECTION_FAILURE);
        }
    }

    /**
     * Reads every result of the current statement and keeps the last one. Earlier results of a
     * multi-statement query are released and lost.
     */
    public static WireResult getLastResult(WireClient wire) {
        WireResult last = null;
        WireResult result;
        while ((result = wire.getResult()) != null) {
            if (last != null) {
                LOGGER.warn("discarding result with status " + last.getStatus() + " (" + last.getCommandStatus()
                        + "), only the last result of a statement is kept");
                last.clear();
            }
            last = result;
        }
        return last;
    }
}
