/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.core.types.TypeCastTable;
import org.pgsession.util.PSQLException;

import java.nio.charset.Charset;
import java.sql.SQLException;

/**
 * Driver-internal connection interface. Engine components see the connection through this
 * interface; application code uses {@link org.pgsession.jdbc.PgConnection}.
 *
 * <p>Setters are only called with the connection's {@link ConnectionGuard} held.</p>
 */
public interface BaseConnection {
    int OPEN = 0;
    int CLOSED = 1;
    /** Closed because of a broken wire, resources not yet released. */
    int CLOSED_NEEDS_CLEANUP = 2;

    WireClient getWireClient();

    ConnectionGuard getGuard();

    int getProtocolVersion();

    TransactionStatus getTransactionStatus();

    void setTransactionStatus(TransactionStatus status);

    IsolationLevel getIsolationLevel();

    /**
     * @return a counter bumped on every transaction boundary
     */
    long getMark();

    void incrementMark();

    /**
     * @return {@link #OPEN}, {@link #CLOSED} or {@link #CLOSED_NEEDS_CLEANUP}
     */
    int getClosed();

    void setClosed(int closed);

    ConnectionHealth getHealth();

    /**
     * Poisons the connection. An empty or null message is ignored.
     */
    void setCritical(String message);

    /**
     * Turns a pending critical condition into an error and clears it.
     *
     * @param close whether to close the connection too
     * @return the error to raise, or null if the connection is healthy
     */
    PSQLException resolveCritical(boolean close);

    /**
     * Raises the pending critical condition, if any.
     */
    void checkCritical(boolean close) throws PSQLException;

    BaseCursor getAsyncCursor();

    void setAsyncCursor(BaseCursor cursor);

    AsyncStatus getAsyncStatus();

    void setAsyncStatus(AsyncStatus status);

    /**
     * @return the cooperative scheduling hook, or null when statements block the calling thread
     */
    WaitCallback getWaitCallback();

    /**
     * Advances an outstanding statement without blocking, see {@link WaitCallback}.
     */
    PollStatus pollLocked() throws SQLException;

    TransactionManager getTransactionManager();

    QueryExecutor getQueryExecutor();

    CopyStreamer getCopyStreamer();

    /**
     * @return the connection-scoped cast overrides, possibly empty
     */
    TypeCastTable getCastTable();

    /**
     * @return the default casts, consulted after the cursor and connection overrides
     */
    TypeCastTable getDefaultCastTable();

    boolean isExtendedErrors();

    boolean isDisplaySize();

    Charset getCharset();

    /**
     * Moves the notices received since the last call to the connection's notice list.
     */
    void processNotices();

    /**
     * Reads pending notifications off the wire. Must be called without holding the guard.
     */
    void processNotifies() throws SQLException;
}
