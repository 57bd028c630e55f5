/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import java.sql.SQLException;

/**
 * <p>Abstracts the protocol-specific details of executing a query.</p>
 *
 * <p>Every method may be called from any thread; wire access is serialized through the
 * connection's {@link ConnectionGuard}. At most one asynchronous statement may be outstanding
 * per connection.</p>
 */
public interface QueryExecutor {
    /**
     * Execute a statement for a cursor.
     *
     * <p>Synchronous execution waits for the backend and fetches the outcome into the cursor
     * before returning. Asynchronous execution returns once the statement is handed to the wire;
     * the caller polls {@link #isBusy()} and {@link #flush()} and then calls
     * {@link #fetchAsyncResult(BaseCursor)}.</p>
     *
     * @param cursor the cursor receiving the results
     * @param query the statement text
     * @param async whether to return without waiting for the results
     * @throws SQLException if the statement could not be sent, or failed when run synchronously
     */
    void execute(BaseCursor cursor, String query, boolean async) throws SQLException;

    /**
     * Collects the results of the asynchronous statement of {@code cursor}, blocking if they are
     * not all available yet.
     */
    void fetchAsyncResult(BaseCursor cursor) throws SQLException;

    /**
     * Reads pending input and reports whether a result is still being produced.
     */
    boolean isBusy() throws SQLException;

    /**
     * Attempts to send queued output.
     *
     * @return 0 when everything was sent, 1 when output remains queued
     */
    int flush() throws SQLException;

    /**
     * Advances the outstanding statement without blocking. Must be called with the guard held.
     */
    PollStatus pollLocked() throws SQLException;

    /**
     * Discards every pending result of the outstanding asynchronous statement.
     */
    void clearAsync() throws SQLException;

    void clearAsyncLocked();

    void setNonBlocking(boolean nonBlocking) throws SQLException;
}
