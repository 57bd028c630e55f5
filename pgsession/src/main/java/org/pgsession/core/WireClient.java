/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * The protocol-level client of a single backend connection.
 *
 * <p>Implementations are not thread safe: every call must be made while holding the owning
 * connection's {@link ConnectionGuard}.</p>
 */
public interface WireClient {
    WireStatus getStatus();

    /**
     * @return the frontend/backend protocol version negotiated at connect time, 2 or 3
     */
    int getProtocolVersion();

    /**
     * @return the most recent error reported by the client, severity prefix included
     */
    String getErrorMessage();

    /**
     * Sends a query and blocks until all its results arrived.
     *
     * @return the last result, or null if the client could not produce one (out of memory, lost
     *         connection)
     */
    WireResult exec(String query);

    /**
     * Sends a query without waiting for its results.
     *
     * @return false if the query could not be dispatched
     */
    boolean sendQuery(String query);

    /**
     * @return false on failure to read from the socket
     */
    boolean consumeInput();

    boolean isBusy();

    /**
     * @return 0 if all output was sent, 1 if some is still queued, -1 on failure
     */
    int flush();

    /**
     * @return the next result of the current query, or null when there are no more
     */
    WireResult getResult();

    /**
     * @return false if the mode could not be changed
     */
    boolean setNonBlocking(boolean nonBlocking);

    boolean isNonBlocking();

    /**
     * @return 1 if queued, 0 if it would block in non-blocking mode, -1 on failure
     */
    int putCopyData(byte[] buffer, int length);

    /**
     * Ends a COPY FROM STDIN. A non-null message makes the backend abort the copy with it.
     *
     * @return 1 if sent, 0 if it would block, -1 on failure
     */
    int putCopyEnd(String errorMessage);

    CopyData getCopyData(boolean async);

    /**
     * Legacy protocol line write. The bytes are sent as they are, newline included.
     *
     * @return 0 on success
     */
    int putLine(byte[] line);

    /**
     * Legacy protocol line read into a buffer of {@code bufferSize} bytes, one of which is
     * reserved for the terminator.
     */
    CopyLine getLine(int bufferSize);

    /**
     * Legacy protocol end of copy.
     *
     * @return 0 on success
     */
    int endCopy();

    void setNoticeListener(NoticeListener listener);

    /**
     * @return the next pending notification, or null
     */
    Notification getNotification();

    void close();
}
