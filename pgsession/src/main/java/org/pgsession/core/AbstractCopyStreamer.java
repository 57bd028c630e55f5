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

import java.io.IOException;
import java.sql.SQLException;

/**
 * Behaviour shared by the protocol-specific {@link CopyStreamer}s.
 */
public abstract class AbstractCopyStreamer implements CopyStreamer {
    private static final Log LOGGER = Logger.getLogger(AbstractCopyStreamer.class);

    @Override
    public final CopyResult copyIn(BaseCursor cursor) throws SQLException {
        ConnectionGuard guard = cursor.getConnection().getGuard();
        guard.lock();
        try {
            if (cursor.getCopySource() == null) {
                abortCopyIn(cursor);
                return CopyResult.failed(missingStream("COPY FROM STDIN", "copyFrom"));
            }
            return copyInFrom(cursor);
        } finally {
            guard.unlock();
        }
    }

    @Override
    public final CopyResult copyOut(BaseCursor cursor) throws SQLException {
        ConnectionGuard guard = cursor.getConnection().getGuard();
        guard.lock();
        try {
            return copyOutTo(cursor);
        } finally {
            guard.unlock();
        }
    }

    /**
     * Uploads from the cursor's source. Called with the guard held.
     */
    protected abstract CopyResult copyInFrom(BaseCursor cursor);

    /**
     * Downloads to the cursor's sink, with the guard held. Without a sink the data is read and
     * discarded, and the copy reported as failed.
     */
    protected abstract CopyResult copyOutTo(BaseCursor cursor);

    /**
     * Ends a COPY FROM STDIN that has no source to read from. Called with the guard held.
     */
    protected abstract void abortCopyIn(BaseCursor cursor);

    /**
     * Reads every remaining result of the copy statement.
     *
     * @return the error of the first fatal result, or null
     */
    protected PSQLException drainResults(BaseCursor cursor) {
        BaseConnection connection = cursor.getConnection();
        WireClient wire = connection.getWireClient();
        PSQLException error = null;
        WireResult result;
        while ((result = wire.getResult()) != null) {
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("copy ended with result status " + result.getStatus());
            }
            if (result.getStatus() == ExecStatus.FATAL_ERROR && error == null) {
                error = ErrorReporter.fromResult(connection, result);
            }
            result.clear();
        }
        return error;
    }

    protected static PSQLException missingStream(String statement, String method) {
        return new PSQLException(GT.tr("can''t execute {0}: use the {1}() method instead", statement, method),
                ErrorKind.PROGRAMMING, PSQLState.OBJECT_NOT_IN_STATE);
    }

    protected static PSQLException streamFailure(String operation, IOException cause) {
        return new PSQLException(GT.tr("error in {0}() call: {1}", operation, cause.getMessage()),
                ErrorKind.OPERATIONAL, PSQLState.IO_ERROR, cause);
    }

    /**
     * Picks the error to report: a stream failure first, then the backend's.
     */
    protected static CopyResult outcome(PSQLException streamError, PSQLException backendError) {
        if (streamError != null) {
            if (backendError != null) {
                streamError.addSuppressed(backendError);
            }
            return CopyResult.failed(streamError);
        }
        if (backendError != null) {
            return CopyResult.failed(backendError);
        }
        return CopyResult.ok();
    }
}
