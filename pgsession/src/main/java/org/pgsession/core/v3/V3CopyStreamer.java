/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core.v3;

import org.pgsession.core.AbstractCopyStreamer;
import org.pgsession.core.BaseConnection;
import org.pgsession.core.BaseCursor;
import org.pgsession.core.CopyData;
import org.pgsession.core.CopyResult;
import org.pgsession.core.ErrorReporter;
import org.pgsession.core.WireClient;
import org.pgsession.log.Log;
import org.pgsession.log.Logger;
import org.pgsession.util.PSQLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * COPY over the version 3 protocol: data travels in chunks and errors are reported inline by the
 * copy primitives.
 */
public class V3CopyStreamer extends AbstractCopyStreamer {
    private static final Log LOGGER = Logger.getLogger(V3CopyStreamer.class);

    private static final String PUT_DATA_FAILED = "error in putCopyData() call";
    private static final String READ_FAILED = "error in read() call";

    @Override
    protected CopyResult copyInFrom(BaseCursor cursor) {
        BaseConnection connection = cursor.getConnection();
        WireClient wire = connection.getWireClient();
        InputStream source = cursor.getCopySource();
        int size = cursor.getCopySize();
        byte[] buffer = new byte[size];

        PSQLException streamError = null;
        boolean putFailed = false;
        while (true) {
            int length;
            try {
                length = source.read(buffer, 0, size);
            } catch (IOException e) {
                streamError = streamFailure("read", e);
                break;
            }
            if (length <= 0) {
                break;
            }
            int res = wire.putCopyData(buffer, length);
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("copy in: sent " + length + " bytes, result " + res);
            }
            if (res == -1) {
                putFailed = true;
                break;
            }
        }

        String endMessage = null;
        if (streamError != null) {
            endMessage = READ_FAILED;
        } else if (putFailed) {
            endMessage = PUT_DATA_FAILED;
        }
        int res = wire.putCopyEnd(endMessage);
        cursor.clearResult();

        if (res == -1) {
            PSQLException error = ErrorReporter.fromResult(connection, null);
            connection.setClosed(BaseConnection.CLOSED_NEEDS_CLEANUP);
            return outcome(streamError, error);
        }
        PSQLException backendError = drainResults(cursor);
        if (backendError == null && putFailed) {
            backendError = ErrorReporter.fromResult(connection, null);
        }
        return outcome(streamError, backendError);
    }

    @Override
    protected CopyResult copyOutTo(BaseCursor cursor) {
        BaseConnection connection = cursor.getConnection();
        WireClient wire = connection.getWireClient();
        OutputStream sink = cursor.getCopySink();

        PSQLException streamError = sink == null ? missingStream("COPY TO STDOUT", "copyTo") : null;
        CopyData chunk;
        while (true) {
            chunk = wire.getCopyData(false);
            if (chunk.getLength() <= 0) {
                break;
            }
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("copy out: received " + chunk.getLength() + " bytes");
            }
            if (streamError == null) {
                try {
                    sink.write(chunk.getData(), 0, chunk.getLength());
                } catch (IOException e) {
                    streamError = streamFailure("write", e);
                }
            }
        }

        cursor.clearResult();
        if (chunk.getLength() == CopyData.ERROR) {
            return outcome(streamError, ErrorReporter.fromResult(connection, null));
        }
        return outcome(streamError, drainResults(cursor));
    }

    @Override
    protected void abortCopyIn(BaseCursor cursor) {
        WireClient wire = cursor.getConnection().getWireClient();
        wire.putCopyEnd("COPY FROM STDIN without a source stream");
        cursor.clearResult();
        PSQLException ignored = drainResults(cursor);
        if (ignored != null && LOGGER.isDebugEnabled()) {
            LOGGER.debug("aborted copy reported: " + ignored.getMessage());
        }
    }
}
