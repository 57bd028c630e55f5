/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core.v2;

import org.pgsession.core.AbstractCopyStreamer;
import org.pgsession.core.BaseConnection;
import org.pgsession.core.BaseCursor;
import org.pgsession.core.CopyLine;
import org.pgsession.core.CopyResult;
import org.pgsession.core.ErrorReporter;
import org.pgsession.core.WireClient;
import org.pgsession.log.Log;
import org.pgsession.log.Logger;
import org.pgsession.util.PSQLException;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * COPY over the version 2 protocol. Data travels line by line and the line primitives report no
 * backend error: a failed copy only shows through the error notice, which poisons the connection,
 * and the results drained at the end.
 */
public class V2CopyStreamer extends AbstractCopyStreamer {
    private static final Log LOGGER = Logger.getLogger(V2CopyStreamer.class);

    /** Size of the buffer used to read lines of a COPY TO STDOUT. */
    static final int LINE_BUFFER_SIZE = 4096;

    private static final byte[] END_OF_COPY = {'\\', '.', '\n'};

    @Override
    protected CopyResult copyInFrom(BaseCursor cursor) {
        BaseConnection connection = cursor.getConnection();
        WireClient wire = connection.getWireClient();
        InputStream source = new BufferedInputStream(cursor.getCopySource());

        PSQLException streamError = null;
        PSQLException wireError = null;
        try {
            byte[] line;
            while ((line = readLine(source)) != null) {
                if (line[line.length - 1] != '\n') {
                    line = Arrays.copyOf(line, line.length + 1);
                    line[line.length - 1] = '\n';
                }
                if (LOGGER.isTraceEnabled()) {
                    LOGGER.trace("copy in: sending line of " + line.length + " bytes");
                }
                if (wire.putLine(line) != 0) {
                    wireError = ErrorReporter.fromResult(connection, null);
                    break;
                }
            }
        } catch (IOException e) {
            streamError = streamFailure("readline", e);
        }

        wire.putLine(END_OF_COPY);
        if (wire.endCopy() != 0 && wireError == null) {
            wireError = ErrorReporter.fromResult(connection, null);
        }
        cursor.clearResult();
        PSQLException backendError = drainResults(cursor);
        return outcome(streamError, backendError != null ? backendError : wireError);
    }

    @Override
    protected CopyResult copyOutTo(BaseCursor cursor) {
        BaseConnection connection = cursor.getConnection();
        WireClient wire = connection.getWireClient();
        OutputStream sink = cursor.getCopySink();

        PSQLException streamError = sink == null ? missingStream("COPY TO STDOUT", "copyTo") : null;
        PSQLException wireError = null;
        boolean continued = false;
        while (true) {
            CopyLine line = wire.getLine(LINE_BUFFER_SIZE);
            byte[] data = line.getData();
            boolean complete;
            if (line.getStatus() == CopyLine.LINE_COMPLETE) {
                if (!continued && data.length >= 2 && data[0] == '\\' && data[1] == '.') {
                    break;
                }
                complete = true;
            } else if (line.getStatus() == CopyLine.LINE_CONTINUES) {
                complete = false;
            } else {
                wireError = ErrorReporter.fromResult(connection, null);
                break;
            }
            continued = !complete;

            if (streamError == null) {
                try {
                    sink.write(data);
                    if (complete) {
                        sink.write('\n');
                    }
                } catch (IOException e) {
                    streamError = streamFailure("write", e);
                }
            }
        }

        if (wire.endCopy() != 0 && wireError == null) {
            wireError = ErrorReporter.fromResult(connection, null);
        }
        cursor.clearResult();
        PSQLException backendError = drainResults(cursor);
        return outcome(streamError, backendError != null ? backendError : wireError);
    }

    @Override
    protected void abortCopyIn(BaseCursor cursor) {
        // the legacy protocol cannot abort a copy, send an empty one
        WireClient wire = cursor.getConnection().getWireClient();
        wire.putLine(END_OF_COPY);
        wire.endCopy();
        cursor.clearResult();
        PSQLException ignored = drainResults(cursor);
        if (ignored != null && LOGGER.isDebugEnabled()) {
            LOGGER.debug("aborted copy reported: " + ignored.getMessage());
        }
    }

    /**
     * Reads one line, newline included.
     *
     * @return the raw bytes of the line, or null at the end of the stream
     */
    static byte[] readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        int b;
        while ((b = in.read()) != -1) {
            line.write(b);
            if (b == '\n') {
                break;
            }
        }
        if (line.size() == 0) {
            return null;
        }
        return line.toByteArray();
    }
}
