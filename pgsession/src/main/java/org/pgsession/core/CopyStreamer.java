/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import java.sql.SQLException;

/**
 * Moves COPY data between the wire client and the stream attached to a cursor. Called by the
 * {@link ResultFetcher} once the backend switched to copy mode, without the guard held: the
 * streamer holds it for the whole copy. Stream and backend failures are reported through the
 * returned {@link CopyResult}; only a failure to obtain the guard is thrown.
 */
public interface CopyStreamer {
    CopyResult copyIn(BaseCursor cursor) throws SQLException;

    CopyResult copyOut(BaseCursor cursor) throws SQLException;
}
