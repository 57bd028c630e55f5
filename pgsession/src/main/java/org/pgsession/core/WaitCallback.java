/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import java.sql.SQLException;

/**
 * Cooperative scheduling hook. Once installed on a connection it is used instead of blocking the
 * calling thread whenever the engine waits for the backend: the statement is sent without
 * waiting and the callback is invoked to drive it to completion.
 *
 * <p>Implementations call {@link BaseConnection#pollLocked()} until it returns
 * {@link PollStatus#OK}, yielding to their scheduler in between when it asks for
 * {@link PollStatus#READ} or {@link PollStatus#WRITE}. The connection guard is held during the
 * call.</p>
 */
public interface WaitCallback {
    void waitFor(BaseConnection connection) throws SQLException;
}
