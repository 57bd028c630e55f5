/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.log;

/**
 * Logging facade used by every engine component. Implementations adapt a concrete backend.
 */
public interface Log {
    boolean isTraceEnabled();

    boolean isDebugEnabled();

    boolean isInfoEnabled();

    boolean isWarnEnabled();

    boolean isErrorEnabled();

    void trace(Object msg);

    void trace(Object msg, Throwable throwable);

    void debug(Object msg);

    void debug(Object msg, Throwable throwable);

    void info(Object msg);

    void info(Object msg, Throwable throwable);

    void warn(Object msg);

    void warn(Object msg, Throwable throwable);

    void error(Object msg);

    void error(Object msg, Throwable throwable);
}
