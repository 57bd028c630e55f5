/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.log;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Log} backed by {@code java.util.logging}. The reported source class and method are the
 * first stack frame outside this package, so records point at the engine code that logged.
 */
public class JdkLogger implements Log {
    private static final String LOG_PACKAGE = LogFactory.getPackageName(Log.class);

    private final Logger jdkLogger;

    public JdkLogger(String name) {
        this.jdkLogger = Logger.getLogger(name);
    }

    @Override
    public boolean isTraceEnabled() {
        return jdkLogger.isLoggable(Level.FINEST);
    }

    @Override
    public boolean isDebugEnabled() {
        return jdkLogger.isLoggable(Level.FINE);
    }

    @Override
    public boolean isInfoEnabled() {
        return jdkLogger.isLoggable(Level.INFO);
    }

    @Override
    public boolean isWarnEnabled() {
        return jdkLogger.isLoggable(Level.WARNING);
    }

    @Override
    public boolean isErrorEnabled() {
        return jdkLogger.isLoggable(Level.SEVERE);
    }

    @Override
    public void trace(Object msg) {
        log(Level.FINEST, msg, null);
    }

    @Override
    public void trace(Object msg, Throwable throwable) {
        log(Level.FINEST, msg, throwable);
    }

    @Override
    public void debug(Object msg) {
        log(Level.FINE, msg, null);
    }

    @Override
    public void debug(Object msg, Throwable throwable) {
        log(Level.FINE, msg, throwable);
    }

    @Override
    public void info(Object msg) {
        log(Level.INFO, msg, null);
    }

    @Override
    public void info(Object msg, Throwable throwable) {
        log(Level.INFO, msg, throwable);
    }

    @Override
    public void warn(Object msg) {
        log(Level.WARNING, msg, null);
    }

    @Override
    public void warn(Object msg, Throwable throwable) {
        log(Level.WARNING, msg, throwable);
    }

    @Override
    public void error(Object msg) {
        log(Level.SEVERE, msg, null);
    }

    @Override
    public void error(Object msg, Throwable throwable) {
        log(Level.SEVERE, msg, throwable);
    }

    private void log(Level level, Object msg, Throwable throwable) {
        if (!jdkLogger.isLoggable(level)) {
            return;
        }
        String className = "NULL";
        String methodName = "NULL";
        StackTraceElement[] stackTrace = new Throwable().getStackTrace();
        for (StackTraceElement element : stackTrace) {
            if (!element.getClassName().startsWith(LOG_PACKAGE)) {
                className = element.getClassName();
                methodName = element.getMethodName();
                break;
            }
        }
        if (throwable == null) {
            jdkLogger.logp(level, className, methodName, String.valueOf(msg));
        } else {
            jdkLogger.logp(level, className, methodName, String.valueOf(msg), throwable);
        }
    }
}
