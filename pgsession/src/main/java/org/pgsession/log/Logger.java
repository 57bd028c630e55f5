/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.log;

import org.pgsession.util.PSQLException;

/**
 * Entry point for obtaining {@link Log} instances. The backend is selected by name; classes
 * hold their logger in a static field, so the backend must be chosen before they are loaded.
 */
public class Logger {
    public static final String JDK_LOGGER = "JdkLogger";

    private static volatile String loggerName;

    private Logger() {
    }

    public static Log getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public static Log getLogger(String name) {
        String backend = loggerName;
        if (backend == null || backend.isEmpty()) {
            return new JdkLogger(name);
        }
        try {
            return LogFactory.getLogger(backend, name);
        } catch (PSQLException e) {
            Log fallback = new JdkLogger(name);
            fallback.warn("logger backend '" + backend + "' unavailable, using " + JDK_LOGGER, e);
            return fallback;
        }
    }

    public static synchronized void setLoggerName(String name) {
        loggerName = name;
    }

    public static String getLoggerName() {
        String backend = loggerName;
        return backend == null || backend.isEmpty() ? JDK_LOGGER : backend;
    }

    public static boolean isUsingJdkLogger() {
        String backend = getLoggerName();
        int lastDot = backend.lastIndexOf('.');
        return JDK_LOGGER.equals(lastDot >= 0 ? backend.substring(lastDot + 1) : backend);
    }
}
