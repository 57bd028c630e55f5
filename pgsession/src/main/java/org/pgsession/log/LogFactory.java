/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.log;

import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Instantiates {@link Log} implementations by class name. Short names are resolved against this
 * package, so {@code "Slf4JLogger"} and {@code "org.pgsession.log.Slf4JLogger"} are equivalent.
 */
public class LogFactory {

    private LogFactory() {
    }

    public static Log getLogger(String className, String instanceName) throws PSQLException {
        if (className == null) {
            throw invalid("logger class name is null", null);
        }
        if (instanceName == null) {
            throw invalid("logger instance name is null", null);
        }

        Class<?> loggerClass;
        try {
            loggerClass = Class.forName(className);
        } catch (ClassNotFoundException notQualified) {
            try {
                loggerClass = Class.forName(getPackageName(Log.class) + "." + className);
            } catch (ClassNotFoundException cnfe) {
                throw invalid(GT.tr("can''t find class of logger ''{0}''", className), cnfe);
            }
        }
        if (!Log.class.isAssignableFrom(loggerClass)) {
            throw invalid(GT.tr("logger class ''{0}'' does not implement Log", className), null);
        }

        try {
            Constructor<?> constructor = loggerClass.getConstructor(String.class);
            return (Log) constructor.newInstance(instanceName);
        } catch (NoSuchMethodException nsme) {
            throw invalid(GT.tr("logger class ''{0}'' has no (String) constructor", className), nsme);
        } catch (InstantiationException | IllegalAccessException e) {
            throw invalid(GT.tr("can''t instantiate logger class ''{0}''", className), e);
        } catch (InvocationTargetException ite) {
            throw invalid(GT.tr("constructor of logger class ''{0}'' failed", className),
                    ite.getTargetException());
        }
    }

    public static String getPackageName(Class<?> clazz) {
        String name = clazz.getName();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : "";
    }

    private static PSQLException invalid(String message, Throwable cause) {
        return new PSQLException(message, ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE, cause);
    }
}
