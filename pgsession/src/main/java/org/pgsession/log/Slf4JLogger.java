/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Slf4JLogger implements Log {
    private final Logger logger;

    public Slf4JLogger(String name) {
        this.logger = LoggerFactory.getLogger(name);
    }

    @Override
    public boolean isTraceEnabled() {
        return logger.isTraceEnabled();
    }

    @Override
    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    @Override
    public boolean isInfoEnabled() {
        return logger.isInfoEnabled();
    }

    @Override
    public boolean isWarnEnabled() {
        return logger.isWarnEnabled();
    }

    @Override
    public boolean isErrorEnabled() {
        return logger.isErrorEnabled();
    }

    @Override
    public void trace(Object msg) {
        logger.trace(String.valueOf(msg));
    }

    @Override
    public void trace(Object msg, Throwable throwable) {
        logger.trace(String.valueOf(msg), throwable);
    }

    @Override
    public void debug(Object msg) {
        logger.debug(String.valueOf(msg));
    }

    @Override
    public void debug(Object msg, Throwable throwable) {
        logger.debug(String.valueOf(msg), throwable);
    }

    @Override
    public void info(Object msg) {
        logger.info(String.valueOf(msg));
    }

    @Override
    public void info(Object msg, Throwable throwable) {
        logger.info(String.valueOf(msg), throwable);
    }

    @Override
    public void warn(Object msg) {
        logger.warn(String.valueOf(msg));
    }

    @Override
    public void warn(Object msg, Throwable throwable) {
        logger.warn(String.valueOf(msg), throwable);
    }

    @Override
    public void error(Object msg) {
        logger.error(String.valueOf(msg));
    }

    @Override
    public void error(Object msg, Throwable throwable) {
        logger.error(String.valueOf(msg), throwable);
    }
}
