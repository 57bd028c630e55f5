/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

import java.util.Locale;

/**
 * Isolation level of the implicit transaction. {@link #AUTOCOMMIT} never opens one.
 */
public enum IsolationLevel {
    AUTOCOMMIT(0, null),
    READ_COMMITTED(1, "READ COMMITTED"),
    SERIALIZABLE(2, "SERIALIZABLE");

    private final int value;
    private final String sqlName;

    IsolationLevel(int value, String sqlName) {
        this.value = value;
        this.sqlName = sqlName;
    }

    public int getValue() {
        return value;
    }

    public boolean isAutocommit() {
        return this == AUTOCOMMIT;
    }

    /**
     * @return the statement opening a transaction at this level, or null in autocommit mode
     */
    public String getBeginCommand() {
        if (sqlName == null) {
            return null;
        }
        return "BEGIN; SET TRANSACTION ISOLATION LEVEL " + sqlName;
    }

    public static IsolationLevel fromValue(int value) throws PSQLException {
        for (IsolationLevel level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        throw new PSQLException(GT.tr("isolation level must be between 0 and 2, got {0}",
                String.valueOf(value)), ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
    }

    /**
     * Parses a level name ({@code read_committed}, {@code READ COMMITTED}...) or its number.
     */
    public static IsolationLevel fromString(String name) throws PSQLException {
        if (name == null) {
            throw new PSQLException(GT.tr("isolation level must not be null"),
                    ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        if (normalized.length() == 1 && Character.isDigit(normalized.charAt(0))) {
            return fromValue(normalized.charAt(0) - '0');
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new PSQLException(GT.tr("unknown isolation level: {0}", name),
                    ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE, e);
        }
    }
}
