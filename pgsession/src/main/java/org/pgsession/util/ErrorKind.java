/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.util;

/**
 * Exception kinds raised by the engine. The names mirror the DB-API error hierarchy; each kind
 * has a SQLSTATE used when the backend did not report one.
 */
public enum ErrorKind {
    NOT_SUPPORTED(PSQLState.NOT_IMPLEMENTED),
    PROGRAMMING(PSQLState.SYNTAX_ERROR),
    DATA(PSQLState.DATA_ERROR),
    INTEGRITY(PSQLState.INTEGRITY_CONSTRAINT_VIOLATION),
    INTERNAL(PSQLState.INTERNAL_ERROR),
    OPERATIONAL(PSQLState.CONNECTION_FAILURE),
    TRANSACTION_ROLLBACK(PSQLState.TRANSACTION_ROLLBACK),
    QUERY_CANCELED(PSQLState.QUERY_CANCELED),
    DATABASE(PSQLState.UNKNOWN_STATE);

    private final PSQLState defaultState;

    ErrorKind(PSQLState defaultState) {
        this.defaultState = defaultState;
    }

    public PSQLState getDefaultState() {
        return defaultState;
    }
}
