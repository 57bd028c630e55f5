/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.util;

import java.io.Serializable;

/**
 * SQLSTATE codes the engine attaches to errors it produces itself. Errors reported by the backend
 * carry the backend's own code instead.
 */
public class PSQLState implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final PSQLState UNKNOWN_STATE = new PSQLState("");

    public static final PSQLState CONNECTION_DOES_NOT_EXIST = new PSQLState("08003");

    /**
     * After a connection has been established, it went bad.
     */
    public static final PSQLState CONNECTION_FAILURE = new PSQLState("08006");

    public static final PSQLState PROTOCOL_VIOLATION = new PSQLState("08P01");

    public static final PSQLState COMMUNICATION_ERROR = new PSQLState("08S01");

    public static final PSQLState NOT_IMPLEMENTED = new PSQLState("0A000");

    public static final PSQLState DATA_ERROR = new PSQLState("22000");

    public static final PSQLState NUMERIC_VALUE_OUT_OF_RANGE = new PSQLState("22003");

    public static final PSQLState INVALID_PARAMETER_VALUE = new PSQLState("22023");

    public static final PSQLState INVALID_TEXT_REPRESENTATION = new PSQLState("22P02");

    public static final PSQLState INTEGRITY_CONSTRAINT_VIOLATION = new PSQLState("23000");

    public static final PSQLState INVALID_TRANSACTION_STATE = new PSQLState("25000");

    public static final PSQLState ACTIVE_SQL_TRANSACTION = new PSQLState("25001");

    public static final PSQLState NO_ACTIVE_SQL_TRANSACTION = new PSQLState("25P01");

    public static final PSQLState TRANSACTION_ROLLBACK = new PSQLState("40000");

    public static final PSQLState SYNTAX_ERROR = new PSQLState("42601");

    public static final PSQLState OUT_OF_MEMORY = new PSQLState("53200");

    public static final PSQLState OBJECT_NOT_IN_STATE = new PSQLState("55000");

    public static final PSQLState OBJECT_IN_USE = new PSQLState("55006");

    public static final PSQLState QUERY_CANCELED = new PSQLState("57014");

    public static final PSQLState IO_ERROR = new PSQLState("58030");

    public static final PSQLState INTERNAL_ERROR = new PSQLState("XX000");

    public static final PSQLState UNEXPECTED_ERROR = new PSQLState("99999");

    private final String state;

    public PSQLState(String state) {
        this.state = state;
    }

    public String getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return state.equals(((PSQLState) o).state);
    }

    @Override
    public int hashCode() {
        return state.hashCode();
    }

    @Override
    public String toString() {
        return state;
    }
}
