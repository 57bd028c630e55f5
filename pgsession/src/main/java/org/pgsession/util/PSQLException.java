/*
 * Copyright (c) 2003, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.util;

import java.sql.SQLException;

public class PSQLException extends SQLException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String pgError;
    private final String pgCode;

    public PSQLException(String msg, ErrorKind kind, PSQLState state) {
        this(msg, kind, state, null);
    }

    public PSQLException(String msg, ErrorKind kind, PSQLState state, Throwable cause) {
        super(msg, state == null ? kind.getDefaultState().getState() : state.getState(), cause);
        this.kind = kind;
        this.pgError = null;
        this.pgCode = null;
    }

    /**
     * Builds an exception for an error reported by the backend.
     *
     * @param msg message with the severity prefix removed
     * @param kind classified kind
     * @param pgError the full backend message, severity included
     * @param pgCode the backend SQLSTATE, or null when the protocol did not report one
     */
    public PSQLException(String msg, ErrorKind kind, String pgError, String pgCode) {
        super(msg, pgCode != null ? pgCode : kind.getDefaultState().getState());
        this.kind = kind;
        this.pgError = pgError;
        this.pgCode = pgCode;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getPgError() {
        return pgError;
    }

    public String getPgCode() {
        return pgCode;
    }
}
