/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * A result produced by the wire client. Column and row indexes are zero based.
 *
 * <p>A result must be {@link #clear() cleared} before the next command runs on the same
 * connection, unless a cursor retains it to serve rows.</p>
 */
public interface WireResult {
    ExecStatus getStatus();

    /**
     * @return the command status tag, e.g. {@code "INSERT 0 1"}
     */
    String getCommandStatus();

    /**
     * @return the number of rows affected as reported by the backend, or an empty string
     */
    String getCommandTuples();

    /**
     * @return the OID of the inserted row, or 0
     */
    long getOidValue();

    String getErrorMessage();

    /**
     * @return the SQLSTATE field of the error, or null when the protocol does not carry it
     */
    String getSQLState();

    int getTupleCount();

    int getFieldCount();

    String getFieldName(int column);

    int getFieldType(int column);

    int getFieldSize(int column);

    int getFieldModifier(int column);

    boolean isBinaryTuples();

    boolean isNull(int row, int column);

    int getLength(int row, int column);

    byte[] getValue(int row, int column);

    void clear();
}
