/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.util;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

import org.junit.Test;

public class ErrorClassifierTest {

    @Test
    public void integrityViolation() {
        assertEquals(ErrorKind.INTEGRITY, ErrorClassifier.fromSqlState("23505", true));
        assertEquals(ErrorKind.INTEGRITY, ErrorClassifier.fromSqlState("23503", false));
    }

    @Test
    public void syntaxErrorIsProgramming() {
        assertEquals(ErrorKind.PROGRAMMING, ErrorClassifier.fromSqlState("42601", true));
        assertEquals(ErrorKind.PROGRAMMING, ErrorClassifier.fromSqlState("42P01", true));
        assertEquals(ErrorKind.PROGRAMMING, ErrorClassifier.fromSqlState("21000", true));
        assertEquals(ErrorKind.PROGRAMMING, ErrorClassifier.fromSqlState("3D000", true));
    }

    @Test
    public void dataException() {
        assertEquals(ErrorKind.DATA, ErrorClassifier.fromSqlState("22012", true));
        assertEquals(ErrorKind.DATA, ErrorClassifier.fromSqlState("22P02", true));
    }

    @Test
    public void featureNotSupported() {
        assertEquals(ErrorKind.NOT_SUPPORTED, ErrorClassifier.fromSqlState("0A000", true));
        assertEquals(ErrorKind.DATABASE, ErrorClassifier.fromSqlState("01000", true));
    }

    @Test
    public void queryCanceledDependsOnExtendedErrors() {
        assertEquals(ErrorKind.QUERY_CANCELED, ErrorClassifier.fromSqlState("57014", true));
        assertEquals(ErrorKind.OPERATIONAL, ErrorClassifier.fromSqlState("57014", false));
        assertEquals(ErrorKind.OPERATIONAL, ErrorClassifier.fromSqlState("57P01", true));
        assertEquals(ErrorKind.OPERATIONAL, ErrorClassifier.fromSqlState("53100", true));
    }

    @Test
    public void transactionRollbackDependsOnExtendedErrors() {
        assertEquals(ErrorKind.TRANSACTION_ROLLBACK, ErrorClassifier.fromSqlState("40001", true));
        assertEquals(ErrorKind.TRANSACTION_ROLLBACK, ErrorClassifier.fromSqlState("40P01", true));
        assertEquals(ErrorKind.OPERATIONAL, ErrorClassifier.fromSqlState("40001", false));
    }

    @Test
    public void internalClasses() {
        assertEquals(ErrorKind.INTERNAL, ErrorClassifier.fromSqlState("25P02", true));
        assertEquals(ErrorKind.INTERNAL, ErrorClassifier.fromSqlState("2D000", true));
        assertEquals(ErrorKind.INTERNAL, ErrorClassifier.fromSqlState("39004", true));
        assertEquals(ErrorKind.INTERNAL, ErrorClassifier.fromSqlState("XX000", true));
        assertEquals(ErrorKind.INTERNAL, ErrorClassifier.fromSqlState("P0001", true));
        assertEquals(ErrorKind.INTERNAL, ErrorClassifier.fromSqlState("F0000", true));
    }

    @Test
    public void operationalClasses() {
        assertEquals(ErrorKind.OPERATIONAL, ErrorClassifier.fromSqlState("28P01", true));
        assertEquals(ErrorKind.OPERATIONAL, ErrorClassifier.fromSqlState("26000", true));
        assertEquals(ErrorKind.OPERATIONAL, ErrorClassifier.fromSqlState("34000", true));
    }

    @Test
    public void unknownClassIsDatabase() {
        assertEquals(ErrorKind.DATABASE, ErrorClassifier.fromSqlState("HV000", true));
        assertEquals(ErrorKind.DATABASE, ErrorClassifier.fromSqlState("", true));
    }

    @Test
    public void messageFallback() {
        assertEquals(ErrorKind.INTEGRITY,
                ErrorClassifier.fromMessage("ERROR:  Cannot insert a duplicate key into unique index", true));
        assertEquals(ErrorKind.INTEGRITY,
                ErrorClassifier.fromMessage("ERROR:  ExecAppend: Fail to add null value", true));
        assertEquals(ErrorKind.INTEGRITY,
                ErrorClassifier.fromMessage("ERROR:  fk_t referential integrity violation", true));
        assertEquals(ErrorKind.TRANSACTION_ROLLBACK,
                ErrorClassifier.fromMessage("ERROR:  could not serialize access", true));
        assertEquals(ErrorKind.OPERATIONAL,
                ErrorClassifier.fromMessage("ERROR:  deadlock detected", false));
        assertEquals(ErrorKind.PROGRAMMING, ErrorClassifier.fromMessage("ERROR:  parser: parse error", true));
        assertEquals(ErrorKind.PROGRAMMING, ErrorClassifier.fromMessage(null, true));
    }

    @Test
    public void sqlStateWinsOverMessage() {
        assertEquals(ErrorKind.DATA,
                ErrorClassifier.classify("ERROR:  Cannot insert a duplicate key", "22000", true));
        assertEquals(ErrorKind.INTEGRITY,
                ErrorClassifier.classify("ERROR:  Cannot insert a duplicate key", null, true));
    }

    @Test
    public void stripSeverity() {
        assertEquals("relation \"t\" does not exist",
                ErrorClassifier.stripSeverity("ERROR:  relation \"t\" does not exist"));
        assertEquals("the database system is shutting down",
                ErrorClassifier.stripSeverity("FATAL:  the database system is shutting down"));
        assertEquals("out of memory", ErrorClassifier.stripSeverity("PANIC:  out of memory"));
        assertEquals("WARNING:  careful", ErrorClassifier.stripSeverity("WARNING:  careful"));
        // too short to carry a message after the prefix
        assertEquals("ERROR:  ", ErrorClassifier.stripSeverity("ERROR:  "));
        assertThat(ErrorClassifier.stripSeverity(null), nullValue());
    }

    @Test
    public void toExceptionKeepsBackendDetails() {
        String message = "ERROR:  duplicate key value violates unique constraint \"t_pkey\"";
        PSQLException e = ErrorClassifier.toException(message, "23505", true);
        assertThat(e.getKind(), is(ErrorKind.INTEGRITY));
        assertThat(e.getMessage(), is("duplicate key value violates unique constraint \"t_pkey\""));
        assertThat(e.getPgError(), is(message));
        assertThat(e.getPgCode(), is("23505"));
        assertThat(e.getSQLState(), is("23505"));
    }

    @Test
    public void toExceptionWithoutCodeUsesKindState() {
        PSQLException e = ErrorClassifier.toException("ERROR:  syntax error", null, true);
        assertThat(e.getKind(), is(ErrorKind.PROGRAMMING));
        assertThat(e.getPgCode(), nullValue());
        assertThat(e.getSQLState(), is(ErrorKind.PROGRAMMING.getDefaultState().getState()));
    }
}
