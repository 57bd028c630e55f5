/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.pgsession.SessionProperty;
import org.pgsession.core.types.BasicCasts;
import org.pgsession.core.types.CastFunction;
import org.pgsession.core.types.TypeCastTable;
import org.pgsession.jdbc.PgConnection;
import org.pgsession.jdbc.PgCursor;
import org.pgsession.test.FakeResult;
import org.pgsession.test.FakeWireClient;
import org.pgsession.util.ErrorKind;
import org.pgsession.util.PSQLException;

import org.junit.Before;
import org.junit.Test;

import java.util.Properties;

public class ResultFetcherTest {
    private static final CastFunction UPPER = new CastFunction() {
        @Override
        public String getName() {
            return "UPPER";
        }

        @Override
        public Object cast(byte[] value, BaseCursor cursor) {
            return value == null ? null : new String(value, cursor.getConnection().getCharset()).toUpperCase();
        }
    };

    private FakeWireClient wire;
    private PgConnection conn;
    private PgCursor cursor;
    private final ResultFetcher fetcher = new ResultFetcher();

    @Before
    public void setUp() throws Exception {
        wire = new FakeWireClient();
        conn = new PgConnection(wire, new Properties());
        cursor = conn.cursor();
    }

    @Test
    public void parseRowCount() {
        assertEquals(12, ResultFetcher.parseRowCount("12"));
        assertEquals(0, ResultFetcher.parseRowCount("0"));
        assertEquals(-1, ResultFetcher.parseRowCount(""));
        assertEquals(-1, ResultFetcher.parseRowCount(null));
        assertEquals(-1, ResultFetcher.parseRowCount("twelve"));
    }

    @Test
    public void noResult() throws Exception {
        assertEquals(FetchOutcome.NO_RESULT, fetcher.fetch(cursor));
        assertEquals(-1, cursor.getRowCount());
    }

    @Test
    public void commandResult() throws Exception {
        FakeResult result = FakeResult.command("INSERT 16384 1", "1").oid(16384);
        cursor.setResult(result);

        assertEquals(FetchOutcome.NO_ROWS, fetcher.fetch(cursor));
        assertEquals("INSERT 16384 1", cursor.getStatusMessage());
        assertEquals(1, cursor.getRowCount());
        assertEquals(16384L, cursor.getLastRowId());
        assertTrue(result.isCleared());
        assertNull(cursor.getResult());
    }

    @Test
    public void commandWithoutRowCount() throws Exception {
        cursor.setResult(FakeResult.command("CREATE TABLE", ""));
        fetcher.fetch(cursor);
        assertEquals(-1, cursor.getRowCount());
    }

    @Test
    public void columnDescription() throws Exception {
        cursor.setResult(FakeResult.tuples("SELECT 1")
                .column("id", Oid.INT4, 4, -1)
                .column("name", Oid.VARCHAR, -1, 24)
                .column("amount", Oid.NUMERIC, -1, ((10 << 16) | 2) + 4)
                .row("1", "abc", "12.50"));

        assertEquals(FetchOutcome.ROWS, fetcher.fetch(cursor));
        assertEquals(1, cursor.getRowCount());
        assertEquals(3, cursor.getDescription().size());

        Field id = cursor.getDescription().get(0);
        assertEquals("id", id.getName());
        assertEquals(Oid.INT4, id.getTypeOid());
        assertEquals(Integer.valueOf(4), id.getInternalSize());
        assertNull(id.getPrecision());
        assertNull(id.getScale());
        assertNull(id.getDisplaySize());
        assertNull(id.getNullOk());

        Field name = cursor.getDescription().get(1);
        assertEquals(Integer.valueOf(20), name.getInternalSize());
        assertNull(name.getPrecision());

        Field amount = cursor.getDescription().get(2);
        assertEquals(Integer.valueOf(10), amount.getInternalSize());
        assertEquals(Integer.valueOf(10), amount.getPrecision());
        assertEquals(Integer.valueOf(2), amount.getScale());
    }

    @Test
    public void displaySizeWhenEnabled() throws Exception {
        Properties info = new Properties();
        SessionProperty.DISPLAY_SIZE.set(info, true);
        conn = new PgConnection(wire, info);
        cursor = conn.cursor();
        cursor.setResult(FakeResult.tuples("SELECT 2")
                .column("name", Oid.TEXT, -1, -1)
                .column("note", Oid.TEXT, -1, -1)
                .row("abc", null)
                .row("a", null));

        fetcher.fetch(cursor);

        assertEquals(Integer.valueOf(3), cursor.getDescription().get(0).getDisplaySize());
        assertEquals(Integer.valueOf(0), cursor.getDescription().get(1).getDisplaySize());
    }

    @Test
    public void castLookupOrder() {
        TypeCastTable cursorCasts = TypeCastTable.empty().with(Oid.INT4, UPPER);
        TypeCastTable connectionCasts = TypeCastTable.empty().with(Oid.INT4, BasicCasts.FLOAT)
                .with(Oid.TEXT, UPPER);
        TypeCastTable defaults = TypeCastTable.defaults();

        assertSame(UPPER, ResultFetcher.lookupCast(Oid.INT4, cursorCasts, connectionCasts, defaults));
        assertSame(UPPER, ResultFetcher.lookupCast(Oid.TEXT, cursorCasts, connectionCasts, defaults));
        assertSame(BasicCasts.BOOLEAN, ResultFetcher.lookupCast(Oid.BOOL, cursorCasts, connectionCasts, defaults));
        assertSame(BasicCasts.STRING, ResultFetcher.lookupCast(9999, cursorCasts, connectionCasts, defaults));
        assertSame(BasicCasts.STRING, ResultFetcher.lookupCast(Oid.INT4, null, null, null));
    }

    @Test
    public void castsFollowOverrides() throws Exception {
        conn.registerCast(Oid.TEXT, UPPER);
        cursor.setResult(FakeResult.tuples("SELECT 1")
                .column("name", Oid.TEXT, -1, -1)
                .column("flag", Oid.BOOL, 1, -1)
                .row("abc", "t"));
        fetcher.fetch(cursor);

        Object[] row = cursor.fetchOne();
        assertEquals("ABC", row[0]);
        assertEquals(Boolean.TRUE, row[1]);
        assertNull(cursor.fetchOne());
    }

    @Test
    public void errorResultIsRaisedAndReleased() throws Exception {
        FakeResult result = FakeResult.error("ERROR:  division by zero", "22012");
        cursor.setResult(result);
        try {
            fetcher.fetch(cursor);
            fail();
        } catch (PSQLException e) {
            assertEquals(ErrorKind.DATA, e.getKind());
            assertEquals("division by zero", e.getMessage());
        }
        assertTrue(result.isCleared());
        assertFalse(conn.isClosed());
    }

    @Test
    public void criticalConditionWinsOverFailure() throws Exception {
        cursor.setResult(FakeResult.error("ERROR:  division by zero", "22012"));
        conn.setCritical("FATAL:  connection to server was lost");
        try {
            fetcher.fetch(cursor);
            fail();
        } catch (PSQLException e) {
            assertEquals(ErrorKind.OPERATIONAL, e.getKind());
            assertThat(e.getMessage(), containsString("connection to server was lost"));
            assertEquals(1, e.getSuppressed().length);
        }
        assertTrue(conn.isClosed());
    }

    @Test
    public void criticalConditionAfterSuccessKeepsConnection() throws Exception {
        cursor.setResult(FakeResult.command("UPDATE 2", "2"));
        conn.setCritical("ERROR:  something went wrong during the copy");
        try {
            fetcher.fetch(cursor);
            fail();
        } catch (PSQLException e) {
            assertEquals("something went wrong during the copy", e.getMessage());
        }
        assertFalse(conn.isClosed());
        assertFalse(conn.getHealth().isPoisoned());
    }

    @Test
    public void noticesAreCollected() throws Exception {
        wire.sendNotice("NOTICE:  table \"t\" does not exist, skipping\n");
        cursor.setResult(FakeResult.command("DROP TABLE", ""));
        fetcher.fetch(cursor);
        assertEquals(1, conn.getNotices().size());
    }
}
