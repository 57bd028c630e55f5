/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.jdbc;

import org.pgsession.core.BaseCursor;
import org.pgsession.core.Field;
import org.pgsession.core.Utils;
import org.pgsession.core.WireResult;
import org.pgsession.core.types.CastFunction;
import org.pgsession.core.types.TypeCastTable;
import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

import java.io.InputStream;
import java.io.OutputStream;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs statements on a {@link PgConnection} and reads their results.
 *
 * <p>A tabular result stays attached to the cursor until the next statement or
 * {@link #close()}; rows are converted with the casts bound when the result was fetched.</p>
 */
public class PgCursor implements BaseCursor, AutoCloseable {
    private final PgConnection connection;

    private WireResult result;
    private String statusMessage;
    private int rowCount = -1;
    private long lastRowId;
    private int rowNumber;
    private List<Field> description;
    private List<CastFunction> casts;
    private TypeCastTable castTable;
    private boolean closed;

    private InputStream copySource;
    private OutputStream copySink;
    private int copySize;

    PgCursor(PgConnection connection) {
        this.connection = connection;
        this.copySize = connection.getCopyBufferSize();
    }

    public void execute(String sql) throws SQLException {
        execute(sql, false);
    }

    /**
     * Runs {@code sql}. When {@code async} is set the call returns as soon as the statement is
     * sent; poll the connection with {@link PgConnection#isBusy()} and collect the outcome with
     * {@link #fetchAsyncResult()}.
     */
    public void execute(String sql, boolean async) throws SQLException {
        checkClosed();
        connection.getQueryExecutor().execute(this, sql, async);
    }

    public void fetchAsyncResult() throws SQLException {
        checkClosed();
        connection.getQueryExecutor().fetchAsyncResult(this);
    }

    /**
     * @return the next row, or null when all rows were read
     */
    public Object[] fetchOne() throws SQLException {
        checkHasRows();
        if (rowNumber >= result.getTupleCount()) {
            return null;
        }
        return buildRow(rowNumber++);
    }

    public List<Object[]> fetchMany(int size) throws SQLException {
        checkHasRows();
        int end = Math.min(result.getTupleCount(), rowNumber + Math.max(size, 0));
        List<Object[]> rows = new ArrayList<Object[]>(Math.max(end - rowNumber, 0));
        while (rowNumber < end) {
            rows.add(buildRow(rowNumber++));
        }
        return rows;
    }

    public List<Object[]> fetchAll() throws SQLException {
        checkHasRows();
        return fetchMany(result.getTupleCount() - rowNumber);
    }

    private Object[] buildRow(int row) throws SQLException {
        int fieldCount = casts.size();
        Object[] values = new Object[fieldCount];
        for (int i = 0; i < fieldCount; i++) {
            byte[] raw = result.isNull(row, i) ? null : result.getValue(row, i);
            values[i] = casts.get(i).cast(raw, this);
        }
        return values;
    }

    private void checkHasRows() throws SQLException {
        checkClosed();
        if (result == null || casts == null) {
            throw new PSQLException(GT.tr("no results to fetch"),
                    ErrorKind.PROGRAMMING, PSQLState.OBJECT_NOT_IN_STATE);
        }
    }

    //
    // COPY
    //

    public void copyFrom(InputStream source, String table) throws SQLException {
        copyFrom(source, table, "\t", "\\N", connection.getCopyBufferSize());
    }

    /**
     * Loads {@code table} from {@code source}, read in chunks of {@code size} bytes.
     */
    public void copyFrom(InputStream source, String table, String separator, String nullString, int size)
            throws SQLException {
        String sql = "COPY " + table + " FROM STDIN WITH DELIMITER AS " + Utils.quoteLiteral(separator)
                + " NULL AS " + Utils.quoteLiteral(nullString);
        copyExpert(sql, source, size);
    }

    public void copyTo(OutputStream sink, String table) throws SQLException {
        copyTo(sink, table, "\t", "\\N");
    }

    public void copyTo(OutputStream sink, String table, String separator, String nullString)
            throws SQLException {
        String sql = "COPY " + table + " TO STDOUT WITH DELIMITER AS " + Utils.quoteLiteral(separator)
                + " NULL AS " + Utils.quoteLiteral(nullString);
        copyExpert(sql, sink);
    }

    /**
     * Runs a user supplied {@code COPY ... FROM STDIN} reading from {@code source}.
     */
    public void copyExpert(String sql, InputStream source, int size) throws SQLException {
        if (source == null) {
            throw new PSQLException(GT.tr("a source stream is required"),
                    ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
        }
        runCopy(sql, source, null, size);
    }

    /**
     * Runs a user supplied {@code COPY ... TO STDOUT} writing to {@code sink}.
     */
    public void copyExpert(String sql, OutputStream sink) throws SQLException {
        if (sink == null) {
            throw new PSQLException(GT.tr("a sink stream is required"),
                    ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
        }
        runCopy(sql, null, sink, connection.getCopyBufferSize());
    }

    private void runCopy(String sql, InputStream source, OutputStream sink, int size) throws SQLException {
        checkClosed();
        if (size <= 0) {
            throw new PSQLException(GT.tr("copy buffer size must be positive but was: {0}", String.valueOf(size)),
                    ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
        }
        copySource = source;
        copySink = sink;
        copySize = size;
        try {
            execute(sql, false);
        } finally {
            copySource = null;
            copySink = null;
            copySize = connection.getCopyBufferSize();
        }
    }

    //
    // BaseCursor
    //

    @Override
    public PgConnection getConnection() {
        return connection;
    }

    @Override
    public WireResult getResult() {
        return result;
    }

    @Override
    public void setResult(WireResult result) {
        clearResult();
        this.result = result;
    }

    @Override
    public void clearResult() {
        if (result != null) {
            result.clear();
            result = null;
        }
    }

    @Override
    public void reset() {
        statusMessage = null;
        rowCount = -1;
        lastRowId = 0;
        rowNumber = 0;
        description = null;
        casts = null;
    }

    @Override
    public void setStatusMessage(String statusMessage) {
        this.statusMessage = statusMessage;
    }

    @Override
    public void setRowCount(int rowCount) {
        this.rowCount = rowCount;
    }

    @Override
    public void setLastRowId(long lastRowId) {
        this.lastRowId = lastRowId;
    }

    @Override
    public void setDescription(List<Field> description) {
        this.description = description;
    }

    @Override
    public void setCasts(List<CastFunction> casts) {
        this.casts = casts;
    }

    @Override
    public TypeCastTable getCastTable() {
        return castTable;
    }

    /**
     * Installs casts that take precedence over the connection's for this cursor.
     */
    public void setCastTable(TypeCastTable castTable) {
        this.castTable = castTable;
    }

    @Override
    public InputStream getCopySource() {
        return copySource;
    }

    @Override
    public OutputStream getCopySink() {
        return copySink;
    }

    @Override
    public int getCopySize() {
        return copySize;
    }

    /**
     * @return the command tag of the last statement, e.g. {@code "INSERT 0 1"}
     */
    public String getStatusMessage() {
        return statusMessage;
    }

    /**
     * @return the number of rows produced or affected by the last statement, -1 if unknown
     */
    public int getRowCount() {
        return rowCount;
    }

    /**
     * @return the OID of the row inserted by the last statement, 0 if none
     */
    public long getLastRowId() {
        return lastRowId;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    /**
     * @return the columns of the current tabular result, or null
     */
    public List<Field> getDescription() {
        return description;
    }

    public List<CastFunction> getCasts() {
        return casts == null ? null : Collections.unmodifiableList(casts);
    }

    //
    // Lifecycle
    //

    @Override
    public void close() {
        if (closed) {
            return;
        }
        clearResult();
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkClosed() throws PSQLException {
        if (closed) {
            throw new PSQLException(GT.tr("cursor already closed"),
                    ErrorKind.PROGRAMMING, PSQLState.OBJECT_NOT_IN_STATE);
        }
        connection.checkClosed();
    }
}
