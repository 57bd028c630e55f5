/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.core.types.BasicCasts;
import org.pgsession.core.types.CastFunction;
import org.pgsession.core.types.TypeCastTable;
import org.pgsession.log.Log;
import org.pgsession.log.Logger;
import org.pgsession.util.PSQLException;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the result held by a cursor into the cursor's visible state: status message, row count,
 * last row id, column description and per-column casts. Must be called without the guard held.
 */
public class ResultFetcher {
    private static final Log LOGGER = Logger.getLogger(ResultFetcher.class);

    /** Width of the header the backend adds to variable-length type modifiers. */
    private static final int VARHDRSZ = 4;

    public FetchOutcome fetch(BaseCursor cursor) throws SQLException {
        BaseConnection connection = cursor.getConnection();
        cursor.reset();

        WireResult result = cursor.getResult();
        if (result == null) {
            return FetchOutcome.NO_RESULT;
        }

        ExecStatus status = result.getStatus();
        cursor.setStatusMessage(result.getCommandStatus());
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("fetching result with status " + status + " (" + result.getCommandStatus() + ")");
        }

        FetchOutcome outcome = FetchOutcome.NO_ROWS;
        PSQLException failure = null;
        CopyResult copy;
        switch (status) {
            case COMMAND_OK:
                cursor.setRowCount(parseRowCount(result.getCommandTuples()));
                cursor.setLastRowId(result.getOidValue());
                cursor.clearResult();
                break;

            case COPY_OUT:
                copy = connection.getCopyStreamer().copyOut(cursor);
                cursor.setRowCount(-1);
                failure = copy.getError();
                break;

            case COPY_IN:
                copy = connection.getCopyStreamer().copyIn(cursor);
                cursor.setRowCount(-1);
                failure = copy.getError();
                break;

            case TUPLES_OK:
                cursor.setRowCount(result.getTupleCount());
                fetchTuples(cursor, result);
                outcome = FetchOutcome.ROWS;
                break;

            default:
                failure = ErrorReporter.fromResult(connection, result);
                cursor.clearResult();
                break;
        }

        connection.processNotices();
        connection.processNotifies();

        if (connection.getHealth().isPoisoned()) {
            PSQLException critical = connection.resolveCritical(failure != null);
            if (failure != null) {
                critical.addSuppressed(failure);
            }
            throw critical;
        }
        if (failure != null) {
            throw failure;
        }
        return outcome;
    }

    /**
     * Parses the affected row count reported by the backend.
     *
     * @return the count, or -1 if the text is empty or not a number
     */
    static int parseRowCount(String commandTuples) {
        if (commandTuples == null || commandTuples.isEmpty()) {
            return -1;
        }
        try {
            return Integer.parseInt(commandTuples);
        } catch (NumberFormatException e) {
            LOGGER.debug("unexpected affected rows text: " + commandTuples);
            return -1;
        }
    }

    private void fetchTuples(BaseCursor cursor, WireResult result) {
        BaseConnection connection = cursor.getConnection();
        int fieldCount = result.getFieldCount();
        int[] displaySizes = connection.isDisplaySize() ? computeDisplaySizes(result) : null;

        TypeCastTable cursorCasts = cursor.getCastTable();
        TypeCastTable connectionCasts = connection.getCastTable();
        TypeCastTable defaultCasts = connection.getDefaultCastTable();

        List<Field> description = new ArrayList<Field>(fieldCount);
        List<CastFunction> casts = new ArrayList<CastFunction>(fieldCount);
        for (int i = 0; i < fieldCount; i++) {
            int type = result.getFieldType(i);
            int size = result.getFieldSize(i);
            int modifier = result.getFieldModifier(i);

            CastFunction cast = lookupCast(type, cursorCasts, connectionCasts, defaultCasts);
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("column " + i + " (" + Oid.toString(type) + ") bound to " + cast.getName());
            }
            casts.add(cast);

            if (modifier > 0) {
                modifier -= VARHDRSZ;
            }
            Integer internalSize;
            if (size == -1) {
                internalSize = type == Oid.NUMERIC ? (modifier >> 16) & 0xFFFF : modifier;
            } else {
                internalSize = size;
            }
            Integer precision = null;
            Integer scale = null;
            if (type == Oid.NUMERIC) {
                precision = (modifier >> 16) & 0xFFFF;
                scale = modifier & 0xFFFF;
            }
            Integer displaySize = null;
            if (displaySizes != null && displaySizes[i] >= 0) {
                displaySize = displaySizes[i];
            }
            description.add(new Field(result.getFieldName(i), type, displaySize, internalSize, precision, scale));
        }
        cursor.setDescription(Collections.unmodifiableList(description));
        cursor.setCasts(Collections.unmodifiableList(casts));
    }

    static CastFunction lookupCast(int type, TypeCastTable cursorCasts, TypeCastTable connectionCasts,
            TypeCastTable defaultCasts) {
        CastFunction cast = null;
        if (cursorCasts != null) {
            cast = cursorCasts.get(type);
        }
        if (cast == null && connectionCasts != null) {
            cast = connectionCasts.get(type);
        }
        if (cast == null && defaultCasts != null) {
            cast = defaultCasts.get(type);
        }
        if (cast == null) {
            cast = BasicCasts.defaultCast();
        }
        return cast;
    }

    private static int[] computeDisplaySizes(WireResult result) {
        int fieldCount = result.getFieldCount();
        int tupleCount = result.getTupleCount();
        int[] sizes = new int[fieldCount];
        for (int i = 0; i < fieldCount; i++) {
            sizes[i] = -1;
        }
        for (int row = 0; row < tupleCount; row++) {
            for (int i = 0; i < fieldCount; i++) {
                int length = result.getLength(row, i);
                if (length > sizes[i]) {
                    sizes[i] = length;
                }
            }
        }
        return sizes;
    }
}
