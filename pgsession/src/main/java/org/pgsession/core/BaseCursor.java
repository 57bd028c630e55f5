/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.core.types.CastFunction;
import org.pgsession.core.types.TypeCastTable;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * Driver-internal cursor interface, see {@link org.pgsession.jdbc.PgCursor}.
 */
public interface BaseCursor {
    BaseConnection getConnection();

    WireResult getResult();

    /**
     * Takes ownership of {@code result}, releasing the previous one.
     */
    void setResult(WireResult result);

    void clearResult();

    /**
     * Forgets the outcome of the previous statement. The result itself is left alone.
     */
    void reset();

    void setStatusMessage(String statusMessage);

    void setRowCount(int rowCount);

    void setLastRowId(long lastRowId);

    void setDescription(List<Field> description);

    void setCasts(List<CastFunction> casts);

    /**
     * @return the cursor-scoped cast overrides, or null
     */
    TypeCastTable getCastTable();

    InputStream getCopySource();

    OutputStream getCopySink();

    int getCopySize();
}
