/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core.types;

import org.pgsession.core.BaseCursor;

import java.sql.SQLException;

/**
 * Converts the wire representation of a column value into a Java object.
 */
public interface CastFunction {
    String getName();

    /**
     * @param value the raw value, null for SQL NULL
     * @param cursor the cursor the value was fetched by
     * @return the converted value, null for SQL NULL
     */
    Object cast(byte[] value, BaseCursor cursor) throws SQLException;
}
