/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * What {@link ResultFetcher#fetch(BaseCursor)} found.
 */
public enum FetchOutcome {
    /** The cursor held no result. */
    NO_RESULT,
    /** A command or a COPY completed; there are no rows to read. */
    NO_ROWS,
    /** A tabular result is retained by the cursor. */
    ROWS
}
