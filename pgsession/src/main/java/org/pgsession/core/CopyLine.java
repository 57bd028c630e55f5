/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * Result of the legacy line-oriented copy read, {@link WireClient#getLine(int)}.
 */
public final class CopyLine {
    /** The data holds a whole line, newline removed. */
    public static final int LINE_COMPLETE = 0;
    /** The buffer filled up before the newline; more of the same line follows. */
    public static final int LINE_CONTINUES = 1;
    /** No more input. */
    public static final int END_OF_DATA = -1;

    private static final CopyLine END = new CopyLine(END_OF_DATA, new byte[0]);

    private final int status;
    private final byte[] data;

    public CopyLine(int status, byte[] data) {
        this.status = status;
        this.data = data;
    }

    public static CopyLine endOfData() {
        return END;
    }

    public int getStatus() {
        return status;
    }

    public byte[] getData() {
        return data;
    }
}
