/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * One chunk returned by {@link WireClient#getCopyData(boolean)}. A positive length carries data;
 * {@link #DONE} ends the copy and {@link #ERROR} reports a failure.
 */
public final class CopyData {
    public static final int NOT_READY = 0;
    public static final int DONE = -1;
    public static final int ERROR = -2;

    private static final CopyData NOT_READY_DATA = new CopyData(NOT_READY, null);
    private static final CopyData DONE_DATA = new CopyData(DONE, null);
    private static final CopyData ERROR_DATA = new CopyData(ERROR, null);

    private final int length;
    private final byte[] data;

    private CopyData(int length, byte[] data) {
        this.length = length;
        this.data = data;
    }

    public static CopyData of(byte[] data) {
        return new CopyData(data.length, data);
    }

    public static CopyData notReady() {
        return NOT_READY_DATA;
    }

    public static CopyData done() {
        return DONE_DATA;
    }

    public static CopyData error() {
        return ERROR_DATA;
    }

    public int getLength() {
        return length;
    }

    public byte[] getData() {
        return data;
    }
}
