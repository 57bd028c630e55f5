/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * I/O direction an outstanding asynchronous statement is waiting on.
 */
public enum AsyncStatus {
    DONE,
    READ,
    WRITE
}
