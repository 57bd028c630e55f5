/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * Status of a {@link WireResult}, as reported by the wire client.
 */
public enum ExecStatus {
    EMPTY_QUERY,
    COMMAND_OK,
    TUPLES_OK,
    COPY_OUT,
    COPY_IN,
    BAD_RESPONSE,
    NONFATAL_ERROR,
    FATAL_ERROR
}
