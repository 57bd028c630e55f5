/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

public enum WireStatus {
    CONNECTION_OK,
    CONNECTION_BAD
}
