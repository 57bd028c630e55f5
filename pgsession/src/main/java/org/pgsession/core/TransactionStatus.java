/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * Transaction phase of a connection as tracked by the engine.
 */
public enum TransactionStatus {
    /** No transaction open. */
    READY,
    /** A transaction was opened by the implicit BEGIN. */
    BEGIN,
    /** A two-phase transaction was prepared and awaits COMMIT/ROLLBACK PREPARED. */
    PREPARED
}
