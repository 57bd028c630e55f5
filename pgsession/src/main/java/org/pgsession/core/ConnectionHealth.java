/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * Sticky fault flag of a connection. A poisoned connection carries the message of the
 * unrecoverable failure, severity prefix intact, until it is resolved into a raised error.
 */
public final class ConnectionHealth {
    public static final ConnectionHealth HEALTHY = new ConnectionHealth(null);

    private final String message;

    private ConnectionHealth(String message) {
        this.message = message;
    }

    public static ConnectionHealth poisoned(String message) {
        if (message == null) {
            throw new IllegalArgumentException("a poisoned connection needs a message");
        }
        return new ConnectionHealth(message);
    }

    public boolean isPoisoned() {
        return message != null;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return message == null ? "Healthy" : "Poisoned(" + message + ")";
    }
}
