/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

/**
 * Per-connection mutual exclusion over the {@link WireClient}.
 *
 * <p>Methods whose name ends in {@code Locked} expect the caller to hold the guard already and
 * are meant for composition; the others acquire and release it themselves. The guard is not
 * reentrant: obtaining it twice from the same thread is a programming error and fails rather than
 * deadlocking.</p>
 */
public class ConnectionGuard {
    private Thread lockedFor = null;

    /**
     * Obtain the guard for the current thread, blocking to wait if necessary.
     *
     * @throws PSQLException when already holding the guard or getting interrupted
     */
    public synchronized void lock() throws PSQLException {
        Thread obtainer = Thread.currentThread();
        if (lockedFor == obtainer) {
            throw new PSQLException(GT.tr("Tried to obtain lock while already holding it"),
                    ErrorKind.OPERATIONAL, PSQLState.OBJECT_NOT_IN_STATE);
        }
        while (lockedFor != null) {
            try {
                this.wait();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new PSQLException(
                        GT.tr("Interrupted while waiting to obtain lock on database connection"),
                        ErrorKind.OPERATIONAL, PSQLState.OBJECT_NOT_IN_STATE, ie);
            }
        }
        lockedFor = obtainer;
    }

    /**
     * Release the guard held by the current thread.
     *
     * @throws PSQLException when this thread does not hold the guard
     */
    public synchronized void unlock() throws PSQLException {
        if (lockedFor != Thread.currentThread()) {
            throw new PSQLException(GT.tr("Tried to break lock on database connection"),
                    ErrorKind.OPERATIONAL, PSQLState.OBJECT_NOT_IN_STATE);
        }
        lockedFor = null;
        this.notify();
    }

    public synchronized boolean isHeldByCurrentThread() {
        return lockedFor == Thread.currentThread();
    }

    /**
     * Fails unless the current thread holds the guard. Used by the {@code Locked} variants.
     */
    public void assertHeld() {
        if (!isHeldByCurrentThread()) {
            throw new IllegalStateException("connection guard not held by " + Thread.currentThread().getName());
        }
    }
}
