/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.pgsession.util.ErrorKind;
import org.pgsession.util.PSQLException;

import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class ConnectionGuardTest {

    @Test
    public void lockAndUnlock() throws Exception {
        ConnectionGuard guard = new ConnectionGuard();
        assertFalse(guard.isHeldByCurrentThread());
        guard.lock();
        assertTrue(guard.isHeldByCurrentThread());
        guard.assertHeld();
        guard.unlock();
        assertFalse(guard.isHeldByCurrentThread());
    }

    @Test
    public void relockingFails() throws Exception {
        ConnectionGuard guard = new ConnectionGuard();
        guard.lock();
        try {
            guard.lock();
            fail("the guard is not reentrant");
        } catch (PSQLException e) {
            assertEquals(ErrorKind.OPERATIONAL, e.getKind());
            assertThat(e.getMessage(), containsString("already holding it"));
        } finally {
            guard.unlock();
        }
    }

    @Test
    public void unlockWithoutHoldingFails() {
        ConnectionGuard guard = new ConnectionGuard();
        try {
            guard.unlock();
            fail("unlock must require the guard");
        } catch (PSQLException e) {
            assertThat(e.getMessage(), containsString("break lock"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void assertHeldWithoutHolding() {
        new ConnectionGuard().assertHeld();
    }

    @Test
    public void otherThreadWaitsForRelease() throws Exception {
        final ConnectionGuard guard = new ConnectionGuard();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch acquired = new CountDownLatch(1);
        final AtomicBoolean failed = new AtomicBoolean();
        guard.lock();

        Thread other = new Thread(new Runnable() {
            @Override
            public void run() {
                started.countDown();
                try {
                    guard.lock();
                    acquired.countDown();
                    guard.unlock();
                } catch (PSQLException e) {
                    failed.set(true);
                }
            }
        });
        other.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertFalse(acquired.await(100, TimeUnit.MILLISECONDS));

        guard.unlock();
        assertTrue(acquired.await(5, TimeUnit.SECONDS));
        other.join(5000);
        assertFalse(failed.get());
    }
}
