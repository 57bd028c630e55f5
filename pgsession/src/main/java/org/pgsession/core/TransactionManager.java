/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.log.Log;
import org.pgsession.log.Logger;
import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

import java.sql.SQLException;

/**
 * Transaction state machine of one connection.
 *
 * <p>Every status change happens with the connection guard held, and every transaction boundary
 * bumps the connection mark once. Isolation level {@link IsolationLevel#AUTOCOMMIT} never opens
 * a transaction.</p>
 */
public class TransactionManager {
    private static final Log LOGGER = Logger.getLogger(TransactionManager.class);

    private final BaseConnection connection;

    public TransactionManager(BaseConnection connection) {
        this.connection = connection;
    }

    /**
     * Opens the implicit transaction if the connection is READY and not in autocommit mode.
     */
    public CommandResult beginLocked() {
        IsolationLevel level = connection.getIsolationLevel();
        if (level.isAutocommit() || connection.getTransactionStatus() != TransactionStatus.READY) {
            return CommandResult.success();
        }
        CommandResult outcome = CommandRunner.run(connection, level.getBeginCommand());
        if (outcome.isOk()) {
            connection.incrementMark();
            setStatus(TransactionStatus.BEGIN);
        }
        return outcome;
    }

    public void begin() throws SQLException {
        CommandResult outcome;
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            checkNoAsyncLocked("begin");
            outcome = beginLocked();
        } finally {
            guard.unlock();
        }
        complete(outcome);
    }

    /**
     * Commits the open transaction. The status goes back to READY even if COMMIT fails, since the
     * backend has aborted the transaction in that case.
     */
    public void commit() throws SQLException {
        CommandResult outcome;
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            checkNoAsyncLocked("commit");
            if (connection.getIsolationLevel().isAutocommit()
                    || connection.getTransactionStatus() != TransactionStatus.BEGIN) {
                return;
            }
            connection.incrementMark();
            outcome = CommandRunner.run(connection, "COMMIT");
            setStatus(TransactionStatus.READY);
        } finally {
            guard.unlock();
        }
        complete(outcome);
    }

    public CommandResult abortLocked() {
        if (connection.getIsolationLevel().isAutocommit()
                || connection.getTransactionStatus() != TransactionStatus.BEGIN) {
            return CommandResult.success();
        }
        connection.incrementMark();
        CommandResult outcome = CommandRunner.run(connection, "ROLLBACK");
        if (outcome.isOk()) {
            setStatus(TransactionStatus.READY);
        }
        return outcome;
    }

    public void rollback() throws SQLException {
        CommandResult outcome;
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            checkNoAsyncLocked("rollback");
            outcome = abortLocked();
        } finally {
            guard.unlock();
        }
        complete(outcome);
    }

    /**
     * Aborts the open transaction, if any, and restores the session defaults.
     */
    public CommandResult resetLocked() {
        connection.incrementMark();
        CommandResult outcome;
        if (!connection.getIsolationLevel().isAutocommit()
                && connection.getTransactionStatus() == TransactionStatus.BEGIN) {
            outcome = CommandRunner.run(connection, "ABORT");
            if (!outcome.isOk()) {
                return outcome;
            }
        }
        outcome = CommandRunner.run(connection, "RESET ALL");
        if (!outcome.isOk()) {
            return outcome;
        }
        outcome = CommandRunner.run(connection, "SET SESSION AUTHORIZATION DEFAULT");
        if (!outcome.isOk()) {
            return outcome;
        }
        setStatus(TransactionStatus.READY);
        return outcome;
    }

    public void reset() throws SQLException {
        CommandResult outcome;
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            checkNoAsyncLocked("reset");
            outcome = resetLocked();
        } finally {
            guard.unlock();
        }
        complete(outcome);
    }

    /**
     * Runs a two-phase commit command, {@code <command> '<transactionId>';}. The status is left
     * alone.
     */
    public CommandResult tpcCommandLocked(String command, String transactionId) {
        String query;
        try {
            query = command + " " + Utils.quoteLiteral(transactionId) + ";";
        } catch (PSQLException e) {
            return CommandResult.failure(e.getMessage());
        }
        return CommandRunner.run(connection, query);
    }

    /**
     * Prepares the open transaction under {@code transactionId}; the status becomes PREPARED.
     */
    public void tpcPrepare(String transactionId) throws SQLException {
        CommandResult outcome;
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            checkNoAsyncLocked("tpcPrepare");
            connection.incrementMark();
            outcome = tpcCommandLocked("PREPARE TRANSACTION", transactionId);
            if (outcome.isOk()) {
                setStatus(TransactionStatus.PREPARED);
            }
        } finally {
            guard.unlock();
        }
        complete(outcome);
    }

    /**
     * Finishes a prepared transaction with {@code COMMIT PREPARED} or {@code ROLLBACK PREPARED}.
     * The status becomes READY on success.
     */
    public void tpcFinish(boolean commit, String transactionId) throws SQLException {
        CommandResult outcome;
        ConnectionGuard guard = connection.getGuard();
        guard.lock();
        try {
            checkNoAsyncLocked(commit ? "tpcCommit" : "tpcRollback");
            connection.incrementMark();
            outcome = tpcCommandLocked(commit ? "COMMIT PREPARED" : "ROLLBACK PREPARED", transactionId);
            if (outcome.isOk()) {
                setStatus(TransactionStatus.READY);
            }
        } finally {
            guard.unlock();
        }
        complete(outcome);
    }

    /**
     * Refuses {@code operation} while an asynchronous statement has results pending on the wire.
     */
    public void checkNoAsyncLocked(String operation) throws PSQLException {
        connection.getGuard().assertHeld();
        if (connection.getAsyncCursor() != null) {
            throw new PSQLException(
                    GT.tr("{0} cannot be used while an asynchronous query is underway", operation),
                    ErrorKind.PROGRAMMING, PSQLState.OBJECT_IN_USE);
        }
    }

    private void complete(CommandResult outcome) throws SQLException {
        connection.processNotices();
        connection.processNotifies();
        if (!outcome.isOk()) {
            throw ErrorReporter.fromCommand(connection, outcome);
        }
    }

    private void setStatus(TransactionStatus status) {
        if (LOGGER.isDebugEnabled() && connection.getTransactionStatus() != status) {
            LOGGER.debug("transaction status " + connection.getTransactionStatus() + " -> " + status);
        }
        connection.setTransactionStatus(status);
    }
}
