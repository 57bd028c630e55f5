/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.jdbc;

import org.pgsession.SessionProperty;
import org.pgsession.core.AsyncStatus;
import org.pgsession.core.BaseConnection;
import org.pgsession.core.BaseCursor;
import org.pgsession.core.CommandResult;
import org.pgsession.core.ConnectionGuard;
import org.pgsession.core.ConnectionHealth;
import org.pgsession.core.CopyStreamer;
import org.pgsession.core.ErrorReporter;
import org.pgsession.core.IsolationLevel;
import org.pgsession.core.Notification;
import org.pgsession.core.PollStatus;
import org.pgsession.core.QueryExecutor;
import org.pgsession.core.QueryExecutorImpl;
import org.pgsession.core.ResultFetcher;
import org.pgsession.core.TransactionManager;
import org.pgsession.core.TransactionStatus;
import org.pgsession.core.WaitCallback;
import org.pgsession.core.WireClient;
import org.pgsession.core.types.CastFunction;
import org.pgsession.core.types.TypeCastTable;
import org.pgsession.core.v2.V2CopyStreamer;
import org.pgsession.core.v3.V3CopyStreamer;
import org.pgsession.log.Log;
import org.pgsession.log.Logger;
import org.pgsession.util.ErrorClassifier;
import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;
import org.pgsession.xa.PgXid;

import java.nio.charset.Charset;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A session with the backend, built on top of a connected {@link WireClient}.
 *
 * <p>The connection may be shared between threads: statements are serialized through its
 * {@link ConnectionGuard}. Once a wire failure has poisoned the connection, the next public
 * operation raises it.</p>
 */
public class PgConnection implements BaseConnection, AutoCloseable {
    private static final Log LOGGER = Logger.getLogger(PgConnection.class);

    /** Number of notices kept by {@link #getNotices()}. */
    static final int MAX_NOTICES = 50;

    private final WireClient wire;
    private final ConnectionGuard guard = new ConnectionGuard();
    private final int protocolVersion;
    private final IsolationLevel defaultIsolationLevel;
    private final boolean extendedErrors;
    private final boolean displaySize;
    private final int copyBufferSize;
    private final Charset charset;
    private final TypeCastTable defaultCastTable;
    private final TransactionManager transactionManager;
    private final QueryExecutor queryExecutor;
    private final CopyStreamer copyStreamer;

    private volatile TransactionStatus transactionStatus = TransactionStatus.READY;
    private volatile IsolationLevel isolationLevel;
    private final AtomicLong mark = new AtomicLong();
    private volatile int closed = OPEN;
    private volatile ConnectionHealth health = ConnectionHealth.HEALTHY;
    private volatile BaseCursor asyncCursor;
    private volatile AsyncStatus asyncStatus = AsyncStatus.DONE;
    private volatile WaitCallback waitCallback;
    private volatile TypeCastTable castTable = TypeCastTable.empty();
    private volatile PgXid tpcXid;

    private final List<String> pendingNotices = new ArrayList<String>();
    private final LinkedList<String> notices = new LinkedList<String>();
    private final List<Notification> notifies = new ArrayList<Notification>();

    public PgConnection(WireClient wire, Properties info) throws PSQLException {
        this(wire, info, TypeCastTable.defaults());
    }

    /**
     * @param wire a connected wire client, owned by this connection from now on
     * @param info session properties, see {@link SessionProperty}
     * @param defaultCastTable the casts consulted after the cursor and connection overrides
     */
    public PgConnection(WireClient wire, Properties info, TypeCastTable defaultCastTable)
            throws PSQLException {
        if (SessionProperty.LOGGER.isPresent(info)) {
            Logger.setLoggerName(SessionProperty.LOGGER.get(info));
        }
        this.wire = wire;
        this.protocolVersion = wire.getProtocolVersion();
        this.defaultIsolationLevel = IsolationLevel.fromString(SessionProperty.ISOLATION_LEVEL.get(info));
        this.isolationLevel = defaultIsolationLevel;
        this.extendedErrors = SessionProperty.EXTENDED_ERRORS.getBoolean(info);
        this.displaySize = SessionProperty.DISPLAY_SIZE.getBoolean(info);
        this.copyBufferSize = SessionProperty.COPY_BUFFER_SIZE.getInt(info);
        if (copyBufferSize <= 0) {
            throw new PSQLException(GT.tr("{0} parameter value must be positive but was: {1}",
                    SessionProperty.COPY_BUFFER_SIZE.getName(), String.valueOf(copyBufferSize)),
                    ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
        }
        this.charset = lookupCharset(SessionProperty.CLIENT_ENCODING.get(info));
        this.defaultCastTable = defaultCastTable;

        this.transactionManager = new TransactionManager(this);
        this.queryExecutor = new QueryExecutorImpl(this, new ResultFetcher());
        this.copyStreamer = protocolVersion >= 3 ? new V3CopyStreamer() : new V2CopyStreamer();
        wire.setNoticeListener(this::noticeReceived);

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("session opened, protocol " + protocolVersion + ", isolation level "
                    + isolationLevel + ", encoding " + charset.name());
        }
    }

    private static Charset lookupCharset(String name) throws PSQLException {
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            throw new PSQLException(GT.tr("Unsupported client encoding: {0}", name),
                    ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE, e);
        }
    }

    public PgCursor cursor() throws SQLException {
        checkClosed();
        return new PgCursor(this);
    }

    public void commit() throws SQLException {
        checkClosed();
        checkCritical(false);
        transactionManager.commit();
    }

    public void rollback() throws SQLException {
        checkClosed();
        checkCritical(false);
        transactionManager.rollback();
    }

    /**
     * Aborts any open transaction and returns the session to its initial state, including the
     * isolation level it was opened with.
     */
    public void reset() throws SQLException {
        checkClosed();
        checkCritical(false);
        transactionManager.reset();
        isolationLevel = defaultIsolationLevel;
        tpcXid = null;
    }

    /**
     * Changes the isolation level used by the following transactions. An open transaction is
     * rolled back first.
     */
    public void setIsolationLevel(IsolationLevel level) throws SQLException {
        checkClosed();
        checkCritical(false);
        CommandResult outcome;
        guard.lock();
        try {
            transactionManager.checkNoAsyncLocked("setIsolationLevel");
            outcome = transactionManager.abortLocked();
            if (outcome.isOk()) {
                isolationLevel = level;
            }
        } finally {
            guard.unlock();
        }
        processNotices();
        if (!outcome.isOk()) {
            throw ErrorReporter.fromCommand(this, outcome);
        }
    }

    public void setIsolationLevel(int level) throws SQLException {
        setIsolationLevel(IsolationLevel.fromValue(level));
    }

    public boolean isBusy() throws SQLException {
        checkClosed();
        return queryExecutor.isBusy();
    }

    public int flush() throws SQLException {
        checkClosed();
        return queryExecutor.flush();
    }

    public void setNonBlocking(boolean nonBlocking) throws SQLException {
        checkClosed();
        queryExecutor.setNonBlocking(nonBlocking);
    }

    public boolean isNonBlocking() throws SQLException {
        checkClosed();
        guard.lock();
        try {
            return wire.isNonBlocking();
        } finally {
            guard.unlock();
        }
    }

    /**
     * Discards the results of the outstanding asynchronous statement.
     */
    public void clearAsync() throws SQLException {
        checkClosed();
        queryExecutor.clearAsync();
    }

    @Override
    public PollStatus pollLocked() throws SQLException {
        return queryExecutor.pollLocked();
    }

    public void setWaitCallback(WaitCallback waitCallback) {
        this.waitCallback = waitCallback;
    }

    @Override
    public WaitCallback getWaitCallback() {
        return waitCallback;
    }

    //
    // Two-phase commit
    //

    public PgXid xid(int formatId, String gtrid, String bqual) throws SQLException {
        checkClosed();
        return new PgXid(formatId, gtrid, bqual);
    }

    /**
     * Opens a two-phase transaction. The BEGIN is sent right away.
     */
    public void tpcBegin(PgXid xid) throws SQLException {
        checkClosed();
        checkCritical(false);
        if (isolationLevel.isAutocommit()) {
            throw programming(GT.tr("tpcBegin can''t be called in autocommit mode"));
        }
        if (transactionStatus != TransactionStatus.READY) {
            throw programming(GT.tr("tpcBegin must be called outside a transaction"));
        }
        transactionManager.begin();
        tpcXid = xid;
    }

    public void tpcBegin(String transactionId) throws SQLException {
        tpcBegin(PgXid.unparsed(transactionId));
    }

    public void tpcPrepare() throws SQLException {
        checkClosed();
        checkCritical(false);
        if (tpcXid == null) {
            throw programming(GT.tr("tpcPrepare must be called in a two-phase transaction"));
        }
        if (transactionStatus != TransactionStatus.BEGIN) {
            throw programming(GT.tr("tpcPrepare must be called in a transaction not yet prepared"));
        }
        transactionManager.tpcPrepare(tpcXid.toString());
    }

    /**
     * Commits the current two-phase transaction: in one phase if it was not prepared, with
     * COMMIT PREPARED otherwise.
     */
    public void tpcCommit() throws SQLException {
        tpcFinish(true, null);
    }

    /**
     * Commits a prepared transaction, typically one returned by {@link #tpcRecover()}.
     */
    public void tpcCommit(PgXid xid) throws SQLException {
        tpcFinish(true, xid);
    }

    public void tpcRollback() throws SQLException {
        tpcFinish(false, null);
    }

    public void tpcRollback(PgXid xid) throws SQLException {
        tpcFinish(false, xid);
    }

    private void tpcFinish(boolean commit, PgXid xid) throws SQLException {
        checkClosed();
        checkCritical(false);
        String method = commit ? "tpcCommit" : "tpcRollback";
        if (xid != null) {
            if (transactionStatus != TransactionStatus.READY) {
                throw programming(GT.tr("{0} with a xid must be called outside a transaction", method));
            }
            transactionManager.tpcFinish(commit, xid.toString());
            return;
        }

        PgXid current = tpcXid;
        if (current == null) {
            throw programming(GT.tr("{0} with no parameter must be called in a two-phase transaction", method));
        }
        switch (transactionStatus) {
            case BEGIN:
                if (commit) {
                    transactionManager.commit();
                } else {
                    transactionManager.rollback();
                }
                break;
            case PREPARED:
                transactionManager.tpcFinish(commit, current.toString());
                break;
            default:
                throw new PSQLException(GT.tr("unexpected transaction status: {0}", transactionStatus),
                        ErrorKind.INTERNAL, PSQLState.INVALID_TRANSACTION_STATE);
        }
        tpcXid = null;
    }

    /**
     * Lists the transactions prepared on the backend. A transaction opened to run the query is
     * rolled back if the connection was not in one already.
     */
    public List<PgXid> tpcRecover() throws SQLException {
        checkClosed();
        TransactionStatus previous = transactionStatus;
        List<PgXid> xids = new ArrayList<PgXid>();
        PgCursor cursor = cursor();
        try {
            cursor.execute("SELECT gid, prepared, owner, database FROM pg_prepared_xacts");
            for (Object[] row : cursor.fetchAll()) {
                xids.add(PgXid.fromString(String.valueOf(row[0]))
                        .withRecoveryInfo(asString(row[1]), asString(row[2]), asString(row[3])));
            }
        } catch (SQLException e) {
            if (openedBy(previous)) {
                try {
                    rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
            }
            throw e;
        } finally {
            cursor.close();
        }
        if (openedBy(previous)) {
            rollback();
        }
        return xids;
    }

    private boolean openedBy(TransactionStatus previous) {
        return previous == TransactionStatus.READY && transactionStatus == TransactionStatus.BEGIN
                && closed == OPEN;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    /**
     * @return the two-phase transaction in progress, or null
     */
    public PgXid getTpcXid() {
        return tpcXid;
    }

    //
    // Notices and notifications
    //

    private void noticeReceived(String message) {
        if (protocolVersion < 3 && message.startsWith("ERROR")) {
            // the legacy protocol reports COPY failures this way
            setCritical(message);
            return;
        }
        synchronized (pendingNotices) {
            pendingNotices.add(message);
        }
    }

    @Override
    public void processNotices() {
        List<String> received;
        synchronized (pendingNotices) {
            if (pendingNotices.isEmpty()) {
                return;
            }
            received = new ArrayList<String>(pendingNotices);
            pendingNotices.clear();
        }
        synchronized (notices) {
            for (String notice : received) {
                notices.add(notice);
                if (notices.size() > MAX_NOTICES) {
                    notices.removeFirst();
                }
            }
        }
    }

    @Override
    public void processNotifies() throws SQLException {
        if (closed != OPEN) {
            return;
        }
        guard.lock();
        try {
            Notification notification;
            while ((notification = wire.getNotification()) != null) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("received " + notification);
                }
                synchronized (notifies) {
                    notifies.add(notification);
                }
            }
        } finally {
            guard.unlock();
        }
    }

    /**
     * @return the last notices sent by the backend, oldest first
     */
    public List<String> getNotices() {
        synchronized (notices) {
            return new ArrayList<String>(notices);
        }
    }

    public List<Notification> getNotifies() {
        synchronized (notifies) {
            return new ArrayList<Notification>(notifies);
        }
    }

    //
    // Critical errors
    //

    @Override
    public ConnectionHealth getHealth() {
        return health;
    }

    @Override
    public void setCritical(String message) {
        if (message == null || message.isEmpty()) {
            return;
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("connection marked critical: " + message.trim());
        }
        health = ConnectionHealth.poisoned(message);
    }

    @Override
    public PSQLException resolveCritical(boolean close) {
        ConnectionHealth current = health;
        if (!current.isPoisoned()) {
            return null;
        }
        String message = current.getMessage();
        PSQLException error = new PSQLException(ErrorClassifier.stripSeverity(message),
                ErrorKind.OPERATIONAL, message, null);
        health = ConnectionHealth.HEALTHY;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("resolving critical condition" + (close ? " and closing" : "") + ": " + message.trim());
        }
        if (close) {
            try {
                close();
            } catch (SQLException e) {
                error.addSuppressed(e);
            }
        }
        return error;
    }

    @Override
    public void checkCritical(boolean close) throws PSQLException {
        PSQLException error = resolveCritical(close);
        if (error != null) {
            throw error;
        }
    }

    //
    // Lifecycle
    //

    /**
     * Drops the outstanding asynchronous statement and closes the wire client. Closing a closed
     * connection does nothing.
     */
    @Override
    public void close() throws SQLException {
        if (closed == CLOSED) {
            return;
        }
        guard.lock();
        try {
            if (asyncCursor != null) {
                queryExecutor.clearAsyncLocked();
            }
            wire.close();
            closed = CLOSED;
        } finally {
            guard.unlock();
        }
        LOGGER.debug("session closed");
    }

    public boolean isClosed() {
        return closed != OPEN;
    }

    void checkClosed() throws PSQLException {
        if (closed != OPEN) {
            throw new PSQLException(GT.tr("connection already closed"),
                    ErrorKind.PROGRAMMING, PSQLState.CONNECTION_DOES_NOT_EXIST);
        }
    }

    private static PSQLException programming(String message) {
        return new PSQLException(message, ErrorKind.PROGRAMMING, PSQLState.OBJECT_NOT_IN_STATE);
    }

    //
    // Cast overrides
    //

    /**
     * Registers a cast used by every cursor of this connection for columns of type {@code oid},
     * unless the cursor overrides it.
     */
    public void registerCast(int oid, CastFunction cast) {
        castTable = castTable.with(oid, cast);
    }

    public void setCastTable(TypeCastTable castTable) {
        this.castTable = castTable == null ? TypeCastTable.empty() : castTable;
    }

    @Override
    public TypeCastTable getCastTable() {
        return castTable;
    }

    @Override
    public TypeCastTable getDefaultCastTable() {
        return defaultCastTable;
    }

    //
    // Engine state
    //

    @Override
    public WireClient getWireClient() {
        return wire;
    }

    @Override
    public ConnectionGuard getGuard() {
        return guard;
    }

    @Override
    public int getProtocolVersion() {
        return protocolVersion;
    }

    @Override
    public TransactionStatus getTransactionStatus() {
        return transactionStatus;
    }

    @Override
    public void setTransactionStatus(TransactionStatus status) {
        this.transactionStatus = status;
    }

    @Override
    public IsolationLevel getIsolationLevel() {
        return isolationLevel;
    }

    @Override
    public long getMark() {
        return mark.get();
    }

    @Override
    public void incrementMark() {
        mark.incrementAndGet();
    }

    @Override
    public int getClosed() {
        return closed;
    }

    @Override
    public void setClosed(int closed) {
        this.closed = closed;
    }

    @Override
    public BaseCursor getAsyncCursor() {
        return asyncCursor;
    }

    @Override
    public void setAsyncCursor(BaseCursor cursor) {
        this.asyncCursor = cursor;
    }

    @Override
    public AsyncStatus getAsyncStatus() {
        return asyncStatus;
    }

    @Override
    public void setAsyncStatus(AsyncStatus status) {
        if (LOGGER.isDebugEnabled() && asyncStatus != status) {
            LOGGER.debug("async status " + asyncStatus + " -> " + status);
        }
        this.asyncStatus = status;
    }

    @Override
    public TransactionManager getTransactionManager() {
        return transactionManager;
    }

    @Override
    public QueryExecutor getQueryExecutor() {
        return queryExecutor;
    }

    @Override
    public CopyStreamer getCopyStreamer() {
        return copyStreamer;
    }

    @Override
    public boolean isExtendedErrors() {
        return extendedErrors;
    }

    @Override
    public boolean isDisplaySize() {
        return displaySize;
    }

    @Override
    public Charset getCharset() {
        return charset;
    }

    public int getCopyBufferSize() {
        return copyBufferSize;
    }
}
