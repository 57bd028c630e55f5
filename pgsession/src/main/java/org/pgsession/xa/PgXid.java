/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.xa;

import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.transaction.xa.Xid;

/**
 * Identifier of a two-phase transaction.
 *
 * <p>The backend knows prepared transactions by a string id. An xid made of a format id, a global
 * transaction id and a branch qualifier is encoded as
 * {@code <formatId>_<base64(gtrid)>_<base64(bqual)>}. Ids found on the backend that were not
 * created this way are "unparsed": their format id and branch qualifier are null and the global
 * transaction id holds the raw string.</p>
 */
public class PgXid implements Xid {
    private static final Pattern ENCODED = Pattern.compile("^(\\d+)_([^_]*)_([^_]*)$");
    private static final int MAX_FORMAT_ID = 0x7fffffff;
    private static final int MAX_ID_LENGTH = 64;

    private final Integer formatId;
    private final String gtrid;
    private final String bqual;

    private String prepared;
    private String owner;
    private String database;

    public PgXid(int formatId, String gtrid, String bqual) throws PSQLException {
        if (formatId < 0 || formatId > MAX_FORMAT_ID) {
            throw invalid(GT.tr("format_id must be a non-negative 32-bit integer"));
        }
        checkId("gtrid", gtrid);
        checkId("bqual", bqual);
        this.formatId = formatId;
        this.gtrid = gtrid;
        this.bqual = bqual;
    }

    private PgXid(String transactionId) {
        this.formatId = null;
        this.gtrid = transactionId;
        this.bqual = null;
    }

    /**
     * Wraps a transaction id that is used verbatim on the backend.
     */
    public static PgXid unparsed(String transactionId) {
        return new PgXid(Objects.requireNonNull(transactionId, "transactionId"));
    }

    /**
     * Parses a backend transaction id, see the class comment.
     */
    public static PgXid fromString(String transactionId) {
        Matcher m = ENCODED.matcher(transactionId);
        if (m.matches() && m.group(2).length() % 4 == 0 && m.group(3).length() % 4 == 0) {
            try {
                int format = Integer.parseInt(m.group(1));
                Base64.Decoder decoder = Base64.getDecoder();
                String g = new String(decoder.decode(m.group(2)), StandardCharsets.UTF_8);
                String b = new String(decoder.decode(m.group(3)), StandardCharsets.UTF_8);
                return new PgXid(format, g, b);
            } catch (IllegalArgumentException | PSQLException e) {
                // not base64, or not a valid xid once decoded: an id of foreign origin
                return unparsed(transactionId);
            }
        }
        return unparsed(transactionId);
    }

    private static void checkId(String name, String value) throws PSQLException {
        if (value == null) {
            throw invalid(GT.tr("{0} must not be null", name));
        }
        if (value.length() > MAX_ID_LENGTH) {
            throw invalid(GT.tr("{0} must be a string no longer than 64 characters", name));
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 || c >= 0x7f) {
                throw invalid(GT.tr("{0} must contain only printable characters", name));
            }
        }
    }

    private static PSQLException invalid(String message) {
        return new PSQLException(message, ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
    }

    public boolean isParsed() {
        return formatId != null;
    }

    /**
     * @return the format id, or -1 for an unparsed id
     */
    @Override
    public int getFormatId() {
        return formatId == null ? -1 : formatId;
    }

    public Integer getFormatIdOrNull() {
        return formatId;
    }

    public String getGtrid() {
        return gtrid;
    }

    public String getBqual() {
        return bqual;
    }

    @Override
    public byte[] getGlobalTransactionId() {
        return gtrid.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] getBranchQualifier() {
        return bqual == null ? new byte[0] : bqual.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return when the transaction was prepared, as reported by recovery, or null
     */
    public String getPrepared() {
        return prepared;
    }

    public String getOwner() {
        return owner;
    }

    public String getDatabase() {
        return database;
    }

    /**
     * Attaches the information read from {@code pg_prepared_xacts}.
     */
    public PgXid withRecoveryInfo(String prepared, String owner, String database) {
        this.prepared = prepared;
        this.owner = owner;
        this.database = database;
        return this;
    }

    /**
     * @return the id the backend knows the transaction by
     */
    @Override
    public String toString() {
        if (formatId == null) {
            return gtrid;
        }
        Base64.Encoder encoder = Base64.getEncoder();
        return formatId + "_" + encoder.encodeToString(gtrid.getBytes(StandardCharsets.UTF_8))
                + "_" + encoder.encodeToString(bqual.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PgXid)) {
            return false;
        }
        PgXid other = (PgXid) o;
        return Objects.equals(formatId, other.formatId)
                && gtrid.equals(other.gtrid)
                && Objects.equals(bqual, other.bqual);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formatId, gtrid, bqual);
    }
}
