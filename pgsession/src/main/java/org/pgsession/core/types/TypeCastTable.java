/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core.types;

import org.pgsession.core.Oid;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable mapping from backend type OID to {@link CastFunction}.
 *
 * <p>Three tables are consulted when a tabular result is fetched: the cursor's, the connection's
 * and the default one given to the connection at construction.</p>
 */
public final class TypeCastTable {
    private static final TypeCastTable EMPTY = new TypeCastTable(Collections.<Integer, CastFunction>emptyMap());

    private final Map<Integer, CastFunction> casts;

    private TypeCastTable(Map<Integer, CastFunction> casts) {
        this.casts = casts;
    }

    public static TypeCastTable empty() {
        return EMPTY;
    }

    /**
     * @return the table binding the well-known OIDs to the {@link BasicCasts}
     */
    public static TypeCastTable defaults() {
        return builder()
                .put(Oid.INT2, BasicCasts.INTEGER)
                .put(Oid.INT4, BasicCasts.INTEGER)
                .put(Oid.INT8, BasicCasts.LONGINTEGER)
                .put(Oid.OID, BasicCasts.LONGINTEGER)
                .put(Oid.FLOAT4, BasicCasts.FLOAT)
                .put(Oid.FLOAT8, BasicCasts.FLOAT)
                .put(Oid.NUMERIC, BasicCasts.DECIMAL)
                .put(Oid.BOOL, BasicCasts.BOOLEAN)
                .put(Oid.BYTEA, BasicCasts.BINARY)
                .put(Oid.TEXT, BasicCasts.STRING)
                .put(Oid.VARCHAR, BasicCasts.STRING)
                .put(Oid.BPCHAR, BasicCasts.STRING)
                .put(Oid.CHAR, BasicCasts.STRING)
                .put(Oid.NAME, BasicCasts.STRING)
                .put(Oid.UNKNOWN, BasicCasts.STRING)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the cast registered for {@code oid}, or null
     */
    public CastFunction get(int oid) {
        return casts.get(oid);
    }

    /**
     * @return a copy of this table with {@code cast} registered for {@code oid}
     */
    public TypeCastTable with(int oid, CastFunction cast) {
        return builder().putAll(this).put(oid, cast).build();
    }

    public int size() {
        return casts.size();
    }

    public boolean isEmpty() {
        return casts.isEmpty();
    }

    public static final class Builder {
        private final Map<Integer, CastFunction> casts = new HashMap<Integer, CastFunction>();

        private Builder() {
        }

        public Builder put(int oid, CastFunction cast) {
            if (cast == null) {
                throw new IllegalArgumentException("cast must not be null");
            }
            casts.put(oid, cast);
            return this;
        }

        public Builder putAll(TypeCastTable table) {
            casts.putAll(table.casts);
            return this;
        }

        public TypeCastTable build() {
            return new TypeCastTable(Collections.unmodifiableMap(new HashMap<Integer, CastFunction>(casts)));
        }
    }
}
