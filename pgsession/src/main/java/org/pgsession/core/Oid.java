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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Provides constants for well-known backend OIDs for the types the default casts handle.
 */
public class Oid {
    private static final Log LOGGER = Logger.getLogger(Oid.class);

    public static final int UNSPECIFIED = 0;
    public static final int BOOL = 16;
    public static final int BYTEA = 17;

    /**
     * This is not char(N), this is "char" a single byte type.
     */
    public static final int CHAR = 18;
    public static final int NAME = 19;
    public static final int INT8 = 20;
    public static final int INT2 = 21;
    public static final int INT4 = 23;
    public static final int TEXT = 25;
    public static final int OID = 26;
    public static final int XML = 142;
    public static final int JSON = 114;
    public static final int FLOAT4 = 700;
    public static final int FLOAT8 = 701;
    public static final int UNKNOWN = 705;
    public static final int MONEY = 790;
    public static final int BPCHAR = 1042;
    public static final int VARCHAR = 1043;
    public static final int DATE = 1082;
    public static final int TIME = 1083;
    public static final int TIMESTAMP = 1114;
    public static final int TIMESTAMPTZ = 1184;
    public static final int INTERVAL = 1186;
    public static final int TIMETZ = 1266;
    public static final int NUMERIC = 1700;
    public static final int UUID = 2950;
    public static final int JSONB = 3802;

    private static final Map<Integer, String> OID_TO_NAME = new HashMap<Integer, String>(40);
    private static final Map<String, Integer> NAME_TO_OID = new HashMap<String, Integer>(40);

    static {
        for (java.lang.reflect.Field field : Oid.class.getFields()) {
            try {
                int oid = field.getInt(null);
                String name = field.getName().toUpperCase(Locale.ROOT);
                OID_TO_NAME.put(oid, name);
                NAME_TO_OID.put(name, oid);
            } catch (IllegalAccessException e) {
                LOGGER.warn("Could not read oid constant " + field.getName(), e);
            }
        }
    }

    private Oid() {
    }

    /**
     * Returns the name of the oid as string.
     *
     * @param oid The oid to convert to name.
     * @return The name of the oid or {@code "<unknown:oid>"} if no constant for oid value has
     *         been defined.
     */
    public static String toString(int oid) {
        String name = OID_TO_NAME.get(oid);
        if (name == null) {
            name = "<unknown:" + oid + ">";
        }
        return name;
    }

    public static int valueOf(String oid) throws PSQLException {
        if (oid.length() > 0 && !Character.isDigit(oid.charAt(0))) {
            Integer id = NAME_TO_OID.get(oid);
            if (id == null) {
                id = NAME_TO_OID.get(oid.toUpperCase(Locale.ROOT));
            }
            if (id != null) {
                return id;
            }
        } else {
            try {
                // OID are unsigned 32bit integers, so Integer.parseInt is not enough
                return (int) Long.parseLong(oid);
            } catch (NumberFormatException ex) {
                throw new PSQLException(GT.tr("oid type {0} not known and not a number", oid),
                        ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE, ex);
            }
        }
        throw new PSQLException(GT.tr("oid type {0} not known and not a number", oid),
                ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
    }
}
