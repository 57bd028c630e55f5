/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.util;

/**
 * Maps backend errors to an {@link ErrorKind}.
 *
 * <p>When the backend reports a SQLSTATE (protocol 3) the kind is chosen from the code class, see
 * <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">the error code
 * appendix</a>. Older backends only send text, which is matched against known phrasings.</p>
 *
 * <p>With {@code extended} disabled, the rollback and cancel kinds degrade to
 * {@link ErrorKind#OPERATIONAL}.</p>
 */
public final class ErrorClassifier {
    private static final String[] SEVERITY_PREFIXES = {"ERROR:  ", "FATAL:  ", "PANIC:  "};
    private static final String QUERY_CANCELED = "57014";

    private ErrorClassifier() {
    }

    public static ErrorKind fromSqlState(String sqlState, boolean extended) {
        if (sqlState == null || sqlState.length() < 2) {
            return ErrorKind.DATABASE;
        }
        char cls = sqlState.charAt(0);
        char sub = sqlState.charAt(1);
        switch (cls) {
            case '0':
                // 0A feature not supported
                return sub == 'A' ? ErrorKind.NOT_SUPPORTED : ErrorKind.DATABASE;
            case '2':
                return fromClass2(sub);
            case '3':
                return fromClass3(sub);
            case '4':
                if (sub == '0') {
                    return extended ? ErrorKind.TRANSACTION_ROLLBACK : ErrorKind.OPERATIONAL;
                }
                // 42 syntax error or access rule violation, 44 WITH CHECK OPTION violation
                if (sub == '2' || sub == '4') {
                    return ErrorKind.PROGRAMMING;
                }
                return ErrorKind.DATABASE;
            case '5':
                // 53 resources, 54 limits, 55 object state, 57 operator intervention, 58 system
                if (extended && QUERY_CANCELED.equals(sqlState)) {
                    return ErrorKind.QUERY_CANCELED;
                }
                return ErrorKind.OPERATIONAL;
            case 'F':
            case 'P':
            case 'X':
                return ErrorKind.INTERNAL;
            default:
                return ErrorKind.DATABASE;
        }
    }

    private static ErrorKind fromClass2(char sub) {
        switch (sub) {
            case '1':
                return ErrorKind.PROGRAMMING;
            case '2':
                return ErrorKind.DATA;
            case '3':
                return ErrorKind.INTEGRITY;
            case '4':
            case '5':
            case 'B':
            case 'D':
            case 'F':
                return ErrorKind.INTERNAL;
            case '6':
            case '7':
            case '8':
                return ErrorKind.OPERATIONAL;
            default:
                return ErrorKind.DATABASE;
        }
    }

    private static ErrorKind fromClass3(char sub) {
        switch (sub) {
            case '4':
                return ErrorKind.OPERATIONAL;
            case '8':
            case '9':
            case 'B':
                return ErrorKind.INTERNAL;
            case 'D':
            case 'F':
                return ErrorKind.PROGRAMMING;
            default:
                return ErrorKind.DATABASE;
        }
    }

    /**
     * Classifies an error from its text alone, for backends that send no SQLSTATE.
     */
    public static ErrorKind fromMessage(String message, boolean extended) {
        if (message == null) {
            return ErrorKind.PROGRAMMING;
        }
        if (message.startsWith("ERROR:  Cannot insert a duplicate key")
                || message.startsWith("ERROR:  ExecAppend: Fail to add null")
                || message.contains("referential integrity violation")) {
            return ErrorKind.INTEGRITY;
        }
        if (message.contains("could not serialize") || message.contains("deadlock detected")) {
            return extended ? ErrorKind.TRANSACTION_ROLLBACK : ErrorKind.OPERATIONAL;
        }
        return ErrorKind.PROGRAMMING;
    }

    public static ErrorKind classify(String message, String sqlState, boolean extended) {
        if (sqlState != null) {
            return fromSqlState(sqlState, extended);
        }
        return fromMessage(message, extended);
    }

    /**
     * Removes the leading {@code "ERROR:  "}, {@code "FATAL:  "} or {@code "PANIC:  "} token.
     */
    public static String stripSeverity(String message) {
        if (message == null) {
            return null;
        }
        if (message.length() > 8) {
            for (String prefix : SEVERITY_PREFIXES) {
                if (message.startsWith(prefix)) {
                    return message.substring(prefix.length());
                }
            }
        }
        return message;
    }

    public static PSQLException toException(String message, String sqlState, boolean extended) {
        ErrorKind kind = classify(message, sqlState, extended);
        return new PSQLException(stripSeverity(message), kind, message, sqlState);
    }
}
