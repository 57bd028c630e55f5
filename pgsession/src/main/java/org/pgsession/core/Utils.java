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
 * Collection of utilities used by the protocol-level code.
 */
public class Utils {
    private Utils() {
    }

    /**
     * Escape the given literal {@code value} and append it to the string builder {@code sbuf}. If
     * {@code sbuf} is {@code null}, a new StringBuilder will be returned.
     *
     * @param sbuf the string builder to append to; or {@code null}
     * @param value the string value
     * @param standardConformingStrings if standard conforming strings should be used
     * @return the sbuf argument; or a new string builder for sbuf == null
     * @throws PSQLException if the string contains a {@code \0} character
     */
    public static StringBuilder escapeLiteral(StringBuilder sbuf, String value,
            boolean standardConformingStrings) throws PSQLException {
        if (sbuf == null) {
            sbuf = new StringBuilder(value.length() * 11 / 10); // Add 10% for escaping.
        }
        if (standardConformingStrings) {
            // With standard_conforming_strings on, escape only single-quotes.
            for (int i = 0; i < value.length(); ++i) {
                char ch = value.charAt(i);
                if (ch == '\0') {
                    throw new PSQLException(GT.tr("Zero bytes may not occur in string parameters."),
                            ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
                }
                if (ch == '\'') {
                    sbuf.append('\'');
                }
                sbuf.append(ch);
            }
        } else {
            // With standard_conforming_string off, escape backslashes and
            // single-quotes, but still escape single-quotes by doubling, to
            // make a valid literal in both modes.
            for (int i = 0; i < value.length(); ++i) {
                char ch = value.charAt(i);
                if (ch == '\0') {
                    throw new PSQLException(GT.tr("Zero bytes may not occur in string parameters."),
                            ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE);
                }
                if (ch == '\\' || ch == '\'') {
                    sbuf.append(ch);
                }
                sbuf.append(ch);
            }
        }
        return sbuf;
    }

    /**
     * Quotes {@code value} as a SQL string literal valid whatever the server's
     * {@code standard_conforming_strings} setting: values holding a backslash use the
     * {@code E''} syntax.
     */
    public static String quoteLiteral(String value) throws PSQLException {
        boolean backslash = value.indexOf('\\') >= 0;
        StringBuilder sbuf = new StringBuilder(value.length() + 4);
        if (backslash) {
            sbuf.append('E');
        }
        sbuf.append('\'');
        escapeLiteral(sbuf, value, !backslash);
        return sbuf.append('\'').toString();
    }

    /**
     * Shortens a statement for logging.
     */
    public static String abbreviate(String sql) {
        if (sql == null || sql.length() <= 200) {
            return sql;
        }
        return sql.substring(0, 200) + "...";
    }
}
