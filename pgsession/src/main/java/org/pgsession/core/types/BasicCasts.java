/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core.types;

import org.pgsession.core.BaseCursor;
import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;

/**
 * Casts for the text representation of the basic backend types.
 */
public enum BasicCasts implements CastFunction {
    INTEGER {
        @Override
        Object parse(byte[] value, BaseCursor cursor) {
            return Integer.valueOf(ascii(value));
        }
    },
    LONGINTEGER {
        @Override
        Object parse(byte[] value, BaseCursor cursor) {
            return Long.valueOf(ascii(value));
        }
    },
    FLOAT {
        @Override
        Object parse(byte[] value, BaseCursor cursor) {
            return Double.valueOf(ascii(value));
        }
    },
    DECIMAL {
        @Override
        Object parse(byte[] value, BaseCursor cursor) {
            String text = ascii(value);
            if ("NaN".equals(text)) {
                return Double.NaN;
            }
            return new BigDecimal(text);
        }
    },
    BOOLEAN {
        @Override
        Object parse(byte[] value, BaseCursor cursor) {
            return value.length > 0 && value[0] == 't';
        }
    },
    STRING {
        @Override
        Object parse(byte[] value, BaseCursor cursor) {
            return new String(value, cursor.getConnection().getCharset());
        }
    },
    BINARY {
        @Override
        Object parse(byte[] value, BaseCursor cursor) {
            return unescapeBytea(value);
        }
    };

    /**
     * @return the cast used for types no table knows about
     */
    public static CastFunction defaultCast() {
        return STRING;
    }

    abstract Object parse(byte[] value, BaseCursor cursor);

    @Override
    public String getName() {
        return name();
    }

    @Override
    public Object cast(byte[] value, BaseCursor cursor) throws SQLException {
        if (value == null) {
            return null;
        }
        try {
            return parse(value, cursor);
        } catch (NumberFormatException e) {
            throw new PSQLException(GT.tr("Bad value for type {0} : {1}", name(), ascii(value)),
                    ErrorKind.DATA, PSQLState.INVALID_TEXT_REPRESENTATION, e);
        }
    }

    private static String ascii(byte[] value) {
        return new String(value, StandardCharsets.US_ASCII);
    }

    static byte[] unescapeBytea(byte[] s) {
        if (s.length >= 2 && s[0] == '\\' && s[1] == 'x') {
            return unescapeByteaHex(s);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(s.length);
        for (int i = 0; i < s.length; ) {
            byte b = s[i];
            if (b == '\\' && i + 1 < s.length && s[i + 1] == '\\') {
                out.write('\\');
                i += 2;
            } else if (b == '\\' && i + 3 < s.length) {
                int octal = (s[i + 1] - '0') * 64 + (s[i + 2] - '0') * 8 + (s[i + 3] - '0');
                out.write(octal);
                i += 4;
            } else {
                out.write(b);
                i++;
            }
        }
        return out.toByteArray();
    }

    private static byte[] unescapeByteaHex(byte[] s) {
        byte[] output = new byte[(s.length - 2) / 2];
        for (int i = 0; i < output.length; i++) {
            byte b1 = gethex(s[2 + i * 2]);
            byte b2 = gethex(s[2 + i * 2 + 1]);
            output[i] = (byte) ((b1 << 4) | b2);
        }
        return output;
    }

    private static byte gethex(byte b) {
        // 0-9 == 48-57
        if (b <= 57) {
            return (byte) (b - 48);
        }
        // a-f == 97-102
        if (b >= 97) {
            return (byte) (b - 97 + 10);
        }
        // A-F == 65-70
        return (byte) (b - 65 + 10);
    }
}
