/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.util;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Wrapper around a message catalog providing localized versions of error messages. Messages use
 * {@link MessageFormat} syntax; when no translation is installed the original text is formatted.
 */
public class GT {
    private static final GT INSTANCE = new GT();
    private static final Object[] NO_ARGS = new Object[0];

    private final ResourceBundle bundle;

    private GT() {
        ResourceBundle found;
        try {
            found = ResourceBundle.getBundle("org.pgsession.translation.messages");
        } catch (MissingResourceException mre) {
            found = null;
        }
        bundle = found;
    }

    public static String tr(String message, Object... args) {
        return INSTANCE.translate(message, args);
    }

    private String translate(String message, Object[] args) {
        if (message == null) {
            return null;
        }
        String pattern = message;
        if (bundle != null && bundle.containsKey(message)) {
            pattern = bundle.getString(message);
        }
        return MessageFormat.format(pattern, args == null ? NO_ARGS : args);
    }
}
