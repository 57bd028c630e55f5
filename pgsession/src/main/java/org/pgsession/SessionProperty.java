/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession;

import org.pgsession.util.ErrorKind;
import org.pgsession.util.GT;
import org.pgsession.util.PSQLException;
import org.pgsession.util.PSQLState;

import java.util.Properties;

/**
 * All session parameters that can be passed when a connection is created.
 */
public enum SessionProperty {

    /**
     * Isolation level applied to the implicit transaction: {@code autocommit},
     * {@code read_committed} or {@code serializable}.
     */
    ISOLATION_LEVEL("isolationLevel", "read_committed",
            "Isolation level of the implicit transaction (autocommit, read_committed, serializable)",
            "autocommit", "read_committed", "serializable"),

    /**
     * Whether serialization failures and cancellations get their own error kinds.
     */
    EXTENDED_ERRORS("extendedErrors", "true",
            "Report transaction rollback and query cancel errors with dedicated kinds"),

    /**
     * Compute the display size of every column of a tabular result.
     */
    DISPLAY_SIZE("displaySize", "false",
            "Compute the per-column display size when a tabular result is fetched"),

    COPY_BUFFER_SIZE("copyBufferSize", "8192",
            "Default size of the chunks read from the source stream of a COPY FROM"),

    CLIENT_ENCODING("clientEncoding", "UTF-8",
            "Charset used to decode text values and legacy COPY lines"),

    /**
     * Logger backend, see {@link org.pgsession.log.Logger}.
     */
    LOGGER("logger", "JdkLogger",
            "Logger backend: JdkLogger, Slf4JLogger or the class name of a Log implementation");

    private final String name;
    private final String defaultValue;
    private final String description;
    private final String[] choices;

    SessionProperty(String name, String defaultValue, String description, String... choices) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.description = description;
        this.choices = choices.length == 0 ? null : choices;
    }

    public String getName() {
        return name;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the available values for this parameter or null
     */
    public String[] getChoices() {
        return choices;
    }

    /**
     * Returns the value of the parameter according to the given {@code Properties} or the default
     * value.
     *
     * @param properties properties to take actual value from
     * @return evaluated value for this parameter
     */
    public String get(Properties properties) {
        return properties.getProperty(name, defaultValue);
    }

    public void set(Properties properties, String value) {
        if (value == null) {
            properties.remove(name);
        } else {
            properties.setProperty(name, value);
        }
    }

    public void set(Properties properties, boolean value) {
        properties.setProperty(name, Boolean.toString(value));
    }

    public void set(Properties properties, int value) {
        properties.setProperty(name, Integer.toString(value));
    }

    public boolean getBoolean(Properties properties) {
        return Boolean.parseBoolean(get(properties));
    }

    /**
     * Return the int value for this parameter in the given {@code Properties}.
     *
     * @param properties properties to take actual value from
     * @return evaluated value for this parameter converted to int
     * @throws PSQLException if it cannot be converted to int
     */
    public int getInt(Properties properties) throws PSQLException {
        String value = get(properties);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException nfe) {
            throw new PSQLException(GT.tr("{0} parameter value must be an integer but was: {1}",
                    getName(), value), ErrorKind.PROGRAMMING, PSQLState.INVALID_PARAMETER_VALUE, nfe);
        }
    }

    public boolean isPresent(Properties properties) {
        return properties.getProperty(name) != null;
    }

    public static SessionProperty forName(String name) {
        for (SessionProperty property : SessionProperty.values()) {
            if (property.getName().equals(name)) {
                return property;
            }
        }
        return null;
    }
}
