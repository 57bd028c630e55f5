/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * An asynchronous notification delivered by LISTEN/NOTIFY.
 */
public class Notification {
    private final String name;
    private final int pid;
    private final String parameter;

    public Notification(String name, int pid) {
        this(name, pid, "");
    }

    public Notification(String name, int pid, String parameter) {
        this.name = name;
        this.pid = pid;
        this.parameter = parameter;
    }

    public String getName() {
        return name;
    }

    /**
     * @return process id of the backend that sent the notification
     */
    public int getPID() {
        return pid;
    }

    public String getParameter() {
        return parameter;
    }

    @Override
    public String toString() {
        return "Notification(" + pid + ", " + name + ", " + parameter + ")";
    }
}
