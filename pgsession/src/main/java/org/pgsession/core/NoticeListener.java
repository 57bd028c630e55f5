/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * Receives backend notices as they are read off the wire. Called by the wire client, possibly
 * while the connection guard is held, so implementations must not touch the wire.
 */
public interface NoticeListener {
    void noticeReceived(String message);
}
