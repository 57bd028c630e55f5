/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

import org.pgsession.util.PSQLException;

/**
 * Outcome of a {@link CopyStreamer} call.
 */
public final class CopyResult {
    private static final CopyResult OK = new CopyResult(null);

    private final PSQLException error;

    private CopyResult(PSQLException error) {
        this.error = error;
    }

    public static CopyResult ok() {
        return OK;
    }

    public static CopyResult failed(PSQLException error) {
        return new CopyResult(error);
    }

    public boolean isOk() {
        return error == null;
    }

    public PSQLException getError() {
        return error;
    }
}
