package com.footballtransfers.domain.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-wide cancellation flag. Once cancelled, no new fetch is issued;
 * requests already in flight are left to complete or time out.
 */
public class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
