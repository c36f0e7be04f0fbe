package com.questrail.insights.client.http;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-flight gate: at most one call runs at a time, waiting callers are
 * admitted in arrival order.
 *
 * <p>The coordinator fans out many fetches at once; the gate turns that into
 * a queue at the transport so the controller never sees more than one request
 * from this client.</p>
 */
public final class RequestGate
{
    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T call(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        }
        finally {
            lock.unlock();
        }
    }

    /** Callers currently blocked waiting for the gate. */
    public int queueLength() {
        return lock.getQueueLength();
    }
}
