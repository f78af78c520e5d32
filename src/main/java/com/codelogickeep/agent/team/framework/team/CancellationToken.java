package com.codelogickeep.agent.team.framework.team;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal shared by a run, its participants and their in-flight backend calls.
 * Linked futures are cancelled as soon as {@link #cancel()} is called.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Future<?>> linked = new ArrayList<>();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        List<Future<?>> toCancel;
        synchronized (linked) {
            toCancel = new ArrayList<>(linked);
            linked.clear();
        }
        for (Future<?> future : toCancel) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Ties a pending operation to this token. A future linked after cancellation is cancelled immediately.
     */
    public <F extends Future<?>> F link(F future) {
        synchronized (linked) {
            linked.removeIf(Future::isDone);
            if (!cancelled.get()) {
                linked.add(future);
                return future;
            }
        }
        future.cancel(true);
        return future;
    }
}
