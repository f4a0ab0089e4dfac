package com.agentflow.engine.executor;

import com.agentflow.provider.CancellationSignal;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation flag of one execution. Fires once; registered callbacks run on the
 * cancelling thread, and callbacks registered afterwards run immediately.
 */
public class CancellationToken implements CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Fire the token. Returns false if it was already cancelled.
     */
    public boolean cancel() {
        synchronized (latch) {
            if (latch.getCount() == 0) {
                return false;
            }
            latch.countDown();
        }
        callbacks.forEach(Runnable::run);
        return true;
    }

    @Override
    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Sleep for the given delay, waking early on cancellation.
     *
     * @return true if cancelled before or during the wait
     */
    public boolean await(long delayMs) throws InterruptedException {
        if (delayMs <= 0) {
            return isCancelled();
        }
        return latch.await(delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Register a callback to run on cancellation.
     *
     * @return a handle that removes the callback
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
