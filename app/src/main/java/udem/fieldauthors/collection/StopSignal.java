package udem.fieldauthors.collection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request. Set once from outside (a shutdown hook, a test),
 * polled by the collector between pages.
 */
public final class StopSignal {
    private final AtomicBoolean requested = new AtomicBoolean(false);

    /**
     * @return true only for the call that actually flipped the flag
     */
    public boolean request() {
        return requested.compareAndSet(false, true);
    }

    public boolean isRequested() {
        return requested.get();
    }
}
