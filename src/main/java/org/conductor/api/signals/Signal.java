package org.conductor.api.signals;

import java.time.Duration;

/**
 * A payload-less one-shot notification. It can be fired once; firing again is a no-op.
 * Any number of threads may wait on it.
 */
public final class Signal {

    private final OneShot<Boolean> slot = new OneShot<>();

    /**
     * Fires the signal.
     *
     * @return true if this call fired it, false if it had already been fired.
     */
    public boolean fire() {
        return slot.offer(Boolean.TRUE);
    }

    public boolean isFired() {
        return slot.isSet();
    }

    /**
     * Blocks until the signal fires.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public void await() throws InterruptedException {
        slot.take();
    }

    /**
     * Blocks until the signal fires or the timeout elapses.
     *
     * @param timeout The maximum time to wait.
     * @return true if the signal fired within the timeout.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public boolean await(final Duration timeout) throws InterruptedException {
        return slot.poll(timeout).isPresent();
    }

    /**
     * Runs the action once the signal fires, immediately if it already has.
     *
     * @param action The action to run.
     */
    public void onFire(final Runnable action) {
        slot.onValue(ignored -> action.run());
    }

    @Override
    public String toString() {
        return isFired() ? "Signal[fired]" : "Signal[pending]";
    }
}
