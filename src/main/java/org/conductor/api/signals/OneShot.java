package org.conductor.api.signals;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * A single-slot handoff channel that carries exactly one value across threads.
 * <p>
 * The first {@link #offer(Object)} wins; every later write is rejected and reported through the
 * return value instead of blocking or throwing. Readers block until the value is present and may
 * read it any number of times afterwards.
 *
 * @param <T> The type of the carried value.
 */
public final class OneShot<T> {

    private final CompletableFuture<T> slot = new CompletableFuture<>();

    /**
     * Writes the value if the slot is still empty.
     *
     * @param value The value to hand off, must not be null.
     * @return true if this call filled the slot, false if it had already been written.
     */
    public boolean offer(final T value) {
        Objects.requireNonNull(value, "value");
        return slot.complete(value);
    }

    /**
     * Blocks until the slot has been written.
     *
     * @return The value.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public T take() throws InterruptedException {
        try {
            return slot.get();
        } catch (final ExecutionException e) {
            throw new IllegalStateException("One-shot slot completed exceptionally", e.getCause());
        }
    }

    /**
     * Blocks until the slot has been written or the timeout elapses.
     *
     * @param timeout The maximum time to wait.
     * @return The value, or empty if the timeout elapsed first.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public Optional<T> poll(final Duration timeout) throws InterruptedException {
        try {
            return Optional.of(slot.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (final TimeoutException e) {
            return Optional.empty();
        } catch (final ExecutionException e) {
            throw new IllegalStateException("One-shot slot completed exceptionally", e.getCause());
        }
    }

    /**
     * Returns the value without blocking.
     *
     * @return The value, or empty if nothing has been written yet.
     */
    public Optional<T> peek() {
        return Optional.ofNullable(slot.getNow(null));
    }

    public boolean isSet() {
        return slot.isDone();
    }

    /**
     * Registers a callback that receives the value once it is written. If the slot is already
     * filled, the callback runs immediately on the calling thread; otherwise it runs on the thread
     * that performs the write.
     *
     * @param consumer The callback.
     */
    public void onValue(final Consumer<? super T> consumer) {
        slot.thenAccept(consumer);
    }

    @Override
    public String toString() {
        return isSet() ? "OneShot[" + slot.getNow(null) + "]" : "OneShot[empty]";
    }
}
