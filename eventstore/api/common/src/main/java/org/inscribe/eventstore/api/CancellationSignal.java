/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.inscribe.eventstore.api;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Lets a caller abort an in-flight push from another thread. Cancelling aborts the statement that is currently executing
 * (if any) and makes the push roll back and throw a {@link PushCancelledException}.
 * <p>
 * A signal can only be cancelled once and is safe to share between threads.
 */
public final class CancellationSignal {
    private static final CancellationSignal NONE = new CancellationSignal();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * @return A signal that is never cancelled
     */
    public static CancellationSignal none() {
        return NONE;
    }

    private CancellationSignal() {
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("Cannot cancel the shared no-op signal");
        }
        if (cancelled.compareAndSet(false, true)) {
            listeners.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Run {@code listener} when this signal is cancelled. If the signal is already cancelled the listener is run
     * immediately.
     *
     * @param listener The action to run on cancellation
     * @return A {@link Registration} that removes the listener when closed
     */
    public Registration onCancel(Runnable listener) {
        requireNonNull(listener, "Listener cannot be null");
        if (this == NONE) {
            return () -> {
            };
        }
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
