package me.flobot.bot.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.flobot.bot.domain.model.Event;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Unbounded queue carrying events from the backend adapter to the event loop.
 *
 * <p>
 * Any number of producers may {@link #send(Event)}; one consumer calls
 * {@link #receive(Duration)}. Closing the channel is how the producer side
 * says it is gone: events already queued are still delivered, then every
 * receive fails with {@link DisconnectedException}.
 */
public class EventChannel {

    private static final Object CLOSED = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Queue an event.
     *
     * @return {@code false} if the channel is closed and the event was dropped
     */
    public boolean send(Event event) {
        if (closed.get()) {
            return false;
        }
        return queue.offer(event);
    }

    /**
     * Close the producer side. Idempotent.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.offer(CLOSED);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Wait up to {@code timeout} for the next event.
     *
     * @return the event, or empty if none arrived in time
     * @throws DisconnectedException
     *             if the channel is closed and drained
     * @throws InterruptedException
     *             if the waiting thread is interrupted
     */
    public Optional<Event> receive(Duration timeout) throws DisconnectedException, InterruptedException {
        Object next = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (next == null) {
            return Optional.empty();
        }
        if (next == CLOSED) {
            // leave the marker for the next receive
            queue.offer(CLOSED);
            throw new DisconnectedException("receiving channel closed");
        }
        return Optional.of((Event) next);
    }

    public static class DisconnectedException extends Exception {

        private static final long serialVersionUID = 1L;

        public DisconnectedException(String message) {
            super(message);
        }
    }
}
