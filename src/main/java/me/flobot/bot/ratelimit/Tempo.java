package me.flobot.bot.ratelimit;

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

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Expiring key presence store used for anti-spam windows.
 *
 * <p>
 * Each key maps to the instant it expires at. A key is present while that
 * instant is strictly in the future. There is no self-cleaning: an expired key
 * is only removed when it is looked up again, so the store is meant for small
 * key spaces (per channel, per channel and trigger), not general caching.
 *
 * <p>
 * Every call takes the same exclusive lock. Handles returned by
 * {@link #shared()} are backed by the same map and lock, so a key set through
 * one handle is immediately visible through all of them, from any thread.
 *
 * <pre>
 * Tempo&lt;String&gt; tempo = new Tempo&lt;&gt;(clock);
 * tempo.set("try", Duration.ofSeconds(1));
 * tempo.exists("try"); // true
 *
 * Tempo&lt;String&gt; other = tempo.shared(); // hand this one to another component
 * tempo.set("cloned", Duration.ofSeconds(1));
 * other.exists("cloned"); // true
 * </pre>
 *
 * @param <K>
 *            key type, must implement {@code equals}/{@code hashCode}
 * @since 1.0
 */
public class Tempo<K> {

    private final Map<K, Instant> store;
    private final Clock clock;

    public Tempo(Clock clock) {
        this(new HashMap<>(), clock);
    }

    private Tempo(Map<K, Instant> store, Clock clock) {
        this.store = store;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Insert or overwrite {@code key}, expiring {@code ttl} from now. An expiry
     * past {@link Instant#MAX} is capped there.
     */
    public void set(K key, Duration ttl) {
        Instant expiresAt = expiry(clock.instant(), ttl);
        synchronized (store) {
            store.put(key, expiresAt);
        }
    }

    /**
     * Check whether {@code key} is present and not expired. An expired entry is
     * removed as a side effect.
     */
    public boolean exists(K key) {
        synchronized (store) {
            Instant expiresAt = store.get(key);
            if (expiresAt == null) {
                return false;
            }
            if (!expiresAt.isAfter(clock.instant())) {
                store.remove(key);
                return false;
            }
            return true;
        }
    }

    private static Instant expiry(Instant now, Duration ttl) {
        try {
            return now.plus(ttl);
        } catch (DateTimeException | ArithmeticException e) {
            return Instant.MAX;
        }
    }

    /**
     * Another handle on this store. Not a copy: both handles see the same keys.
     */
    public Tempo<K> shared() {
        return new Tempo<>(store, clock);
    }

    /**
     * Number of entries held, expired or not.
     */
    public int size() {
        synchronized (store) {
            return store.size();
        }
    }
}
