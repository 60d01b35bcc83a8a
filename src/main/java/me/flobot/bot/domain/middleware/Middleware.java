package me.flobot.bot.domain.middleware;

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

/**
 * A stage of the event chain, run before any post handler sees an event.
 *
 * <p>
 * Middleware run in registration order. Each one receives the event returned
 * by the previous stage and may pass it on unchanged, pass on a transformed
 * copy, or drop it. A dropped event is not seen by later middleware nor by any
 * handler. Throwing {@link MiddlewareException} aborts the event loop.
 *
 * @see me.flobot.bot.domain.loop.Instance
 */
public interface Middleware {

    /**
     * Name shown in the startup summary.
     */
    String getName();

    /**
     * Process the event.
     *
     * @return {@link Continue#yes(Event)} with the event to hand to the next
     *         stage, or {@link Continue#no()} to drop it
     */
    Continue process(Event event) throws MiddlewareException;
}
