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

import java.util.Objects;

/**
 * Outcome of a {@link Middleware} stage: go on with an event, or stop here.
 */
public final class Continue {

    private static final Continue NO = new Continue(null);

    private final Event event;

    private Continue(Event event) {
        this.event = event;
    }

    public static Continue yes(Event event) {
        return new Continue(Objects.requireNonNull(event, "event"));
    }

    public static Continue no() {
        return NO;
    }

    public boolean isYes() {
        return event != null;
    }

    /**
     * The event to hand to the next stage. Only meaningful when {@link #isYes()}.
     */
    public Event getEvent() {
        if (event == null) {
            throw new IllegalStateException("Continue.no() carries no event");
        }
        return event;
    }

    @Override
    public String toString() {
        return isYes() ? "Continue.yes(" + event + ")" : "Continue.no()";
    }
}
