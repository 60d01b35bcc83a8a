package me.flobot.bot.domain.model;

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

/**
 * A decoded unit of activity coming from the chat backend.
 *
 * <p>
 * Events are produced by the backend adapter, pushed into the
 * {@link me.flobot.bot.domain.loop.EventChannel} and consumed exactly once by
 * the {@link me.flobot.bot.domain.loop.Instance}. All variants are immutable.
 *
 * <ul>
 * <li>{@link Hello} - the backend greets the bot, carrying the bot's own user
 * id</li>
 * <li>{@link Posted} - a new chat message</li>
 * <li>{@link Edited} - an edited chat message</li>
 * <li>{@link StatusReceived} - protocol-level status reply</li>
 * <li>{@link Unsupported} - anything the adapter could not map</li>
 * <li>{@link Shutdown} - asks the event loop to return</li>
 * </ul>
 */
public interface Event {

    static Event shutdown() {
        return Shutdown.INSTANCE;
    }

    record Hello(String serverString, String myUserId) implements Event {
    }

    record Posted(Post post) implements Event {
    }

    record Edited(PostEdited post) implements Event {
    }

    record StatusReceived(Status status) implements Event {
    }

    record Unsupported(String raw) implements Event {
    }

    final class Shutdown implements Event {

        static final Shutdown INSTANCE = new Shutdown();

        private Shutdown() {
        }

        @Override
        public String toString() {
            return "Shutdown";
        }
    }
}
