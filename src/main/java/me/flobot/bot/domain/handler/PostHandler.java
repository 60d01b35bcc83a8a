package me.flobot.bot.domain.handler;

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

import me.flobot.bot.domain.model.Post;

/**
 * An independently registered unit reacting to chat messages.
 *
 * <p>
 * Every handler receives every post that survived the middleware chain, in
 * registration order, whether or not an earlier handler acted on it. Handlers
 * must ignore the posts they don't recognize. A failing handler does not stop
 * the others: its error is reported to the debug channel.
 */
public interface PostHandler {

    /**
     * Name used by {@code !help <name>} and in the startup summary.
     */
    String getName();

    /**
     * Help text shown by {@code !help <name>}, or {@code null} to stay out of
     * the help listing.
     */
    default String getHelp() {
        return null;
    }

    void handle(Post post) throws HandlerException;
}
