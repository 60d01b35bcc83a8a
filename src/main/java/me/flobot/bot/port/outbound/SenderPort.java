package me.flobot.bot.port.outbound;

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
import me.flobot.bot.domain.model.Trigger;

import java.util.List;

/**
 * Port for actions visible to chat users. Calls are synchronous from the event
 * loop's point of view.
 */
public interface SenderPort {

    /**
     * Replies to {@code post} in its channel (and thread, if any).
     */
    void reply(Post post, String text) throws BackendException;

    /**
     * Adds the {@code emojiName} reaction to {@code post}.
     */
    void reaction(Post post, String emojiName) throws BackendException;

    /**
     * Replies to {@code post} with a rendering of the team's triggers.
     */
    void sendTriggerList(List<Trigger> triggers, Post post) throws BackendException;
}
