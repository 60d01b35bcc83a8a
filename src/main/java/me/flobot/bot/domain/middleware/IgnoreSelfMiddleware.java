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

import lombok.extern.slf4j.Slf4j;
import me.flobot.bot.domain.model.Event;

/**
 * Drops posts and edits authored by the bot itself, so that its own replies
 * never feed back into the handlers.
 *
 * <p>
 * The bot's user id is learned from the backend's {@link Event.Hello}. Until
 * a hello went through, nothing is dropped.
 */
@Slf4j
public class IgnoreSelfMiddleware implements Middleware {

    private volatile String myUserId;

    @Override
    public String getName() {
        return "ignore_self";
    }

    @Override
    public Continue process(Event event) {
        if (event instanceof Event.Hello hello) {
            myUserId = hello.myUserId();
            log.debug("[IgnoreSelf] bot user id: {}", myUserId);
            return Continue.yes(event);
        }

        String author = null;
        if (event instanceof Event.Posted posted) {
            author = posted.post().getUserId();
        } else if (event instanceof Event.Edited edited) {
            author = edited.post().getUserId();
        }

        if (author != null && myUserId != null && !myUserId.isEmpty() && myUserId.equals(author)) {
            return Continue.no();
        }
        return Continue.yes(event);
    }

    String getMyUserId() {
        return myUserId;
    }
}
