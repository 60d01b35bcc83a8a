package me.flobot.bot.port.inbound;

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

import me.flobot.bot.domain.loop.EventChannel;

/**
 * Port for the backend connection producing events. The source is the only
 * producer of its channel and closes it when the connection goes away.
 */
public interface EventSourcePort {

    /**
     * Connect and start pushing decoded events into {@code channel}.
     */
    void start(EventChannel channel);

    /**
     * Disconnect from the backend.
     */
    void stop();

    boolean isRunning();
}
