package me.flobot.bot.infrastructure.config;

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
import me.flobot.bot.domain.handler.DebugHandler;
import me.flobot.bot.domain.handler.SynchronizedPostHandler;
import me.flobot.bot.domain.handler.TriggerHandler;
import me.flobot.bot.domain.loop.Instance;
import me.flobot.bot.domain.middleware.DebugMiddleware;
import me.flobot.bot.domain.middleware.IgnoreSelfMiddleware;
import me.flobot.bot.port.outbound.NotifierPort;
import me.flobot.bot.port.outbound.SenderPort;
import me.flobot.bot.port.outbound.TriggerPort;
import me.flobot.bot.ratelimit.Tempo;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Assembles the event loop. Registration order is the processing order:
 * middlewares first (ignore self, then optional event logging), then post
 * handlers (triggers, then optional post logging).
 */
@Configuration
@Slf4j
public class InstanceConfiguration {

    @Bean
    public Instance instance(BotProperties properties, SenderPort sender, NotifierPort notifier,
            TriggerPort triggerPort, Tempo<String> tempo) {
        BotProperties.TriggerProperties trigger = properties.getTrigger();
        BotProperties.DebugProperties debug = properties.getDebug();

        Instance instance = new Instance(sender, notifier, properties.getLoop().getPollTimeout());
        instance.addMiddleware(new IgnoreSelfMiddleware());
        if (debug.isLogEvents()) {
            instance.addMiddleware(new DebugMiddleware("events"));
        }

        instance.addPostHandler(SynchronizedPostHandler.wrap(new TriggerHandler(
                triggerPort, sender, tempo.shared(), trigger.getRepeatDelay(), trigger.getChannelRateLimit())));
        if (debug.isLogPosts()) {
            instance.addPostHandler(SynchronizedPostHandler.wrap(new DebugHandler("posts")));
        }

        log.debug("[Instance] assembled, events logging={}, posts logging={}",
                debug.isLogEvents(), debug.isLogPosts());
        return instance;
    }
}
