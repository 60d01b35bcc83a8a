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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Bot configuration bound from {@code bot.*} properties. Built once at startup
 * and handed to the components that need it.
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private MattermostProperties mattermost = new MattermostProperties();
    private LoopProperties loop = new LoopProperties();
    private TriggerProperties trigger = new TriggerProperties();
    private DebugProperties debug = new DebugProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class MattermostProperties {
        /** REST base, e.g. {@code https://chat.example.org/api/v4}. */
        private String apiUrl = "";
        /** Websocket endpoint, e.g. {@code wss://chat.example.org/api/v4/websocket}. */
        private String wsUrl = "";
        private String token = "";
        private String debugChannel = "";
        private String instanceName = "flobot";
    }

    @Data
    public static class LoopProperties {
        private Duration pollTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class TriggerProperties {
        /** Per [channel, trigger] antispam window. */
        private Duration repeatDelay = Duration.ofSeconds(120);
        /** Per channel antispam window. */
        private Duration channelRateLimit = Duration.ofSeconds(3);
    }

    @Data
    public static class DebugProperties {
        private boolean logEvents = false;
        private boolean logPosts = false;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.flobot/workspace";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        /** Websocket ping interval, 0 disables pings. */
        private long pingInterval = 30000;
        /** Let OkHttp silently retry a failed connection attempt. */
        private boolean retryOnConnectionFailure = false;
    }
}
