package me.flobot.bot.infrastructure.http;


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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.flobot.bot.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * The one {@link OkHttpClient} of the bot, shared by the Mattermost REST
 * client and the websocket listener.
 *
 * <p>
 * The websocket is long-lived, so the client pings it every
 * {@code bot.http.ping-interval} ms; a missed pong fails the socket and the
 * listener closes the event channel. Connection retries are off by default:
 * the bot does not reconnect, and a failed call should surface as a
 * {@link me.flobot.bot.port.outbound.BackendException} instead of stalling
 * the handler.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final BotProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        return build(properties.getHttp());
    }

    static OkHttpClient build(BotProperties.HttpProperties http) {
        log.debug("[Http] client: connect={}ms, read={}ms, ping={}ms, retry={}",
                http.getConnectTimeout(), http.getReadTimeout(), http.getPingInterval(),
                http.isRetryOnConnectionFailure());
        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .pingInterval(http.getPingInterval(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(http.isRetryOnConnectionFailure())
                .build();
    }
}
