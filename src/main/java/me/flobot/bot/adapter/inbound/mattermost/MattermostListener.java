package me.flobot.bot.adapter.inbound.mattermost;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.flobot.bot.domain.loop.EventChannel;
import me.flobot.bot.domain.model.Event;
import me.flobot.bot.infrastructure.config.BotProperties;
import me.flobot.bot.port.inbound.EventSourcePort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Mattermost websocket connection, the only producer of the event channel.
 *
 * <p>
 * Authenticates with the bot token once the socket is open, then decodes each
 * text frame and sends it to the channel. When the socket closes or fails, the
 * channel is closed and the event loop stops with a disconnect error. There is
 * no reconnection.
 */
@Component
@Slf4j
public class MattermostListener implements EventSourcePort {

    static final int NORMAL_CLOSURE = 1000;

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final MattermostEventDecoder decoder;
    private final ObjectMapper objectMapper;
    private final Object lifecycleLock = new Object();

    private WebSocket webSocket;
    private volatile boolean running;

    public MattermostListener(BotProperties properties, OkHttpClient httpClient,
            MattermostEventDecoder decoder, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.decoder = decoder;
        this.objectMapper = objectMapper;
    }

    @Override
    public void start(EventChannel channel) {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Mattermost] listener already running");
                return;
            }
            String wsUrl = properties.getMattermost().getWsUrl();
            Request request = new Request.Builder()
                    .url(wsUrl)
                    .header("Authorization", "Bearer " + properties.getMattermost().getToken())
                    .build();
            webSocket = httpClient.newWebSocket(request, new FrameListener(channel));
            running = true;
            log.info("[Mattermost] connecting to {}", wsUrl);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (webSocket != null) {
                webSocket.close(NORMAL_CLOSURE, "shutdown");
                webSocket = null;
            }
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    String authenticationChallenge() throws JsonProcessingException {
        return objectMapper.writeValueAsString(Map.of(
                "seq", 1,
                "action", "authentication_challenge",
                "data", Map.of("token", properties.getMattermost().getToken())));
    }

    final class FrameListener extends WebSocketListener {

        private final EventChannel channel;

        FrameListener(EventChannel channel) {
            this.channel = channel;
        }

        @Override
        public void onOpen(WebSocket socket, Response response) {
            log.info("[Mattermost] websocket open, authenticating");
            try {
                socket.send(authenticationChallenge());
            } catch (JsonProcessingException e) {
                log.error("[Mattermost] cannot build authentication challenge", e);
                socket.close(NORMAL_CLOSURE, "authentication failed");
            }
        }

        @Override
        public void onMessage(WebSocket socket, String text) {
            Event event = decoder.decode(text);
            if (!channel.send(event)) {
                log.warn("[Mattermost] event channel closed, dropping {}", event.getClass().getSimpleName());
            }
        }

        @Override
        public void onClosing(WebSocket socket, int code, String reason) {
            socket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket socket, int code, String reason) {
            log.info("[Mattermost] websocket closed: {} {}", code, reason);
            disconnect();
        }

        @Override
        public void onFailure(WebSocket socket, Throwable t, Response response) {
            log.error("[Mattermost] websocket failure: {}", t.getMessage(), t);
            disconnect();
        }

        private void disconnect() {
            running = false;
            channel.close();
        }
    }
}
