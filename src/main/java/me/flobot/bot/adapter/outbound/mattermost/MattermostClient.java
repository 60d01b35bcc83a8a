package me.flobot.bot.adapter.outbound.mattermost;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.flobot.bot.domain.model.Post;
import me.flobot.bot.domain.model.Trigger;
import me.flobot.bot.infrastructure.config.BotProperties;
import me.flobot.bot.port.outbound.BackendException;
import me.flobot.bot.port.outbound.NotifierPort;
import me.flobot.bot.port.outbound.SenderPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;

/**
 * Mattermost REST API v4 client.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /posts - replies, debug and startup messages
 * <li>POST /reactions - emoji reactions
 * <li>GET /users/me - bot user id, fetched once for reactions
 * </ul>
 *
 * <p>
 * Every request carries the bot token as a Bearer header. Calls are
 * synchronous: they run on the event loop thread.
 */
@Component
@Slf4j
public class MattermostClient implements SenderPort, NotifierPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    private volatile String myUserId;

    public MattermostClient(BotProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void reply(Post post, String text) throws BackendException {
        createPost(new CreatePost(post.getChannelId(), text, post.getRootId()));
    }

    @Override
    public void reaction(Post post, String emojiName) throws BackendException {
        ReactionRequest reaction = new ReactionRequest(me(), post.getId(), emojiName);
        execute(new Request.Builder()
                .url(apiUrl("/reactions"))
                .post(RequestBody.create(toJson(reaction), JSON)));
    }

    @Override
    public void sendTriggerList(List<Trigger> triggers, Post post) throws BackendException {
        reply(post, renderTriggers(triggers));
    }

    @Override
    public void debug(String text) throws BackendException {
        createPost(new CreatePost(properties.getMattermost().getDebugChannel(), text, ""));
    }

    @Override
    public void startup(String summary) throws BackendException {
        String message = "bot " + properties.getMattermost().getInstanceName() + " is up\n" + summary;
        createPost(new CreatePost(properties.getMattermost().getDebugChannel(), message, ""));
        log.info("[Mattermost] startup message sent to debug channel");
    }

    /**
     * Returns the bot user id, asking the server on first use.
     */
    String me() throws BackendException {
        String id = myUserId;
        if (id != null) {
            return id;
        }
        String body = execute(new Request.Builder().url(apiUrl("/users/me")).get());
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode idNode = node.get("id");
            if (idNode == null || !idNode.isTextual()) {
                throw new BackendException(BackendException.Kind.BODY, "users/me: missing id");
            }
            myUserId = idNode.asText();
            return myUserId;
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendException.Kind.BODY, "users/me: " + e.getOriginalMessage(), e);
        }
    }

    static String renderTriggers(List<Trigger> triggers) {
        if (triggers.isEmpty()) {
            return "no triggers";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("| trigger | reaction |\n");
        sb.append("|---|---|\n");
        for (Trigger trigger : triggers) {
            sb.append("| ").append(escapeCell(trigger.getTriggeredBy())).append(" | ");
            if (trigger.hasText()) {
                sb.append(escapeCell(trigger.getText()));
            } else {
                sb.append(':').append(trigger.getEmoji()).append(':');
            }
            sb.append(" |\n");
        }
        return sb.toString();
    }

    private static String escapeCell(String value) {
        return value.replace("|", "\\|").replace("\n", " ");
    }

    private void createPost(CreatePost post) throws BackendException {
        execute(new Request.Builder()
                .url(apiUrl("/posts"))
                .post(RequestBody.create(toJson(post), JSON)));
    }

    private String execute(Request.Builder builder) throws BackendException {
        Request request = builder
                .header("Authorization", "Bearer " + properties.getMattermost().getToken())
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                log.debug("[Mattermost] {} {} failed: HTTP {}", request.method(), request.url().encodedPath(),
                        response.code());
                throw new BackendException(BackendException.Kind.STATUS, "HTTP " + response.code() + ": " + body);
            }
            return body;
        } catch (InterruptedIOException e) {
            throw new BackendException(BackendException.Kind.TIMEOUT, "timeout: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new BackendException(BackendException.Kind.OTHER, e.getMessage(), e);
        }
    }

    private String toJson(Object value) throws BackendException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendException.Kind.BODY, e.getOriginalMessage(), e);
        }
    }

    private String apiUrl(String path) {
        String base = properties.getMattermost().getApiUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    // Request DTOs
    record CreatePost(String channel_id, String message, String root_id) {
    }

    record ReactionRequest(String user_id, String post_id, String emoji_name) {
    }
}
