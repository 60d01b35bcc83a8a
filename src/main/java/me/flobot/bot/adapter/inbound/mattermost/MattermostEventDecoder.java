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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.flobot.bot.domain.model.Event;
import me.flobot.bot.domain.model.Post;
import me.flobot.bot.domain.model.PostEdited;
import me.flobot.bot.domain.model.Status;
import me.flobot.bot.domain.model.StatusCode;
import me.flobot.bot.domain.model.StatusError;
import org.springframework.stereotype.Component;

/**
 * Maps Mattermost websocket frames to {@link Event} values.
 *
 * <p>
 * Two frame shapes exist: replies to the bot's own requests carry a
 * {@code status} field, broadcast events carry an {@code event} name and a
 * {@code data} object. For {@code posted} and {@code post_edited} the post
 * itself is a JSON document serialized as a string inside {@code data.post}.
 * Anything not understood becomes {@link Event.Unsupported} with the raw
 * frame.
 */
@Component
@Slf4j
public class MattermostEventDecoder {

    private final ObjectMapper objectMapper;

    public MattermostEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Event decode(String frame) {
        try {
            JsonNode root = objectMapper.readTree(frame);
            if (root == null || !root.isObject()) {
                return new Event.Unsupported(frame);
            }
            if (root.hasNonNull("status")) {
                return new Event.StatusReceived(decodeStatus(root));
            }

            String type = root.path("event").asText("");
            JsonNode data = root.path("data");
            return switch (type) {
            case "hello" -> new Event.Hello(
                    data.path("server_version").asText(""),
                    root.path("broadcast").path("user_id").asText(""));
            case "posted" -> new Event.Posted(decodePost(data));
            case "post_edited" -> new Event.Edited(decodeEdited(data));
            default -> new Event.Unsupported(frame);
            };
        } catch (JsonProcessingException e) {
            log.debug("[Mattermost] undecodable frame: {}", e.getOriginalMessage());
            return new Event.Unsupported(frame);
        }
    }

    private Status decodeStatus(JsonNode root) {
        String status = root.get("status").asText();
        if (status.contains("OK")) {
            return Status.ok();
        }
        if (status.contains("FAIL")) {
            JsonNode error = root.path("error");
            StatusError details = error.isObject() ? decodeStatusError(error) : StatusError.none();
            return Status.of(StatusCode.ERROR, details);
        }
        return Status.of(StatusCode.UNSUPPORTED, null);
    }

    private StatusError decodeStatusError(JsonNode error) {
        JsonNode requestId = error.path("request_id");
        return StatusError.builder()
                .message(error.path("message").asText(""))
                .detailedError(error.path("detailed_error").asText(""))
                .requestId(requestId.isTextual() ? requestId.asText() : null)
                .statusCode(error.path("status_code").asInt(0))
                .build();
    }

    private Post decodePost(JsonNode data) throws JsonProcessingException {
        JsonNode post = objectMapper.readTree(data.path("post").asText("{}"));
        return Post.builder()
                .id(post.path("id").asText(""))
                .channelId(post.path("channel_id").asText(""))
                .userId(post.path("user_id").asText(""))
                .rootId(post.path("root_id").asText(""))
                .parentId(post.path("parent_id").asText(""))
                .message(post.path("message").asText(""))
                .teamId(data.path("team_id").asText(""))
                .build();
    }

    private PostEdited decodeEdited(JsonNode data) throws JsonProcessingException {
        JsonNode post = objectMapper.readTree(data.path("post").asText("{}"));
        return PostEdited.builder()
                .id(post.path("id").asText(""))
                .channelId(post.path("channel_id").asText(""))
                .userId(post.path("user_id").asText(""))
                .rootId(post.path("root_id").asText(""))
                .parentId(post.path("parent_id").asText(""))
                .message(post.path("message").asText(""))
                .build();
    }
}
