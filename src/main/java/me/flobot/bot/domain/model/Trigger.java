package me.flobot.bot.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stored (pattern, reaction) pair. Exactly one of {@code text} and
 * {@code emoji} is set: text triggers reply with replacement text, emoji
 * triggers react to the message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trigger {

    private String triggeredBy;
    private String text;
    private String emoji;

    public static Trigger text(String triggeredBy, String text) {
        return new Trigger(triggeredBy, text, null);
    }

    public static Trigger emoji(String triggeredBy, String emoji) {
        return new Trigger(triggeredBy, null, emoji);
    }

    @JsonIgnore
    public boolean hasText() {
        return text != null;
    }
}
