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

import me.flobot.bot.domain.model.Trigger;

import java.util.List;

/**
 * Persistence of triggers, keyed by team.
 */
public interface TriggerPort {

    /**
     * All triggers of the team, for display.
     */
    List<Trigger> list(String teamId) throws PersistenceException;

    /**
     * All triggers of the team, as candidates to match against a message.
     */
    List<Trigger> search(String teamId) throws PersistenceException;

    void addText(String teamId, String triggeredBy, String text) throws PersistenceException;

    void addEmoji(String teamId, String triggeredBy, String emoji) throws PersistenceException;

    void delete(String teamId, String triggeredBy) throws PersistenceException;
}
