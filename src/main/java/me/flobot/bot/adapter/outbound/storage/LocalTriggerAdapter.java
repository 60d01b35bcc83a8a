package me.flobot.bot.adapter.outbound.storage;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.flobot.bot.domain.model.Trigger;
import me.flobot.bot.port.outbound.PersistenceException;
import me.flobot.bot.port.outbound.StoragePort;
import me.flobot.bot.port.outbound.TriggerPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Stores triggers as one JSON array per team, under
 * {@code triggers/team-<teamId>.json}.
 *
 * <p>
 * A trigger is identified by its {@code triggeredBy} text within a team:
 * adding a trigger that already exists replaces it, whether it was a text or
 * an emoji trigger.
 */
@Component
@Slf4j
public class LocalTriggerAdapter implements TriggerPort {

    static final String TRIGGERS_DIR = "triggers";

    private static final TypeReference<List<Trigger>> TRIGGER_LIST = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    public LocalTriggerAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized List<Trigger> list(String teamId) throws PersistenceException {
        List<Trigger> triggers = load(teamId);
        triggers.sort(Comparator.comparing(Trigger::getTriggeredBy));
        return triggers;
    }

    @Override
    public synchronized List<Trigger> search(String teamId) throws PersistenceException {
        return load(teamId);
    }

    @Override
    public synchronized void addText(String teamId, String triggeredBy, String text) throws PersistenceException {
        upsert(teamId, Trigger.text(triggeredBy, text));
    }

    @Override
    public synchronized void addEmoji(String teamId, String triggeredBy, String emoji) throws PersistenceException {
        upsert(teamId, Trigger.emoji(triggeredBy, emoji));
    }

    @Override
    public synchronized void delete(String teamId, String triggeredBy) throws PersistenceException {
        List<Trigger> triggers = load(teamId);
        boolean removed = triggers.removeIf(t -> triggeredBy.equals(t.getTriggeredBy()));
        if (!removed) {
            log.debug("[Triggers] Nothing to delete for '{}' in team {}", triggeredBy, teamId);
            return;
        }
        if (triggers.isEmpty()) {
            drop(teamId);
        } else {
            save(teamId, triggers);
        }
        log.info("[Triggers] Deleted '{}' from team {}", triggeredBy, teamId);
    }

    private void upsert(String teamId, Trigger trigger) throws PersistenceException {
        List<Trigger> triggers = load(teamId);
        triggers.removeIf(t -> trigger.getTriggeredBy().equals(t.getTriggeredBy()));
        triggers.add(trigger);
        save(teamId, triggers);
        log.info("[Triggers] Saved '{}' for team {}", trigger.getTriggeredBy(), teamId);
    }

    private List<Trigger> load(String teamId) throws PersistenceException {
        String json;
        try {
            json = storagePort.getText(TRIGGERS_DIR, fileName(teamId)).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to read triggers of team " + teamId, unwrap(e));
        }
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, TRIGGER_LIST));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupted trigger file for team " + teamId, e);
        }
    }

    private void save(String teamId, List<Trigger> triggers) throws PersistenceException {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(triggers);
            storagePort.putTextAtomic(TRIGGERS_DIR, fileName(teamId), json).join();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize triggers of team " + teamId, e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to write triggers of team " + teamId, unwrap(e));
        }
    }

    private void drop(String teamId) throws PersistenceException {
        try {
            storagePort.deleteObject(TRIGGERS_DIR, fileName(teamId)).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to delete trigger file of team " + teamId, unwrap(e));
        }
    }

    private static String fileName(String teamId) {
        return "team-" + teamId + ".json";
    }

    private static Throwable unwrap(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }
}
