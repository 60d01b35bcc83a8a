package me.flobot.bot.domain.handler;

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
import me.flobot.bot.domain.model.Post;
import me.flobot.bot.domain.model.Trigger;
import me.flobot.bot.port.outbound.BackendException;
import me.flobot.bot.port.outbound.PersistenceException;
import me.flobot.bot.port.outbound.SenderPort;
import me.flobot.bot.port.outbound.TriggerPort;
import me.flobot.bot.ratelimit.Tempo;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reacts to configured words in chat messages, and manages those words
 * through {@code !trigger} commands.
 *
 * <p>
 * A trigger either replies with replacement text or reacts with an emoji. Two
 * antispam windows apply before anything is sent:
 * <ul>
 * <li>per channel: once a message was searched for triggers, the channel is
 * ignored for {@code channelRateLimit}</li>
 * <li>per channel and trigger: a trigger that acted stays silent in that
 * channel for {@code repeatDelay}</li>
 * </ul>
 *
 * <p>
 * Text triggers take precedence: matches are tried text triggers first, and
 * the first text trigger that acts ends the processing of the message, so it
 * suppresses every emoji trigger. Emoji triggers all react when no text
 * trigger acted.
 */
@Slf4j
public class TriggerHandler implements PostHandler {

    static final String COMMAND_PREFIX = "!trigger ";
    static final String ACK_REACTION = "ok_hand";

    private static final String CHANNEL_RATE_LIMIT_SUFFIX = "--global-channel-rate-limit";
    private static final String TRIGGER_RATE_LIMIT_SUFFIX = "--trigger-channel-rate-limit";

    private static final Pattern MATCH_LIST = Pattern.compile("^!trigger list.*$");
    private static final Pattern MATCH_DEL = Pattern.compile("^!trigger del \"(.+)\".*");
    private static final Pattern MATCH_REACTION = Pattern
            .compile("^!trigger reaction \"([^\"]+)\" [:\"]([^:]+)[:\"].*$");
    private static final Pattern MATCH_TEXT = Pattern.compile("^!trigger text \"([^\"]+)\" \"([^\"]+)\".*$");

    private final TriggerPort triggerPort;
    private final SenderPort sender;
    private final Tempo<String> tempo;
    private final Duration repeatDelay;
    private final Duration channelRateLimit;

    public TriggerHandler(TriggerPort triggerPort, SenderPort sender, Tempo<String> tempo,
            Duration repeatDelay, Duration channelRateLimit) {
        this.triggerPort = triggerPort;
        this.sender = sender;
        this.tempo = tempo;
        this.repeatDelay = repeatDelay;
        this.channelRateLimit = channelRateLimit;
    }

    @Override
    public String getName() {
        return "trigger";
    }

    @Override
    public String getHelp() {
        return "```\n"
                + "Automatically react to a given text in each received message on channels where the bot is present.\n"
                + "\n"
                + "There is a per channel antispam of " + channelRateLimit.toSeconds()
                + " seconds, avoiding a heated channel to be polluted by the bot.\n"
                + "\n"
                + "A per [channel, trigger] antispam is effective and currently configured at "
                + repeatDelay.toSeconds() + " seconds.\n"
                + "\n"
                + "!trigger list\n"
                + "!trigger text \"trigger\" \"me\"\n"
                + "!trigger reaction \"trigger\" :emoji:\n"
                + "!trigger del \"trigger\"\n"
                + "```";
    }

    @Override
    public void handle(Post post) throws HandlerException {
        try {
            if (!post.getMessage().startsWith(COMMAND_PREFIX)) {
                react(post);
            } else {
                command(post);
            }
        } catch (BackendException e) {
            throw HandlerException.from(e);
        } catch (PersistenceException e) {
            throw HandlerException.from(e);
        }
    }

    private void react(Post post) throws BackendException, PersistenceException {
        // keep heated discussions from being spammed by the bot
        String channelKey = post.getTeamId() + post.getChannelId() + CHANNEL_RATE_LIMIT_SUFFIX;
        if (tempo.exists(channelKey)) {
            log.trace("[Trigger] channel {} is rate limited", post.getChannelId());
            return;
        }
        tempo.set(channelKey, channelRateLimit);

        List<Trigger> matches = triggerPort.search(post.getTeamId()).stream()
                .filter(t -> TriggerMatcher.validMatch(t.getTriggeredBy(), post.getMessage()))
                .sorted(Comparator.comparing(t -> !t.hasText()))
                .toList();

        for (Trigger trigger : matches) {
            String triggerKey = post.getTeamId() + post.getChannelId() + trigger.getTriggeredBy()
                    + TRIGGER_RATE_LIMIT_SUFFIX;
            if (tempo.exists(triggerKey)) {
                log.debug("[Trigger] '{}' delayed in channel {}", trigger.getTriggeredBy(), post.getChannelId());
                continue;
            }
            tempo.set(triggerKey, repeatDelay);

            if (trigger.hasText()) {
                sender.reply(post, trigger.getText());
                break;
            }
            sender.reaction(post, trigger.getEmoji());
        }
    }

    private void command(Post post) throws BackendException, PersistenceException {
        String message = post.getMessage();
        String teamId = post.getTeamId();

        if (MATCH_LIST.matcher(message).find()) {
            sender.sendTriggerList(triggerPort.list(teamId), post);
            return;
        }

        Matcher text = MATCH_TEXT.matcher(message);
        if (text.find()) {
            String trigger = text.group(1);
            if (!isCompilable(trigger, post)) {
                return;
            }
            try {
                triggerPort.addText(teamId, trigger, text.group(2));
            } catch (PersistenceException e) {
                log.warn("[Trigger] failed to store text trigger '{}': {}", trigger, e.getMessage());
            }
            sender.reaction(post, ACK_REACTION);
            return;
        }

        Matcher reaction = MATCH_REACTION.matcher(message);
        if (reaction.find()) {
            String trigger = reaction.group(1);
            if (!isCompilable(trigger, post)) {
                return;
            }
            try {
                triggerPort.addEmoji(teamId, trigger, reaction.group(2));
            } catch (PersistenceException e) {
                log.warn("[Trigger] failed to store reaction trigger '{}': {}", trigger, e.getMessage());
            }
            sender.reaction(post, ACK_REACTION);
            return;
        }

        Matcher del = MATCH_DEL.matcher(message);
        if (del.find()) {
            triggerPort.delete(teamId, del.group(1));
            sender.reaction(post, ACK_REACTION);
        }
    }

    /**
     * Prevents broken triggers from being stored; the compiler's error goes back
     * to the user.
     */
    private boolean isCompilable(String trigger, Post post) throws BackendException {
        try {
            TriggerMatcher.compile(trigger);
            return true;
        } catch (PatternSyntaxException e) {
            sender.reply(post, e.getMessage());
            return false;
        }
    }
}
