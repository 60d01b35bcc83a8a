package me.flobot.bot.domain.loop;

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
import me.flobot.bot.domain.handler.PostHandler;
import me.flobot.bot.domain.middleware.Continue;
import me.flobot.bot.domain.middleware.Middleware;
import me.flobot.bot.domain.middleware.MiddlewareException;
import me.flobot.bot.domain.model.Event;
import me.flobot.bot.domain.model.Post;
import me.flobot.bot.domain.model.Status;
import me.flobot.bot.port.outbound.BackendException;
import me.flobot.bot.port.outbound.NotifierPort;
import me.flobot.bot.port.outbound.SenderPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The event loop of the bot.
 *
 * <p>
 * Consumes events one at a time from an {@link EventChannel}, runs each one
 * through the middleware chain, then hands posts to every registered
 * {@link PostHandler} in registration order:
 *
 * <pre>
 * EventChannel -> Middleware 1..n -> (posts) !help -> PostHandler 1..n
 * </pre>
 *
 * <p>
 * Handler failures are reported to the debug channel and never stop the loop.
 * Everything else that goes wrong is fatal: {@link #run(EventChannel)} throws
 * an {@link InstanceException} and the caller is expected to exit.
 *
 * <p>
 * Not thread-safe: middleware and handlers are registered before
 * {@code run}, and the loop runs on a single thread.
 */
@Slf4j
public class Instance {

    static final String HELP_NOT_FOUND = "tutétrompé";

    private static final String HELP_COMMAND = "!help";
    private static final Pattern HELP_NAMED = Pattern.compile("^!help ([a-zA-Z0-9_-]+).*");

    private final SenderPort sender;
    private final NotifierPort notifier;
    private final Duration pollTimeout;
    private final List<Middleware> middlewares = new ArrayList<>();
    private final List<PostHandler> postHandlers = new ArrayList<>();
    private final Map<String, String> helps = new HashMap<>();

    public Instance(SenderPort sender, NotifierPort notifier, Duration pollTimeout) {
        this.sender = sender;
        this.notifier = notifier;
        this.pollTimeout = pollTimeout;
    }

    public Instance addMiddleware(Middleware middleware) {
        middlewares.add(middleware);
        return this;
    }

    /**
     * Register a handler. Its help, if any, is recorded under its name; a later
     * handler with the same name replaces it.
     */
    public Instance addPostHandler(PostHandler handler) {
        String help = handler.getHelp();
        if (help != null) {
            helps.put(handler.getName(), help);
        }
        postHandlers.add(handler);
        return this;
    }

    /**
     * Announce the bot, then process events until a {@link Event.Shutdown}
     * arrives.
     *
     * @throws InstanceException
     *             on any fatal error; the loop has stopped
     */
    public void run(EventChannel channel) throws InstanceException {
        try {
            notifier.startup(loadedSummary());
        } catch (BackendException e) {
            throw new InstanceException(InstanceException.Kind.CLIENT, e.getMessage(), e);
        }
        log.info("[Instance] running with {} middleware(s) and {} post handler(s)",
                middlewares.size(), postHandlers.size());

        while (true) {
            Optional<Event> next;
            try {
                next = channel.receive(pollTimeout);
            } catch (EventChannel.DisconnectedException e) {
                throw new InstanceException(InstanceException.Kind.CONSUMER, e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InstanceException(InstanceException.Kind.OTHER, "event loop interrupted", e);
            }

            if (next.isEmpty()) {
                log.trace("[Instance] no event within {}", pollTimeout);
                continue;
            }

            Event event = next.get();
            if (event instanceof Event.Shutdown) {
                log.info("[Instance] shutdown requested");
                return;
            }
            process(event);
        }
    }

    String loadedSummary() {
        StringBuilder loaded = new StringBuilder("## Loaded middlewares\n");
        for (Middleware middleware : middlewares) {
            loaded.append(" * `").append(middleware.getName()).append("`\n");
        }
        loaded.append("## Loaded post handlers\n");
        for (PostHandler handler : postHandlers) {
            loaded.append(" * `").append(handler.getName()).append("`\n");
        }
        return loaded.toString();
    }

    void process(Event event) throws InstanceException {
        Optional<Event> surviving = processMiddlewares(event);
        if (surviving.isPresent()) {
            processEvent(surviving.get());
        }
    }

    private Optional<Event> processMiddlewares(Event event) throws InstanceException {
        Event current = event;
        for (Middleware middleware : middlewares) {
            Continue result;
            try {
                result = middleware.process(current);
            } catch (MiddlewareException e) {
                throw new InstanceException(InstanceException.Kind.MIDDLEWARE,
                        middleware.getName() + ": " + e.getMessage(), e);
            } catch (RuntimeException e) {
                throw new InstanceException(InstanceException.Kind.MIDDLEWARE,
                        middleware.getName() + ": " + e, e);
            }
            if (!result.isYes()) {
                log.trace("[Instance] event dropped by middleware '{}'", middleware.getName());
                return Optional.empty();
            }
            current = result.getEvent();
        }
        return Optional.of(current);
    }

    private void processEvent(Event event) throws InstanceException {
        if (event instanceof Event.Posted posted) {
            processPost(posted.post());
        } else if (event instanceof Event.Edited) {
            log.info("[Instance] edits are unsupported for now");
        } else if (event instanceof Event.Unsupported unsupported) {
            log.trace("[Instance] unsupported event: {}", unsupported.raw());
        } else if (event instanceof Event.Hello hello) {
            log.info("[Instance] hello server {}", hello.serverString());
        } else if (event instanceof Event.StatusReceived received) {
            processStatus(received.status());
        }
        // Shutdown is handled by run() before the chain
    }

    private void processStatus(Status status) throws InstanceException {
        switch (status.getCode()) {
        case OK -> {
        }
        case ERROR -> throw new InstanceException(InstanceException.Kind.STATUS, status.errorMessage());
        case UNSUPPORTED -> log.info("[Instance] unsupported status: {}", status);
        case UNKNOWN -> throw new InstanceException(InstanceException.Kind.OTHER, status.errorMessage());
        }
    }

    private void processPost(Post post) throws InstanceException {
        processHelp(post);
        for (PostHandler handler : postHandlers) {
            try {
                handler.handle(post);
            } catch (Exception e) { // NOSONAR - a failing handler must not stop the others
                log.warn("[Instance] handler '{}' failed: {}", handler.getName(), e.getMessage());
                reportHandlerError(e);
            }
        }
    }

    private void reportHandlerError(Exception error) {
        try {
            notifier.debug("error: " + error);
        } catch (BackendException e) {
            log.error("[Instance] debug notification failed: {}", e.getMessage(), e);
        }
    }

    private void processHelp(Post post) throws InstanceException {
        String message = post.getMessage();
        try {
            if (HELP_COMMAND.equals(message)) {
                StringBuilder reply = new StringBuilder();
                helps.keySet().stream()
                        .sorted()
                        .forEach(name -> reply.append('`').append(name).append("`\n"));
                sender.reply(post, reply.toString());
                return;
            }

            Matcher named = HELP_NAMED.matcher(message);
            if (named.find()) {
                sender.reply(post, helps.getOrDefault(named.group(1), HELP_NOT_FOUND));
            }
        } catch (BackendException e) {
            throw new InstanceException(InstanceException.Kind.CLIENT, e.getMessage(), e);
        }
    }
}
