package me.flobot.bot.infrastructure.runner;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.flobot.bot.domain.loop.EventChannel;
import me.flobot.bot.domain.loop.Instance;
import me.flobot.bot.domain.loop.InstanceException;
import me.flobot.bot.domain.model.Event;
import me.flobot.bot.port.inbound.EventSourcePort;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Starts the event source and runs the {@link Instance} on a dedicated
 * {@code event-loop} thread once the context is ready.
 *
 * <p>
 * A fatal {@link InstanceException} is logged and the application exits with
 * status {@value #FATAL_EXIT_CODE}. On context shutdown, a {@code Shutdown}
 * event is queued and the loop thread is joined before disconnecting.
 */
@Component
@Slf4j
public class BotRunner implements ApplicationRunner {

    static final int FATAL_EXIT_CODE = 1;
    private static final long JOIN_TIMEOUT_MS = 10_000;

    private final Instance instance;
    private final EventSourcePort eventSource;
    private final EventChannel channel;
    private final ConfigurableApplicationContext applicationContext;

    private Thread loopThread;

    public BotRunner(Instance instance, EventSourcePort eventSource, EventChannel channel,
            ConfigurableApplicationContext applicationContext) {
        this.instance = instance;
        this.eventSource = eventSource;
        this.channel = channel;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        eventSource.start(channel);
        loopThread = new Thread(this::loop, "event-loop");
        loopThread.setDaemon(false);
        loopThread.start();
    }

    void loop() {
        try {
            instance.run(channel);
            log.info("[Runner] event loop stopped");
        } catch (InstanceException e) {
            log.error("[Runner] {}", e.getMessage(), e);
            eventSource.stop();
            exit();
        } catch (RuntimeException e) {
            log.error("[Runner] event loop crashed: {}", e.getMessage(), e);
            eventSource.stop();
            exit();
        }
    }

    void exit() {
        Thread exitThread = new Thread(() -> {
            int exitCode = SpringApplication.exit(applicationContext, () -> FATAL_EXIT_CODE);
            System.exit(exitCode);
        }, "exit-thread");
        exitThread.setDaemon(false);
        exitThread.start();
    }

    @PreDestroy
    public void shutdown() {
        channel.send(Event.shutdown());
        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Runner] interrupted while waiting for the event loop");
            }
        }
        eventSource.stop();
    }
}
