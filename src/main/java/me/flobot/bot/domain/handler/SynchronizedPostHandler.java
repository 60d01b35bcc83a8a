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

import me.flobot.bot.domain.model.Post;

import java.util.Objects;

/**
 * Gives one caller at a time exclusive access to the wrapped handler. The lock
 * is taken for each call and released when it returns.
 */
public final class SynchronizedPostHandler implements PostHandler {

    private final PostHandler delegate;
    private final Object lock = new Object();

    private SynchronizedPostHandler(PostHandler delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public static PostHandler wrap(PostHandler handler) {
        if (handler instanceof SynchronizedPostHandler) {
            return handler;
        }
        return new SynchronizedPostHandler(handler);
    }

    @Override
    public String getName() {
        synchronized (lock) {
            return delegate.getName();
        }
    }

    @Override
    public String getHelp() {
        synchronized (lock) {
            return delegate.getHelp();
        }
    }

    @Override
    public void handle(Post post) throws HandlerException {
        synchronized (lock) {
            delegate.handle(post);
        }
    }
}
