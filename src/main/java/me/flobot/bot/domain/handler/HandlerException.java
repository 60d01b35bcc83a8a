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

import me.flobot.bot.port.outbound.BackendException;
import me.flobot.bot.port.outbound.PersistenceException;

/**
 * Failure of a {@link PostHandler}. Never fatal to the event loop.
 */
public class HandlerException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        DATABASE, TIMEOUT, STATUS, OTHER
    }

    private final Kind kind;

    public HandlerException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HandlerException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static HandlerException from(BackendException e) {
        Kind kind = switch (e.getKind()) {
        case TIMEOUT -> Kind.TIMEOUT;
        case STATUS -> Kind.STATUS;
        case BODY, OTHER -> Kind.OTHER;
        };
        return new HandlerException(kind, e.getMessage(), e);
    }

    public static HandlerException from(PersistenceException e) {
        return new HandlerException(Kind.DATABASE, e.getMessage(), e);
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind + "(" + getMessage() + ")";
    }
}
