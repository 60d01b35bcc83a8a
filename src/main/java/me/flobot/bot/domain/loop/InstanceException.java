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

/**
 * Fatal error of the event loop. Once thrown, {@link Instance#run(EventChannel)}
 * has returned and the caller decides what to do, usually exit the process.
 */
public class InstanceException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        OTHER,
        /** A middleware failed. */
        MIDDLEWARE,
        /** The backend failed on a call the loop itself made. */
        CLIENT,
        /** The event channel was closed. */
        CONSUMER,
        /** The backend reported a failing status. */
        STATUS
    }

    private final Kind kind;

    public InstanceException(Kind kind, String message) {
        super("Instance got a fatal error: " + kind + "(" + message + ")");
        this.kind = kind;
    }

    public InstanceException(Kind kind, String message, Throwable cause) {
        super("Instance got a fatal error: " + kind + "(" + message + ")", cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
