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

/**
 * Failure reported by the chat backend while sending a reply, a reaction or a
 * notification.
 */
public class BackendException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** The call did not complete in time. */
        TIMEOUT,
        /** The backend answered with a non-success HTTP status. */
        STATUS,
        /** The response body could not be read or decoded. */
        BODY,
        OTHER
    }

    private final Kind kind;

    public BackendException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return "BackendException(" + kind + "): " + getMessage();
    }
}
