package me.flobot.bot.domain.handler;

import me.flobot.bot.port.outbound.BackendException;
import me.flobot.bot.port.outbound.PersistenceException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HandlerExceptionTest {

    @Test
    void shouldMapBackendKinds() {
        assertEquals(HandlerException.Kind.TIMEOUT,
                HandlerException.from(new BackendException(BackendException.Kind.TIMEOUT, "t")).getKind());
        assertEquals(HandlerException.Kind.STATUS,
                HandlerException.from(new BackendException(BackendException.Kind.STATUS, "s")).getKind());
        assertEquals(HandlerException.Kind.OTHER,
                HandlerException.from(new BackendException(BackendException.Kind.BODY, "b")).getKind());
        assertEquals(HandlerException.Kind.OTHER,
                HandlerException.from(new BackendException(BackendException.Kind.OTHER, "o")).getKind());
    }

    @Test
    void shouldMapPersistenceToDatabaseKeepingCause() {
        PersistenceException cause = new PersistenceException("locked");

        HandlerException error = HandlerException.from(cause);

        assertEquals(HandlerException.Kind.DATABASE, error.getKind());
        assertSame(cause, error.getCause());
        assertEquals("DATABASE(locked)", error.toString());
    }
}
