package me.flobot.bot.ratelimit;

import me.flobot.bot.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TempoTest {

    private static final Duration ONE_SECOND = Duration.ofSeconds(1);

    private MutableClock clock;
    private Tempo<String> tempo;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        tempo = new Tempo<>(clock);
    }

    @Test
    void shouldReportKeyWithinTtl() {
        tempo.set("try", ONE_SECOND);

        assertTrue(tempo.exists("try"));
        clock.advance(Duration.ofMillis(999));
        assertTrue(tempo.exists("try"));
    }

    @Test
    void shouldNotReportUnknownKey() {
        assertFalse(tempo.exists("missing"));
        assertEquals(0, tempo.size());
    }

    @Test
    void shouldExpireAndRemoveKeyAfterTtl() {
        tempo.set("try", ONE_SECOND);
        assertEquals(1, tempo.size());

        clock.advance(ONE_SECOND);

        assertFalse(tempo.exists("try"));
        assertEquals(0, tempo.size());
    }

    @Test
    void shouldKeepExpiredKeyUntilLookedUp() {
        tempo.set("a", ONE_SECOND);
        tempo.set("b", ONE_SECOND);
        clock.advance(Duration.ofSeconds(5));

        assertEquals(2, tempo.size());
        assertFalse(tempo.exists("a"));
        assertEquals(1, tempo.size());
    }

    @Test
    void shouldOverwriteExpiry() {
        tempo.set("try", ONE_SECOND);
        tempo.set("try", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(5));

        assertTrue(tempo.exists("try"));
    }

    @Test
    void shouldTreatZeroTtlAsAlreadyExpired() {
        tempo.set("now", Duration.ZERO);

        assertFalse(tempo.exists("now"));
    }

    @Test
    void shouldCapHugeTtlInsteadOfOverflowing() {
        assertDoesNotThrow(() -> tempo.set("forever", Duration.ofSeconds(Long.MAX_VALUE)));

        clock.advance(Duration.ofDays(365L * 1000));

        assertTrue(tempo.exists("forever"));
    }

    @Test
    void shouldShareStoreBetweenHandles() {
        Tempo<String> other = tempo.shared();

        tempo.set("cloned", ONE_SECOND);
        other.set("back", ONE_SECOND);

        assertTrue(other.exists("cloned"));
        assertTrue(tempo.exists("back"));
        assertEquals(2, other.size());
    }

    @Test
    void shouldSeeWritesFromOtherThreads() throws InterruptedException {
        Tempo<String> other = tempo.shared();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(100);
        try {
            for (int i = 0; i < 100; i++) {
                String key = "k" + i;
                executor.submit(() -> {
                    other.set(key, ONE_SECOND);
                    done.countDown();
                });
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(100, tempo.size());
        assertTrue(tempo.exists("k42"));
    }
}
