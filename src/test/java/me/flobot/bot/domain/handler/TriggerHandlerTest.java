package me.flobot.bot.domain.handler;

import me.flobot.bot.domain.model.Post;
import me.flobot.bot.domain.model.Trigger;
import me.flobot.bot.port.outbound.BackendException;
import me.flobot.bot.port.outbound.PersistenceException;
import me.flobot.bot.port.outbound.SenderPort;
import me.flobot.bot.port.outbound.TriggerPort;
import me.flobot.bot.ratelimit.Tempo;
import me.flobot.bot.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TriggerHandlerTest {

    private static final String TEAM = "team1";
    private static final String CHANNEL = "chan1";
    private static final Duration REPEAT_DELAY = Duration.ofSeconds(120);
    private static final Duration CHANNEL_RATE_LIMIT = Duration.ofSeconds(3);

    private TriggerPort triggerPort;
    private SenderPort sender;
    private MutableClock clock;
    private TriggerHandler handler;

    @BeforeEach
    void setUp() {
        triggerPort = mock(TriggerPort.class);
        sender = mock(SenderPort.class);
        clock = MutableClock.atEpoch();
        handler = new TriggerHandler(triggerPort, sender, new Tempo<>(clock), REPEAT_DELAY, CHANNEL_RATE_LIMIT);
    }

    private static Post post(String message) {
        return Post.builder()
                .id("post1")
                .channelId(CHANNEL)
                .teamId(TEAM)
                .userId("user1")
                .message(message)
                .build();
    }

    // ===== Identity =====

    @Test
    void shouldExposeNameAndHelpWithConfiguredDelays() {
        assertEquals("trigger", handler.getName());
        String help = handler.getHelp();
        assertTrue(help.contains("antispam of 3 seconds"));
        assertTrue(help.contains("configured at 120 seconds"));
        assertTrue(help.contains("!trigger reaction \"trigger\" :emoji:"));
    }

    // ===== Reacting to messages =====

    @Test
    void shouldReplyWithTextTrigger() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(Trigger.text("hello", "world")));

        Post post = post("well hello there");
        handler.handle(post);

        verify(sender).reply(post, "world");
        verify(sender, never()).reaction(any(), anyString());
    }

    @Test
    void shouldIgnoreGluedTrigger() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(Trigger.text("hello", "world")));

        handler.handle(post("hellothere"));

        verifyNoInteractions(sender);
    }

    @Test
    void shouldLetTextTriggerSuppressEmojiTriggers() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(
                Trigger.emoji("coffee", "coffee"),
                Trigger.text("morning", "good morning!"),
                Trigger.emoji("tea", "tea")));

        Post post = post("morning coffee and tea");
        handler.handle(post);

        verify(sender).reply(post, "good morning!");
        verify(sender, never()).reaction(any(), anyString());
    }

    @Test
    void shouldReactWithEveryMatchingEmoji() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(
                Trigger.emoji("coffee", "coffee"),
                Trigger.emoji("tea", "tea_cup")));

        Post post = post("coffee or tea");
        handler.handle(post);

        var ordered = inOrder(sender);
        ordered.verify(sender).reaction(post, "coffee");
        ordered.verify(sender).reaction(post, "tea_cup");
        verify(sender, never()).reply(any(), anyString());
    }

    @Test
    void shouldStopAtFirstTextTrigger() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(
                Trigger.text("one", "first"),
                Trigger.text("two", "second")));

        Post post = post("one two");
        handler.handle(post);

        verify(sender).reply(post, "first");
        verify(sender, never()).reply(post, "second");
    }

    // ===== Antispam =====

    @Test
    void shouldRateLimitChannel() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(
                Trigger.text("hello", "world"),
                Trigger.text("bye", "see you")));

        handler.handle(post("hello"));
        clock.advance(Duration.ofSeconds(2));
        handler.handle(post("bye"));

        verify(sender).reply(any(), anyString());
        verify(triggerPort, times(1)).search(TEAM);

        clock.advance(Duration.ofSeconds(1));
        Post later = post("bye");
        handler.handle(later);

        verify(sender).reply(later, "see you");
    }

    @Test
    void shouldApplyChannelRateLimitEvenWithoutMatch() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(Trigger.text("hello", "world")));

        handler.handle(post("nothing here"));
        handler.handle(post("hello"));

        verifyNoInteractions(sender);
    }

    @Test
    void shouldNotRateLimitOtherChannels() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(Trigger.text("hello", "world")));

        handler.handle(post("hello"));
        Post elsewhere = post("hello").toBuilder().channelId("chan2").build();
        handler.handle(elsewhere);

        verify(sender).reply(elsewhere, "world");
    }

    @Test
    void shouldDelayRepeatedTrigger() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(Trigger.emoji("coffee", "coffee")));

        handler.handle(post("coffee"));
        clock.advance(Duration.ofSeconds(10));
        handler.handle(post("coffee"));

        verify(sender, times(1)).reaction(any(), anyString());

        clock.advance(Duration.ofSeconds(110));
        handler.handle(post("coffee"));

        verify(sender, times(2)).reaction(any(), anyString());
    }

    @Test
    void shouldFallBackToEmojiWhenTextTriggerIsDelayed() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(
                Trigger.text("morning", "good morning!"),
                Trigger.emoji("coffee", "coffee")));

        handler.handle(post("morning"));
        clock.advance(Duration.ofSeconds(5));
        Post post = post("morning coffee");
        handler.handle(post);

        verify(sender, times(1)).reply(any(), anyString());
        verify(sender).reaction(post, "coffee");
    }

    // ===== Commands =====

    @Test
    void shouldListTriggers() throws Exception {
        List<Trigger> triggers = List.of(Trigger.text("a", "b"));
        when(triggerPort.list(TEAM)).thenReturn(triggers);

        Post post = post("!trigger list");
        handler.handle(post);

        verify(sender).sendTriggerList(triggers, post);
    }

    @Test
    void shouldAddTextTriggerAndAcknowledge() throws Exception {
        Post post = post("!trigger text \"hello\" \"world of pain\"");
        handler.handle(post);

        verify(triggerPort).addText(TEAM, "hello", "world of pain");
        verify(sender).reaction(post, TriggerHandler.ACK_REACTION);
    }

    @Test
    void shouldAddReactionTriggerWithColons() throws Exception {
        Post post = post("!trigger reaction \"coffee\" :coffee:");
        handler.handle(post);

        verify(triggerPort).addEmoji(TEAM, "coffee", "coffee");
        verify(sender).reaction(post, "ok_hand");
    }

    @Test
    void shouldAddReactionTriggerWithQuotes() throws Exception {
        handler.handle(post("!trigger reaction \"tea time\" \"tea\""));

        verify(triggerPort).addEmoji(TEAM, "tea time", "tea");
    }

    @Test
    void shouldAcknowledgeEvenWhenStoringFails() throws Exception {
        doThrow(new PersistenceException("disk full")).when(triggerPort).addText(anyString(), anyString(),
                anyString());

        Post post = post("!trigger text \"hello\" \"world\"");
        assertDoesNotThrow(() -> handler.handle(post));

        verify(sender).reaction(post, "ok_hand");
    }

    @Test
    void shouldDeleteTriggerAndAcknowledge() throws Exception {
        Post post = post("!trigger del \"hello\"");
        handler.handle(post);

        verify(triggerPort).delete(TEAM, "hello");
        verify(sender).reaction(post, "ok_hand");
    }

    @Test
    void shouldPropagateDeleteFailure() throws Exception {
        doThrow(new PersistenceException("locked")).when(triggerPort).delete(TEAM, "hello");

        HandlerException error = assertThrows(HandlerException.class,
                () -> handler.handle(post("!trigger del \"hello\"")));

        assertEquals(HandlerException.Kind.DATABASE, error.getKind());
        verify(sender, never()).reaction(any(), anyString());
    }

    @Test
    void shouldIgnoreUnknownCommand() throws Exception {
        handler.handle(post("!trigger frobnicate"));

        verifyNoInteractions(sender);
        verify(triggerPort, never()).search(anyString());
    }

    @Test
    void shouldNotSearchTriggersForCommands() throws Exception {
        handler.handle(post("!trigger text \"a\" \"b\""));

        verify(triggerPort, never()).search(anyString());
    }

    // ===== Errors =====

    @Test
    void shouldMapBackendTimeout() throws Exception {
        when(triggerPort.search(TEAM)).thenReturn(List.of(Trigger.text("hello", "world")));
        doThrow(new BackendException(BackendException.Kind.TIMEOUT, "slow")).when(sender).reply(any(), anyString());

        HandlerException error = assertThrows(HandlerException.class, () -> handler.handle(post("hello")));

        assertEquals(HandlerException.Kind.TIMEOUT, error.getKind());
    }

    @Test
    void shouldMapSearchFailureToDatabase() throws Exception {
        when(triggerPort.search(TEAM)).thenThrow(new PersistenceException("corrupted"));

        HandlerException error = assertThrows(HandlerException.class, () -> handler.handle(post("hello")));

        assertEquals(HandlerException.Kind.DATABASE, error.getKind());
        assertEquals("DATABASE(corrupted)", error.toString());
    }
}
