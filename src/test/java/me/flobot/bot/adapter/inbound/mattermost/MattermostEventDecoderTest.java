package me.flobot.bot.adapter.inbound.mattermost;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.flobot.bot.domain.model.Event;
import me.flobot.bot.domain.model.Post;
import me.flobot.bot.domain.model.Status;
import me.flobot.bot.domain.model.StatusCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MattermostEventDecoderTest {

    private MattermostEventDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new MattermostEventDecoder(new ObjectMapper());
    }

    @Test
    void shouldDecodePosted() {
        String frame = "{\"event\":\"posted\",\"data\":{\"channel_type\":\"O\",\"team_id\":\"team1\","
                + "\"post\":\"{\\\"id\\\":\\\"p1\\\",\\\"channel_id\\\":\\\"c1\\\",\\\"user_id\\\":\\\"u1\\\","
                + "\\\"root_id\\\":\\\"r1\\\",\\\"parent_id\\\":\\\"\\\",\\\"message\\\":\\\"hello there\\\"}\"},"
                + "\"broadcast\":{\"channel_id\":\"c1\"},\"seq\":3}";

        Event event = decoder.decode(frame);

        Event.Posted posted = assertInstanceOf(Event.Posted.class, event);
        Post post = posted.post();
        assertEquals("p1", post.getId());
        assertEquals("c1", post.getChannelId());
        assertEquals("u1", post.getUserId());
        assertEquals("r1", post.getRootId());
        assertEquals("", post.getParentId());
        assertEquals("hello there", post.getMessage());
        assertEquals("team1", post.getTeamId());
    }

    @Test
    void shouldDefaultMissingPostFieldsToEmpty() {
        String frame = "{\"event\":\"posted\",\"data\":{\"post\":\"{\\\"message\\\":\\\"hi\\\"}\"}}";

        Event.Posted posted = assertInstanceOf(Event.Posted.class, decoder.decode(frame));

        assertEquals("hi", posted.post().getMessage());
        assertEquals("", posted.post().getTeamId());
        assertEquals("", posted.post().getRootId());
    }

    @Test
    void shouldDecodeEdited() {
        String frame = "{\"event\":\"post_edited\",\"data\":{\"post\":"
                + "\"{\\\"id\\\":\\\"p1\\\",\\\"user_id\\\":\\\"u1\\\",\\\"message\\\":\\\"fixed\\\"}\"}}";

        Event.Edited edited = assertInstanceOf(Event.Edited.class, decoder.decode(frame));

        assertEquals("p1", edited.post().getId());
        assertEquals("fixed", edited.post().getMessage());
    }

    @Test
    void shouldDecodeHello() {
        String frame = "{\"event\":\"hello\",\"data\":{\"server_version\":\"9.5.0.1234\"},"
                + "\"broadcast\":{\"user_id\":\"bot-id\"},\"seq\":0}";

        Event.Hello hello = assertInstanceOf(Event.Hello.class, decoder.decode(frame));

        assertEquals("9.5.0.1234", hello.serverString());
        assertEquals("bot-id", hello.myUserId());
    }

    @Test
    void shouldDecodeOkStatus() {
        Event.StatusReceived received = assertInstanceOf(Event.StatusReceived.class,
                decoder.decode("{\"status\":\"OK\",\"seq_reply\":1}"));

        assertEquals(StatusCode.OK, received.status().getCode());
    }

    @Test
    void shouldDecodeFailStatusWithDetails() {
        String frame = "{\"status\":\"FAIL\",\"seq_reply\":1,\"error\":{\"id\":\"api.web_socket_router.not_authenticated\","
                + "\"message\":\"not authenticated\",\"detailed_error\":\"token\",\"request_id\":\"req1\","
                + "\"status_code\":401}}";

        Status status = assertInstanceOf(Event.StatusReceived.class, decoder.decode(frame)).status();

        assertEquals(StatusCode.ERROR, status.getCode());
        assertEquals("not authenticated", status.errorMessage());
        assertEquals("token", status.getError().getDetailedError());
        assertEquals("req1", status.getError().getRequestId());
        assertEquals(401, status.getError().getStatusCode());
    }

    @Test
    void shouldDecodeFailStatusWithoutDetails() {
        Status status = assertInstanceOf(Event.StatusReceived.class,
                decoder.decode("{\"status\":\"FAIL\"}")).status();

        assertEquals(StatusCode.ERROR, status.getCode());
        assertEquals("none", status.errorMessage());
        assertNull(status.getError().getRequestId());
    }

    @Test
    void shouldMarkOtherStatusUnsupported() {
        Status status = assertInstanceOf(Event.StatusReceived.class,
                decoder.decode("{\"status\":\"PENDING\"}")).status();

        assertEquals(StatusCode.UNSUPPORTED, status.getCode());
    }

    @Test
    void shouldKeepRawFrameForUnknownEvent() {
        String frame = "{\"event\":\"typing\",\"data\":{}}";

        Event.Unsupported unsupported = assertInstanceOf(Event.Unsupported.class, decoder.decode(frame));

        assertEquals(frame, unsupported.raw());
    }

    @Test
    void shouldKeepRawFrameForUndecodableText() {
        assertEquals(new Event.Unsupported("not json"), decoder.decode("not json"));
        assertEquals(new Event.Unsupported("[1,2]"), decoder.decode("[1,2]"));
    }

    @Test
    void shouldKeepRawFrameWhenNestedPostIsBroken() {
        String frame = "{\"event\":\"posted\",\"data\":{\"post\":\"{broken\"}}";

        assertEquals(new Event.Unsupported(frame), decoder.decode(frame));
    }
}
