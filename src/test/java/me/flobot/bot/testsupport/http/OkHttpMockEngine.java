package me.flobot.bot.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory Mattermost REST stand-in for unit tests.
 * <p>
 * Never touches the network: tests plan responses (or failures) in order, and
 * every request is recorded for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final Deque<Planned> planned = new ArrayDeque<>();
    private final Deque<CapturedRequest> captured = new ArrayDeque<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public synchronized void enqueueJson(int code, String body) {
        planned.add(new Planned(code, body != null ? body : "", null));
    }

    public synchronized void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, "", failure));
    }

    public synchronized CapturedRequest takeRequest() {
        return captured.poll();
    }

    /**
     * Total requests seen, independent of how many were taken.
     */
    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requestCount.incrementAndGet();
        Planned next;
        synchronized (this) {
            captured.add(new CapturedRequest(request.method(), request.url().encodedPath(),
                    request.header("Authorization"), readBody(request.body())));
            next = planned.poll();
        }
        if (next == null) {
            throw new IOException("No planned response for " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.code())
                .message("mock")
                .body(ResponseBody.create(next.body(), JSON))
                .build();
    }

    private static String readBody(RequestBody body) throws IOException {
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Planned(int code, String body, IOException failure) {
    }

    public record CapturedRequest(String method, String path, String authorization, String body) {
    }
}
