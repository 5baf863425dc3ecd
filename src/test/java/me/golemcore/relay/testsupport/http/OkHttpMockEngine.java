package me.golemcore.relay.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * OkHttp interceptor that answers from a script instead of the network.
 * <p>
 * Tests plan replies (or I/O failures) in order; every request that reaches
 * the interceptor is recorded, planned or not.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<Reply> replies = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> captured = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public void enqueueJson(int code, String body) {
        replies.add(new Reply(code, body != null ? body : "", null));
    }

    public void enqueueFailure(IOException failure) {
        replies.add(new Reply(0, null, failure));
    }

    public CapturedRequest takeRequest() {
        return captured.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request, readBody(request)));
        requestCount.incrementAndGet();

        Reply reply = replies.poll();
        if (reply == null) {
            throw new IOException("Unplanned request: " + request.method() + " " + request.url());
        }
        if (reply.failure() != null) {
            throw reply.failure();
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("mock")
                .body(ResponseBody.create(reply.body(), JSON))
                .build();
    }

    private static String readBody(Request request) throws IOException {
        if (request.body() == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Reply(int code, String body, IOException failure) {
    }

    /**
     * Request as seen by the interceptor.
     */
    public record CapturedRequest(Request request, String body) {

        public String method() {
            return request.method();
        }

        public String path() {
            return request.url().encodedPath();
        }

        public String queryParameter(String name) {
            return request.url().queryParameter(name);
        }

        public String header(String name) {
            return request.header(name);
        }
    }
}
