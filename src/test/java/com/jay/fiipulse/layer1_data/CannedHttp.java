package com.jay.fiipulse.layer1_data;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Offline HTTP for provider tests. Responses are queued per URL-path fragment and served in
 * order; the last queued response for a fragment repeats. Every request is recorded.
 */
public class CannedHttp implements Interceptor {

    public interface Reply {
        Response build(Request request) throws IOException;
    }

    private final Map<String, Deque<Reply>> routes = new LinkedHashMap<>();
    private final List<Request> requests = new ArrayList<>();

    public CannedHttp on(String pathFragment, Reply... replies) {
        routes.computeIfAbsent(pathFragment, k -> new ArrayDeque<>()).addAll(List.of(replies));
        return this;
    }

    public HttpClientFactory factory() {
        return new HttpClientFactory(List.of(this));
    }

    public synchronized List<Request> requests() {
        return List.copyOf(requests);
    }

    public synchronized List<String> paths() {
        return requests.stream().map(r -> r.url().encodedPath()).toList();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        Reply reply;
        synchronized (this) {
            requests.add(request);
            reply = match(request.url().toString());
        }
        if (reply == null) return respond(request, 404, "", "text/plain");
        return reply.build(request);
    }

    private Reply match(String url) {
        String best = null;
        for (String fragment : routes.keySet()) {
            if (url.contains(fragment) && (best == null || fragment.length() > best.length())) best = fragment;
        }
        if (best == null) return null;
        Deque<Reply> queue = routes.get(best);
        return queue.size() > 1 ? queue.poll() : queue.peek();
    }

    public static Reply ok(String body, String contentType) {
        return request -> respond(request, 200, body, contentType);
    }

    public static Reply status(int code, String body) {
        return request -> respond(request, code, body, "text/plain");
    }

    public static Reply failure(String message) {
        return request -> {
            throw new IOException(message);
        };
    }

    public static Response respond(Request request, int code, String body, String contentType) {
        return new Response.Builder()
            .request(request)
            .protocol(Protocol.HTTP_1_1)
            .code(code)
            .message(code == 200 ? "OK" : "Error")
            .body(ResponseBody.create(body, MediaType.get(contentType)))
            .build();
    }
}
