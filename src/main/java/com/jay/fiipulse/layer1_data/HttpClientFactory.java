package com.jay.fiipulse.layer1_data;

import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Builds OkHttp clients for the data providers. Extra interceptors are applied to every client,
 * which lets tests serve canned responses without a network.
 */
@Component
public class HttpClientFactory {

    private final List<Interceptor> interceptors;

    public HttpClientFactory() {
        this(List.of());
    }

    public HttpClientFactory(List<Interceptor> interceptors) {
        this.interceptors = List.copyOf(interceptors);
    }

    public OkHttpClient newClient(int connectTimeoutSeconds, int readTimeoutSeconds) {
        return builder(connectTimeoutSeconds, readTimeoutSeconds).build();
    }

    /** Client with its own cookie jar; one per provider session. */
    public OkHttpClient newSessionClient(int connectTimeoutSeconds, int readTimeoutSeconds, InMemoryCookieJar jar) {
        return builder(connectTimeoutSeconds, readTimeoutSeconds)
            .cookieJar(jar)
            .build();
    }

    private OkHttpClient.Builder builder(int connectTimeoutSeconds, int readTimeoutSeconds) {
        OkHttpClient.Builder b = new OkHttpClient.Builder()
            .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
            .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
            .followRedirects(true);
        interceptors.forEach(b::addInterceptor);
        return b;
    }
}
