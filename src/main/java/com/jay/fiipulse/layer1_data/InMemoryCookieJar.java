package com.jay.fiipulse.layer1_data;

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session-scoped cookie store. The exchange's bot protection sets its cookies on the landing
 * page; they must be replayed on every subsequent API call of the same session.
 */
public class InMemoryCookieJar implements CookieJar {

    // name|domain|path -> cookie; later responses overwrite earlier ones
    private final Map<String, Cookie> store = new LinkedHashMap<>();

    @Override
    public synchronized void saveFromResponse(HttpUrl url, List<Cookie> cookies) {
        for (Cookie c : cookies) {
            store.put(c.name() + "|" + c.domain() + "|" + c.path(), c);
        }
    }

    @Override
    public synchronized List<Cookie> loadForRequest(HttpUrl url) {
        long now = System.currentTimeMillis();
        store.values().removeIf(c -> c.expiresAt() < now);
        List<Cookie> matching = new ArrayList<>();
        for (Cookie c : store.values()) {
            if (c.matches(url)) matching.add(c);
        }
        return matching;
    }

    public synchronized List<String> names() {
        return store.values().stream().map(Cookie::name).toList();
    }
}
