package com.wailer.backend;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;

/** Shared OkHttp plumbing for the provider backends. */
final class ProviderHttp {

    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_READ_TIMEOUT    = Duration.ofSeconds(15);

    private ProviderHttp() {}

    static OkHttpClient client(final Duration connectTimeout, final Duration readTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .writeTimeout(readTimeout)
                .build();
    }

    static String stripTrailingSlash(final String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    static String bodyOf(final Response response) throws IOException {
        return response.body() != null ? response.body().string() : "";
    }

    static void shutdown(final OkHttpClient http) {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }
}
