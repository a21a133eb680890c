package io.a2a.lite.client.http.jdk;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import io.a2a.lite.client.http.A2AHttpClient;
import io.a2a.lite.client.http.A2AHttpResponse;
import io.a2a.lite.client.http.A2AHttpStreamResponse;
import io.a2a.lite.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link A2AHttpClient} backed by the JDK's {@link HttpClient}.
 */
public class JdkA2AHttpClient implements A2AHttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkA2AHttpClient.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkA2AHttpClient() {
        this(DEFAULT_TIMEOUT);
    }

    public JdkA2AHttpClient(Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(requestTimeout)
                .build(), requestTimeout);
    }

    public JdkA2AHttpClient(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Assert.checkNotNullParam("httpClient", httpClient);
        this.requestTimeout = Assert.checkNotNullParam("requestTimeout", requestTimeout);
    }

    Duration getRequestTimeout() {
        return requestTimeout;
    }

    @Override
    public PostBuilder createPost() {
        return new JdkPostBuilder();
    }

    private class JdkPostBuilder implements PostBuilder {
        private @Nullable String url;
        private final Map<String, String> headers = new HashMap<>();
        private String body = "";

        @Override
        public PostBuilder url(String url) {
            this.url = url;
            return this;
        }

        @Override
        public PostBuilder addHeader(String name, String value) {
            headers.put(name, value);
            return this;
        }

        @Override
        public PostBuilder addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return this;
        }

        @Override
        public PostBuilder body(String body) {
            this.body = body;
            return this;
        }

        private HttpRequest createRequest() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(Assert.checkNotNullParam("url", url)))
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder.build();
        }

        @Override
        public A2AHttpResponse post() throws IOException, InterruptedException {
            HttpResponse<String> response = httpClient.send(createRequest(), BodyHandlers.ofString(StandardCharsets.UTF_8));
            LOGGER.debug("POST {} -> {}", url, response.statusCode());
            return new JdkHttpResponse(response);
        }

        @Override
        public A2AHttpStreamResponse postForStream() throws IOException, InterruptedException {
            HttpResponse<InputStream> response = httpClient.send(createRequest(), BodyHandlers.ofInputStream());
            LOGGER.debug("POST {} (stream) -> {}", url, response.statusCode());
            return new JdkHttpStreamResponse(response);
        }
    }

    private record JdkHttpResponse(HttpResponse<String> response) implements A2AHttpResponse {

        @Override
        public int status() {
            return response.statusCode();
        }

        @Override
        public @Nullable String header(String name) {
            return response.headers().firstValue(name).orElse(null);
        }

        @Override
        public String body() {
            String body = response.body();
            return body != null ? body : "";
        }
    }

    private record JdkHttpStreamResponse(HttpResponse<InputStream> response) implements A2AHttpStreamResponse {

        @Override
        public int status() {
            return response.statusCode();
        }

        @Override
        public @Nullable String header(String name) {
            return response.headers().firstValue(name).orElse(null);
        }

        @Override
        public InputStream body() {
            return response.body();
        }

        @Override
        public void close() {
            try {
                response.body().close();
            } catch (IOException e) {
                LOGGER.debug("Error closing response body: {}", e.getMessage(), e);
            }
        }
    }
}
