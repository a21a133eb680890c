package io.a2a.lite.client;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import io.a2a.lite.util.Assert;
import io.a2a.lite.util.EventChannel;

/**
 * Settings of an {@link A2AClient}.
 * <p>
 * Use {@link #builder()}; every setting has a default.
 */
public final class A2AClientConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final String DEFAULT_USER_AGENT = "a2a-lite-client/0.1";

    private final Duration timeout;
    private final String userAgent;
    private final int streamBufferSize;
    private final Map<String, String> headers;

    private A2AClientConfig(Builder builder) {
        this.timeout = builder.timeout;
        this.userAgent = builder.userAgent;
        this.streamBufferSize = builder.streamBufferSize;
        this.headers = Map.copyOf(builder.headers);
    }

    /**
     * @return the HTTP request timeout; for streams it bounds the wait for the response headers and for an error body
     */
    public Duration getTimeout() {
        return timeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    /**
     * @return the capacity of the channels returned by the streaming calls
     */
    public int getStreamBufferSize() {
        return streamBufferSize;
    }

    /**
     * @return extra headers sent with every request, e.g. {@code Authorization}
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration timeout = DEFAULT_TIMEOUT;
        private String userAgent = DEFAULT_USER_AGENT;
        private int streamBufferSize = EventChannel.DEFAULT_CAPACITY;
        private final Map<String, String> headers = new HashMap<>();

        private Builder() {
        }

        public Builder timeout(Duration timeout) {
            Assert.checkNotNullParam("timeout", timeout);
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = Assert.checkNotBlankParam("userAgent", userAgent);
            return this;
        }

        public Builder streamBufferSize(int streamBufferSize) {
            if (streamBufferSize <= 0) {
                throw new IllegalArgumentException("streamBufferSize must be greater than 0");
            }
            this.streamBufferSize = streamBufferSize;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(Assert.checkNotBlankParam("name", name), Assert.checkNotNullParam("value", value));
            return this;
        }

        public A2AClientConfig build() {
            return new A2AClientConfig(this);
        }
    }
}
