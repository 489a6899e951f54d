package io.ksp.client;

import java.time.Duration;

import io.ksp.client.http.HttpClientBuilder;
import io.ksp.util.Assert;
import io.ksp.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Connection settings for a {@link KspClient}.
 *
 * @param baseUrl the platform base URL; a trailing slash is ignored
 * @param verifyTls {@code false} to accept any server certificate, for local or staging servers
 * @param requestTimeout the timeout applied to every API request
 * @param verifyTimeout the timeout of the API key verification performed when the client is created
 * @param httpClientBuilder the factory of the underlying transport
 */
public record KspClientConfig(String baseUrl, boolean verifyTls, Duration requestTimeout, Duration verifyTimeout,
                              HttpClientBuilder httpClientBuilder) {

    /** Production API. */
    public static final String DEFAULT_API_URL = "https://api.bugbounty-ksp.com";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_VERIFY_TIMEOUT = Duration.ofSeconds(5);

    public KspClientConfig {
        Assert.checkNotNullParam("baseUrl", baseUrl);
        Assert.checkPositive("requestTimeout", requestTimeout);
        Assert.checkPositive("verifyTimeout", verifyTimeout);
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
    }

    /**
     * @return the production settings: default URL, TLS verification on, default timeouts
     */
    public static KspClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing instances. Unset values take the defaults.
     */
    public static class Builder {
        private @Nullable String baseUrl;
        private boolean verifyTls = true;
        private @Nullable Duration requestTimeout;
        private @Nullable Duration verifyTimeout;
        private @Nullable HttpClientBuilder httpClientBuilder;

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder verifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder verifyTimeout(Duration verifyTimeout) {
            this.verifyTimeout = verifyTimeout;
            return this;
        }

        /**
         * Sets the transport factory, for example to plug in a different HTTP stack.
         *
         * @param httpClientBuilder the factory
         * @return this builder for method chaining
         */
        public Builder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
            this.httpClientBuilder = httpClientBuilder;
            return this;
        }

        public KspClientConfig build() {
            return new KspClientConfig(
                    Utils.defaultIfNull(baseUrl, DEFAULT_API_URL),
                    verifyTls,
                    Utils.defaultIfNull(requestTimeout, DEFAULT_REQUEST_TIMEOUT),
                    Utils.defaultIfNull(verifyTimeout, DEFAULT_VERIFY_TIMEOUT),
                    Utils.defaultIfNull(httpClientBuilder, HttpClientBuilder.DEFAULT_FACTORY));
        }
    }
}
