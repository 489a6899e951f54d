package io.ksp.client.http;

import io.ksp.client.http.jdk.JdkHttpClientBuilder;

public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    /**
     * Creates a client for the given base URL.
     *
     * @param url the base URL; only its scheme and authority are used
     * @param verifyTls {@code false} to accept any server certificate
     * @return a new client
     * @throws IllegalArgumentException if the URL is not valid
     */
    HttpClient create(String url, boolean verifyTls);
}
