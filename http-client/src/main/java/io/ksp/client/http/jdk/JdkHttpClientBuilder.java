package io.ksp.client.http.jdk;

import io.ksp.client.http.HttpClient;
import io.ksp.client.http.HttpClientBuilder;

/**
 * Creates transports backed by {@code java.net.http.HttpClient}.
 * <p>
 * With TLS verification disabled any server certificate is accepted, whatever host it was
 * issued for.
 */
public class JdkHttpClientBuilder implements HttpClientBuilder {

    @Override
    public HttpClient create(String url, boolean verifyTls) {
        return new JdkHttpClient(url, verifyTls);
    }
}
