/**
 * HTTP transport abstraction for the KSP platform client.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.ksp.client.http.HttpClient} - request builders for GET, POST and DELETE</li>
 *   <li>{@link io.ksp.client.http.HttpClientBuilder} - factory, defaulting to the JDK implementation</li>
 *   <li>{@link io.ksp.client.http.HttpResponse} - status code and body</li>
 *   <li>{@link io.ksp.client.http.MultipartBody} - {@code multipart/form-data} encoder used for uploads</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (HttpClient client = HttpClientBuilder.DEFAULT_FACTORY.create("https://api.bugbounty-ksp.com", true)) {
 *     HttpResponse response = client.get("/api/auth/verify")
 *             .addHeader("Authorization", "Bearer sk_...")
 *             .timeout(Duration.ofSeconds(5))
 *             .send()
 *             .get();
 * }
 * }</pre>
 *
 * @see io.ksp.client.http.jdk.JdkHttpClientBuilder
 */
@NullMarked
package io.ksp.client.http;

import org.jspecify.annotations.NullMarked;
