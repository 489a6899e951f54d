package io.ksp.client;

import static java.net.HttpURLConnection.HTTP_BAD_REQUEST;
import static java.net.HttpURLConnection.HTTP_OK;

import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.ksp.client.http.HttpClient;
import io.ksp.client.http.HttpResponse;
import io.ksp.client.http.MultipartBody;
import io.ksp.common.KspErrorMessages;
import io.ksp.spec.ArticleMetadata;
import io.ksp.spec.DeleteResult;
import io.ksp.spec.KspApiException;
import io.ksp.spec.KspAuthenticationException;
import io.ksp.spec.KspClientJSONException;
import io.ksp.spec.KspNetworkException;
import io.ksp.spec.KspNotFoundException;
import io.ksp.spec.KspValidationException;
import io.ksp.spec.PublishResult;
import io.ksp.util.Assert;
import io.ksp.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the BugBountyKE-KSP platform API.
 * <p>
 * The API key is verified against the platform when the client is created: a constructed
 * client always holds a key that was valid at that moment, so an invalid key is reported
 * before any work starts rather than in the middle of a publication.
 * <p>
 * Every operation blocks until the platform answers or the request times out. Requests are
 * attempted once; nothing is retried. Failures are reported as {@link KspApiException}
 * subclasses (see {@link io.ksp.spec.KspErrorKind}); malformed success responses as
 * {@link KspClientJSONException}.
 * <p>
 * The client holds no mutable state besides its transport. Sharing one instance between
 * threads is as safe as the configured {@link HttpClient}; the default JDK transport supports it,
 * other transports may not.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (KspClient client = new KspClient("sk_live_...")) {
 *     PublishResult result = client.publishArticle(title, markdown, frontmatter, images, "articles/xss.md");
 *     System.out.println(result.webUrl());
 * }
 * }</pre>
 */
public class KspClient implements AutoCloseable {

    public static final String API_KEY_PREFIX = "sk_";
    public static final String USER_AGENT = "BugBountyKSP-Java-SDK/1.0";

    static final String VERIFY_PATH = "/api/auth/verify";
    static final String PUBLISH_PATH = "/api/articles/publish";
    static final String ARTICLES_PATH = "/api/articles/";

    private static final Logger LOG = LoggerFactory.getLogger(KspClient.class);
    private static final String APPLICATION_JSON = "application/json";
    private static final int MASK_VISIBLE_CHARS = 4;

    private final String apiKey;
    private final String apiUrl;
    private final String apiPath;
    private final boolean verifyTls;
    private final Duration requestTimeout;
    private final Map<String, String> headers;
    private final HttpClient httpClient;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a client for the production API and verifies the API key.
     *
     * @param apiKey the API key, starting with {@code sk_}
     * @throws KspValidationException if the API key is malformed
     * @throws KspAuthenticationException if the platform rejects the API key
     * @throws KspNetworkException if the platform cannot be reached
     */
    public KspClient(String apiKey) throws KspApiException {
        this(apiKey, KspClientConfig.defaults());
    }

    /**
     * Creates a client for the given API URL and verifies the API key.
     *
     * @param apiKey the API key, starting with {@code sk_}
     * @param apiUrl the base API URL
     * @throws KspApiException if the API key is malformed, rejected, or cannot be verified
     */
    public KspClient(String apiKey, String apiUrl) throws KspApiException {
        this(apiKey, KspClientConfig.builder().baseUrl(apiUrl).build());
    }

    /**
     * Creates a client for the given API URL and verifies the API key.
     *
     * @param apiKey the API key, starting with {@code sk_}
     * @param apiUrl the base API URL
     * @param verifyTls {@code false} to accept any server certificate
     * @throws KspApiException if the API key is malformed, rejected, or cannot be verified
     */
    public KspClient(String apiKey, String apiUrl, boolean verifyTls) throws KspApiException {
        this(apiKey, KspClientConfig.builder().baseUrl(apiUrl).verifyTls(verifyTls).build());
    }

    /**
     * Creates a client with the given settings and verifies the API key.
     * <p>
     * The key format is checked before any network activity. If the verification fails the
     * transport is closed before the exception is thrown.
     *
     * @param apiKey the API key, starting with {@code sk_}
     * @param config the connection settings
     * @throws KspValidationException if the API key or the base URL is malformed
     * @throws KspAuthenticationException if the platform does not answer the verification with 200
     * @throws KspNetworkException if the verification request fails
     */
    public KspClient(@Nullable String apiKey, KspClientConfig config) throws KspApiException {
        Assert.checkNotNullParam("config", config);
        this.apiKey = validateApiKey(apiKey);
        this.apiUrl = stripTrailingSlash(config.baseUrl());
        this.apiPath = pathOf(apiUrl);
        this.verifyTls = config.verifyTls();
        this.requestTimeout = config.requestTimeout();

        Map<String, String> requestHeaders = new LinkedHashMap<>();
        requestHeaders.put("Authorization", "Bearer " + this.apiKey);
        requestHeaders.put("User-Agent", USER_AGENT);
        requestHeaders.put("Accept", APPLICATION_JSON);
        this.headers = Collections.unmodifiableMap(requestHeaders);

        try {
            this.httpClient = config.httpClientBuilder().create(apiUrl, verifyTls);
        } catch (IllegalArgumentException e) {
            throw new KspValidationException("Invalid API URL: " + apiUrl, e);
        }
        LOG.debug("Created client for {} with API key {} (TLS verification {})",
                apiUrl, maskApiKey(this.apiKey), verifyTls ? "on" : "off");

        try {
            verifyAuthentication(config.verifyTimeout());
        } catch (KspApiException | RuntimeException e) {
            httpClient.close();
            throw e;
        }
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    /**
     * @return the headers sent with every request
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Publishes a new article.
     * <p>
     * Without images the request is a JSON body; with at least one image it is a multipart form
     * where each image is a part named {@code images[<filename>]}. In both cases the frontmatter
     * travels as a JSON-encoded string field.
     *
     * @param title the article title
     * @param content the processed markdown content, referencing images by relative path
     * @param frontmatter the article frontmatter
     * @param images raw image bytes keyed by filename; may be {@code null} or empty
     * @param filePath the source file path, sent for traceability; may be {@code null}
     * @return the publication result
     * @throws KspValidationException if title or content is empty, or the frontmatter is missing
     *         or cannot be serialized; also for 400/422 responses
     * @throws KspApiException if the request fails
     * @throws KspClientJSONException if the response lacks a required field
     */
    public PublishResult publishArticle(@Nullable String title, @Nullable String content,
                                        @Nullable Map<String, ?> frontmatter, @Nullable Map<String, byte[]> images,
                                        @Nullable String filePath) throws KspApiException, KspClientJSONException {
        if (title == null || title.isEmpty() || content == null || content.isEmpty()) {
            throw new KspValidationException(KspErrorMessages.TITLE_AND_CONTENT_REQUIRED);
        }
        if (frontmatter == null) {
            throw new KspValidationException(KspErrorMessages.FRONTMATTER_REQUIRED);
        }

        String serializedFrontmatter;
        try {
            serializedFrontmatter = Utils.toJsonString(frontmatter);
        } catch (JsonProcessingException e) {
            throw new KspValidationException("Frontmatter cannot be serialized to JSON: " + e.getOriginalMessage(), e);
        }

        Map<String, @Nullable Object> data = new LinkedHashMap<>();
        data.put("title", title);
        data.put("content", content);
        data.put("frontmatter", serializedFrontmatter);
        data.put("file_path", filePath);

        HttpResponse response;
        if (images == null || images.isEmpty()) {
            response = request("POST", PUBLISH_PATH, data, null, requestTimeout);
        } else {
            MultipartBody.Builder multipart = MultipartBody.builder();
            for (Map.Entry<String, @Nullable Object> field : data.entrySet()) {
                if (field.getValue() != null) {
                    multipart.addFormField(field.getKey(), String.valueOf(field.getValue()));
                }
            }
            for (Map.Entry<String, byte[]> image : images.entrySet()) {
                multipart.addFilePart("images[" + image.getKey() + "]", image.getKey(), image.getValue());
            }
            response = request("POST", PUBLISH_PATH, null, multipart.build(), requestTimeout);
        }

        PublishResult result = ResponseDecoder.publishResult(response.body());
        LOG.debug("Published article {} at {}", result.publishedId(), result.webUrl());
        return result;
    }

    /**
     * Publishes a new article described by its metadata.
     *
     * @param metadata the article metadata; its title is the article title
     * @param content the processed markdown content
     * @param images raw image bytes keyed by filename; may be {@code null} or empty
     * @param filePath the source file path; may be {@code null}
     * @return the publication result
     * @throws KspApiException if the request fails
     * @throws KspClientJSONException if the response lacks a required field
     * @see #publishArticle(String, String, Map, Map, String)
     */
    public PublishResult publishArticle(ArticleMetadata metadata, @Nullable String content,
                                        @Nullable Map<String, byte[]> images, @Nullable String filePath)
            throws KspApiException, KspClientJSONException {
        Assert.checkNotNullParam("metadata", metadata);
        return publishArticle(metadata.title(), content, metadata.toFrontmatter(), images, filePath);
    }

    /**
     * Fetches an article.
     * <p>
     * The platform does not publish a schema for this payload, so it is returned as decoded.
     *
     * @param publishedId the article's published id
     * @return the decoded JSON object
     * @throws KspNotFoundException if there is no such article
     * @throws KspApiException if the request fails
     * @throws KspClientJSONException if the body is not a JSON object
     */
    public Map<String, Object> getArticle(@Nullable String publishedId) throws KspApiException, KspClientJSONException {
        HttpResponse response = request("GET", articlePath(publishedId), null, null, requestTimeout);
        return ResponseDecoder.article(response.body());
    }

    /**
     * Deletes an article. Only the owner or a moderator may do so.
     * <p>
     * The platform archives articles by default; {@link DeleteResult#archived()} is {@code true}
     * unless the platform says otherwise.
     *
     * @param publishedId the article's published id
     * @return the deletion result
     * @throws KspNotFoundException if there is no such article
     * @throws KspAuthenticationException if the key may not delete the article
     * @throws KspApiException if the request fails
     * @throws KspClientJSONException if the response lacks a required field
     */
    public DeleteResult deleteArticle(@Nullable String publishedId) throws KspApiException, KspClientJSONException {
        HttpResponse response = request("DELETE", articlePath(publishedId), null, null, requestTimeout);
        DeleteResult result = ResponseDecoder.deleteResult(response.body());
        LOG.debug("Deleted article {} (archived: {})", result.publishedId(), result.archived());
        return result;
    }

    /**
     * Closes the transport. Further requests fail with a {@link KspNetworkException}.
     * Calling this more than once has no effect.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            httpClient.close();
            LOG.debug("Closed client for {}", apiUrl);
        }
    }

    /**
     * Sends one authenticated request.
     * <p>
     * At most one of {@code jsonBody} and {@code multipart} may be given. A JSON body is sent
     * with {@code Content-Type: application/json}; for a multipart body the transport sets the
     * content type with its boundary.
     *
     * @param method {@code GET}, {@code POST} or {@code DELETE}
     * @param endpoint the endpoint path, starting with {@code /}
     * @param jsonBody the value to send as JSON, or {@code null}
     * @param multipart the form to send, or {@code null}
     * @param timeout the request timeout
     * @return the response, whose status is below 400
     * @throws KspValidationException if the request cannot be built
     * @throws KspNetworkException if no response was received
     * @throws KspApiException the classified error for a status of 400 or above
     */
    HttpResponse request(String method, String endpoint, @Nullable Object jsonBody,
                         @Nullable MultipartBody multipart, Duration timeout) throws KspApiException {
        if (jsonBody != null && multipart != null) {
            throw new IllegalArgumentException("A request carries either a JSON body or a multipart body, not both");
        }

        CompletableFuture<HttpResponse> future;
        try {
            future = send(method, apiPath + endpoint, jsonBody, multipart, timeout);
        } catch (IllegalArgumentException e) {
            // the transport message may quote header values
            throw new KspValidationException("Invalid request: " + method + " " + endpoint, e);
        }

        LOG.debug("{} {}{}", method, endpoint, multipart != null ? " (multipart)" : "");
        HttpResponse response;
        try {
            response = future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KspNetworkException("Request interrupted", e);
        } catch (ExecutionException e) {
            throw toNetworkException(e.getCause(), timeout);
        }

        if (response.statusCode() >= HTTP_BAD_REQUEST) {
            KspApiException error = ResponseErrorMapper.mapHttpError(response);
            LOG.debug("{} {} failed with status {}: {}", method, endpoint, response.statusCode(), error.getMessage());
            throw error;
        }
        return response;
    }

    private CompletableFuture<HttpResponse> send(String method, String path, @Nullable Object jsonBody,
                                                 @Nullable MultipartBody multipart, Duration timeout)
            throws KspValidationException {
        switch (method) {
            case "GET":
                return httpClient.get(path).addHeaders(headers).timeout(timeout).send();
            case "DELETE":
                return httpClient.delete(path).addHeaders(headers).timeout(timeout).send();
            case "POST":
                HttpClient.PostRequestBuilder post = httpClient.post(path)
                        .addHeaders(headers)
                        .timeout(timeout);
                if (multipart != null) {
                    post.body(multipart);
                } else if (jsonBody != null) {
                    post.addHeader("Content-Type", APPLICATION_JSON).body(toJson(jsonBody));
                }
                return post.send();
            default:
                throw new IllegalArgumentException("Unsupported HTTP method: " + method);
        }
    }

    private void verifyAuthentication(Duration verifyTimeout) throws KspApiException {
        HttpResponse response;
        try {
            response = request("GET", VERIFY_PATH, null, null, verifyTimeout);
        } catch (KspNetworkException e) {
            throw new KspNetworkException(
                    KspErrorMessages.AUTHENTICATION_VERIFICATION_FAILED + ": " + e.getMessage(), e);
        } catch (KspApiException e) {
            if (e.getStatusCode() == null) {
                // rejected locally, the platform never answered
                throw e;
            }
            throw new KspAuthenticationException(KspErrorMessages.INVALID_API_KEY,
                    e.getStatusCode(), e.getResponse(), e);
        }

        if (response.statusCode() != HTTP_OK) {
            throw new KspAuthenticationException(KspErrorMessages.INVALID_API_KEY, response.statusCode(), null);
        }
        LOG.debug("API key {} verified against {}", maskApiKey(apiKey), apiUrl);
    }

    private static KspNetworkException toNetworkException(@Nullable Throwable cause, Duration timeout) {
        Throwable failure = cause;
        while (failure instanceof CompletionException && failure.getCause() != null) {
            failure = failure.getCause();
        }
        if (failure == null) {
            return new KspNetworkException("Request failed");
        }
        if (failure instanceof HttpTimeoutException) {
            return new KspNetworkException("Request timeout after " + formatTimeout(timeout), failure);
        }
        if (failure instanceof ConnectException) {
            return new KspNetworkException("Connection failed: " + describe(failure), failure);
        }
        return new KspNetworkException("Request failed: " + describe(failure), failure);
    }

    private static String describe(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }

    private static String formatTimeout(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    private static String toJson(Object value) throws KspValidationException {
        try {
            return Utils.toJsonString(value);
        } catch (JsonProcessingException e) {
            throw new KspValidationException("Request body cannot be serialized to JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String validateApiKey(@Nullable String apiKey) throws KspValidationException {
        if (apiKey == null || apiKey.isEmpty()) {
            throw new KspValidationException(KspErrorMessages.API_KEY_REQUIRED);
        }
        if (!apiKey.startsWith(API_KEY_PREFIX)) {
            throw new KspValidationException(KspErrorMessages.API_KEY_INVALID_FORMAT);
        }
        if (apiKey.chars().anyMatch(c -> Character.isWhitespace(c) || Character.isISOControl(c))) {
            throw new KspValidationException(KspErrorMessages.API_KEY_INVALID_CHARACTERS);
        }
        return apiKey;
    }

    private static String articlePath(@Nullable String publishedId) throws KspValidationException {
        if (publishedId == null || publishedId.isEmpty()) {
            throw new KspValidationException(KspErrorMessages.PUBLISHED_ID_REQUIRED);
        }
        return ARTICLES_PATH + URLEncoder.encode(publishedId, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String pathOf(String apiUrl) throws KspValidationException {
        try {
            String path = new URI(apiUrl).getRawPath();
            return path == null ? "" : path;
        } catch (URISyntaxException e) {
            throw new KspValidationException("Invalid API URL: " + apiUrl, e);
        }
    }

    /**
     * Masks an API key for logging: the prefix and the last four characters stay visible.
     */
    static String maskApiKey(String apiKey) {
        int prefixLength = API_KEY_PREFIX.length();
        if (apiKey.length() <= MASK_VISIBLE_CHARS) {
            return "*".repeat(apiKey.length());
        }
        if (apiKey.length() <= prefixLength + MASK_VISIBLE_CHARS) {
            return API_KEY_PREFIX + "*".repeat(apiKey.length() - prefixLength);
        }
        String visibleEnd = apiKey.substring(apiKey.length() - MASK_VISIBLE_CHARS);
        return API_KEY_PREFIX + "*".repeat(apiKey.length() - prefixLength - MASK_VISIBLE_CHARS) + visibleEnd;
    }
}
