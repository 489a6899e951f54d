package io.ksp.client.http;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Transport used by the KSP client to reach the platform.
 * <p>
 * An instance is bound to the scheme and authority of one base URL; request paths are resolved
 * against it. Requests complete exceptionally with an {@link java.io.IOException} when no HTTP
 * response is received. Error statuses are not failures at this level: they are returned as
 * ordinary {@link HttpResponse}s for the caller to classify.
 * <p>
 * Once {@link #close()} has been called every new request fails.
 */
public interface HttpClient extends AutoCloseable {

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    DeleteRequestBuilder delete(String path);

    /**
     * Releases the resources held by this client. Calling it more than once has no effect.
     */
    @Override
    void close();

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);

        T timeout(Duration timeout);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {
        PostRequestBuilder body(@Nullable String body);

        /**
         * Sends the given multipart form as the request body. The transport sets the
         * {@code Content-Type} header, including the boundary.
         */
        PostRequestBuilder body(MultipartBody body);

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }

    interface DeleteRequestBuilder extends RequestBuilder<DeleteRequestBuilder> {

    }
}
