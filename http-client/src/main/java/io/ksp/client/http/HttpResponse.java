package io.ksp.client.http;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * Returns the response body decoded as UTF-8 text.
     *
     * @return the body, may be empty but not null
     */
    String body();
}
