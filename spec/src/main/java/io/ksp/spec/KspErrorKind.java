package io.ksp.spec;

/**
 * The kinds of failure reported by the SDK.
 * <p>
 * Every {@link KspApiException} reports exactly one kind through {@link KspApiException#getKind()}.
 *
 * @see KspApiException
 */
public enum KspErrorKind {
    /** The API key was rejected (HTTP 401/403) or the startup verification failed. */
    AUTHENTICATION,

    /** Malformed caller input, or an HTTP 400/422 response. */
    VALIDATION,

    /** HTTP 429. */
    RATE_LIMIT,

    /** HTTP 404. */
    NOT_FOUND,

    /** The request never produced an HTTP response: timeout, refused connection, DNS or TLS failure. */
    NETWORK,

    /** Any other HTTP status of 400 or above. */
    API
}
