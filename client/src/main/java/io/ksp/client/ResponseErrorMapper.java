package io.ksp.client;

import static java.net.HttpURLConnection.HTTP_BAD_REQUEST;
import static java.net.HttpURLConnection.HTTP_FORBIDDEN;
import static java.net.HttpURLConnection.HTTP_NOT_FOUND;
import static java.net.HttpURLConnection.HTTP_UNAUTHORIZED;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.ksp.client.http.HttpResponse;
import io.ksp.common.KspErrorMessages;
import io.ksp.spec.KspApiException;
import io.ksp.spec.KspAuthenticationException;
import io.ksp.spec.KspNotFoundException;
import io.ksp.spec.KspRateLimitException;
import io.ksp.spec.KspValidationException;
import io.ksp.util.Utils;

/**
 * Turns HTTP error responses into the matching {@link KspApiException} subclass.
 * <p>
 * The message is built from the {@code error} field of the JSON body, or {@code HTTP <status>}
 * when there is none. A body that is not a JSON object is kept as {@code {"error": <raw text>}}.
 */
final class ResponseErrorMapper {

    static final int HTTP_UNPROCESSABLE_ENTITY = 422;
    static final int HTTP_TOO_MANY_REQUESTS = 429;

    private static final String ERROR_FIELD = "error";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REFERENCE = new TypeReference<>() {};

    private ResponseErrorMapper() {
    }

    static KspApiException mapHttpError(HttpResponse response) {
        int status = response.statusCode();
        Map<String, Object> errorData = decodeErrorBody(response.body());
        String errorMessage = errorMessage(errorData, status);

        switch (status) {
            case HTTP_UNAUTHORIZED:
                return new KspAuthenticationException("Unauthorized: " + errorMessage + ". Check your API key.",
                        status, errorData);
            case HTTP_FORBIDDEN:
                return new KspAuthenticationException("Forbidden: " + errorMessage + ". Check your permissions.",
                        status, errorData);
            case HTTP_NOT_FOUND:
                return new KspNotFoundException("Not found: " + errorMessage, status, errorData);
            case HTTP_BAD_REQUEST:
            case HTTP_UNPROCESSABLE_ENTITY:
                return new KspValidationException("Validation error: " + errorMessage, status, errorData);
            case HTTP_TOO_MANY_REQUESTS:
                // retry_after in the body is deliberately not surfaced
                return new KspRateLimitException(KspErrorMessages.RATE_LIMIT_EXCEEDED, status, errorData);
            default:
                return new KspApiException("API error: " + errorMessage, status, errorData);
        }
    }

    static Map<String, Object> decodeErrorBody(String body) {
        try {
            Map<String, Object> decoded = Utils.unmarshalFrom(body, MAP_TYPE_REFERENCE);
            return decoded != null ? decoded : rawError(body);
        } catch (JsonProcessingException e) {
            return rawError(body);
        }
    }

    private static Map<String, Object> rawError(String body) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(ERROR_FIELD, body);
        return raw;
    }

    private static String errorMessage(Map<String, Object> errorData, int status) {
        Object error = errorData.get(ERROR_FIELD);
        if (error == null || asText(error).isBlank()) {
            return "HTTP " + status;
        }
        return asText(error);
    }

    private static String asText(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        try {
            return Utils.toJsonString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
