package io.ksp.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.util.Map;

import io.ksp.client.http.HttpResponse;
import io.ksp.spec.KspApiException;
import io.ksp.spec.KspAuthenticationException;
import io.ksp.spec.KspErrorKind;
import org.junit.jupiter.api.Test;

public class ResponseErrorMapperTest {

    private record TestResponse(int statusCode, String body) implements HttpResponse {
    }

    @Test
    public void testMissingErrorFieldUsesStatus() {
        KspApiException e = ResponseErrorMapper.mapHttpError(new TestResponse(500, "{}"));

        assertEquals("API error: HTTP 500", e.getMessage());
        assertEquals(KspErrorKind.API, e.getKind());
    }

    @Test
    public void testBlankErrorFieldUsesStatus() {
        KspApiException e = ResponseErrorMapper.mapHttpError(new TestResponse(404, "{\"error\": \"  \"}"));

        assertEquals("Not found: HTTP 404", e.getMessage());
    }

    @Test
    public void testEmptyBody() {
        KspApiException e = ResponseErrorMapper.mapHttpError(new TestResponse(403, ""));

        assertInstanceOf(KspAuthenticationException.class, e);
        assertEquals("Forbidden: HTTP 403. Check your permissions.", e.getMessage());
        assertEquals(Map.of("error", ""), e.getResponse());
    }

    @Test
    public void testStructuredErrorIsSerialized() {
        KspApiException e = ResponseErrorMapper.mapHttpError(
                new TestResponse(422, "{\"error\": {\"field\": \"title\"}}"));

        assertEquals(KspErrorKind.VALIDATION, e.getKind());
        assertEquals("Validation error: {\"field\":\"title\"}", e.getMessage());
    }

    @Test
    public void testJsonArrayBodyIsKeptRaw() {
        Map<String, Object> decoded = ResponseErrorMapper.decodeErrorBody("[1, 2]");

        assertEquals(Map.of("error", "[1, 2]"), decoded);
    }

    @Test
    public void testUnknownClientErrorIsApiError() {
        KspApiException e = ResponseErrorMapper.mapHttpError(new TestResponse(409, "{\"error\": \"Duplicate slug\"}"));

        assertEquals(KspErrorKind.API, e.getKind());
        assertEquals("API error: Duplicate slug", e.getMessage());
        assertEquals(409, e.getStatusCode());
    }
}
