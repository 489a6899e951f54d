package io.ksp.client;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.ksp.spec.DeleteResult;
import io.ksp.spec.KspClientJSONException;
import io.ksp.spec.PublishResult;
import io.ksp.util.Utils;

/**
 * Decodes successful response bodies. Any deviation from the expected shape is a
 * {@link KspClientJSONException}.
 */
final class ResponseDecoder {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REFERENCE = new TypeReference<>() {};

    private ResponseDecoder() {
    }

    static PublishResult publishResult(String body) throws KspClientJSONException {
        JsonNode node = readObject(body, "publish");
        return new PublishResult(
                requiredText(node, "article_id"),
                requiredText(node, "published_id"),
                requiredText(node, "web_url"),
                images(node.get("images")),
                requiredText(node, "created_at"));
    }

    static DeleteResult deleteResult(String body) throws KspClientJSONException {
        JsonNode node = readObject(body, "delete");
        JsonNode archived = node.get("archived");
        if (archived != null && !archived.isNull() && !archived.isBoolean()) {
            throw new KspClientJSONException("Invalid delete response: 'archived' is not a boolean");
        }
        return new DeleteResult(
                requiredText(node, "article_id"),
                requiredText(node, "published_id"),
                requiredText(node, "deleted_at"),
                archived == null || archived.isNull() || archived.booleanValue());
    }

    static Map<String, Object> article(String body) throws KspClientJSONException {
        try {
            Map<String, Object> article = Utils.unmarshalFrom(body, MAP_TYPE_REFERENCE);
            if (article == null) {
                throw new KspClientJSONException("Invalid article response: body is not a JSON object");
            }
            return article;
        } catch (JsonProcessingException e) {
            throw new KspClientJSONException("Could not decode article response", e);
        }
    }

    private static JsonNode readObject(String body, String operation) throws KspClientJSONException {
        JsonNode node;
        try {
            node = Utils.OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new KspClientJSONException("Could not decode " + operation + " response", e);
        }
        if (node == null || !node.isObject()) {
            throw new KspClientJSONException("Invalid " + operation + " response: body is not a JSON object");
        }
        return node;
    }

    private static String requiredText(JsonNode node, String field) throws KspClientJSONException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new KspClientJSONException("Response is missing required field '" + field + "'");
        }
        if (!value.isValueNode()) {
            throw new KspClientJSONException("Response field '" + field + "' is not a scalar value");
        }
        return value.asText();
    }

    private static Map<String, String> images(JsonNode images) throws KspClientJSONException {
        Map<String, String> result = new LinkedHashMap<>();
        if (images == null || images.isNull()) {
            return result;
        }
        if (!images.isObject()) {
            throw new KspClientJSONException("Response field 'images' is not a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = images.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isNull()) {
                result.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return result;
    }
}
