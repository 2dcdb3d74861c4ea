package io.cryojob4j.internal.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cryojob4j.core.JobParameters;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a submitted JSON form into {@link JobParameters}.
 *
 * <p>Top-level fields only. Strings, numbers, booleans and nulls keep their type; nested arrays
 * and objects are kept as their compact JSON text.
 */
public class JsonJobParameters {

    private final ObjectMapper objectMapper;

    public JsonJobParameters(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public JobParameters read(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return read(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job parameters are not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the node is not a JSON object
     */
    public JobParameters read(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JobParameters.empty();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Job parameters must be a JSON object, got " + node.getNodeType());
        }
        JobParameters.Builder params = JobParameters.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            params.put(field.getKey(), scalar(field.getValue()));
        }
        return params.build();
    }

    private static Object scalar(JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        return value.toString();
    }
}
