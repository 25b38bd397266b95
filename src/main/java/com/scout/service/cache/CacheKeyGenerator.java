package com.scout.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scout.model.InferenceRequest;
import com.scout.model.Message;
import com.scout.model.ResponseFormat;
import org.apache.commons.codec.digest.DigestUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives stable cache keys from inference requests.
 *
 * Steps:
 * 1. Project the request onto the fields that shape the completion
 * 2. Drop nulls and sort JSON keys recursively
 * 3. Normalize numbers (1, 1.0 and 1.00 are the same value)
 * 4. SHA-256 over the canonical string
 *
 * String content is kept byte-exact: prompts that differ in whitespace are different prompts.
 */
public class CacheKeyGenerator {

    private final ObjectMapper objectMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Generate the cache key for a resolved request.
     *
     * @param request request with generation parameters already defaulted
     * @param model   model the request will run on
     * @return SHA-256 hash (64 hex chars)
     */
    public String generateKey(InferenceRequest request, String model) {
        return DigestUtils.sha256Hex(canonicalize(request, model));
    }

    /**
     * Canonical JSON string of the cache-relevant request fields.
     */
    public String canonicalize(InferenceRequest request, String model) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("model", model);
        node.put("system", request.getSystem());
        if (request.getTemperature() != null) {
            node.put("temperature", request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            node.put("max_tokens", request.getMaxTokens());
        }
        ResponseFormat format = request.getResponseFormat() != null ? request.getResponseFormat() : ResponseFormat.TEXT;
        node.put("response_format", format.getValue());

        ArrayNode messages = node.putArray("messages");
        if (request.getMessages() != null) {
            for (Message message : request.getMessages()) {
                ObjectNode m = messages.addObject();
                m.put("role", message.getRole() != null ? message.getRole().getValue() : null);
                m.put("content", message.getContent());
            }
        }

        StringBuilder sb = new StringBuilder();
        serializeNode(canonicalizeNode(node), sb);
        return sb.toString();
    }

    private JsonNode canonicalizeNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }

        if (node.isObject()) {
            ObjectNode canonical = objectMapper.createObjectNode();
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            for (String fieldName : fieldNames) {
                JsonNode value = canonicalizeNode(node.get(fieldName));
                if (value != null) {
                    canonical.set(fieldName, value);
                }
            }
            return canonical;
        } else if (node.isArray()) {
            ArrayNode canonical = objectMapper.createArrayNode();
            for (JsonNode element : node) {
                JsonNode value = canonicalizeNode(element);
                canonical.add(value != null ? value : objectMapper.nullNode());
            }
            return canonical;
        } else if (node.isNumber()) {
            return objectMapper.getNodeFactory().numberNode(node.decimalValue().stripTrailingZeros());
        } else {
            return node;
        }
    }

    private void serializeNode(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull()) {
            sb.append("null");
        } else if (node.isObject()) {
            sb.append("{");
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            boolean first = true;
            for (String fieldName : fieldNames) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                sb.append("\"").append(escapeJson(fieldName)).append("\":");
                serializeNode(node.get(fieldName), sb);
            }
            sb.append("}");
        } else if (node.isArray()) {
            sb.append("[");
            boolean first = true;
            for (JsonNode element : node) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                serializeNode(element, sb);
            }
            sb.append("]");
        } else if (node.isTextual()) {
            sb.append("\"").append(escapeJson(node.asText())).append("\"");
        } else if (node.isNumber()) {
            BigDecimal value = node.decimalValue();
            sb.append(value.toPlainString());
        } else if (node.isBoolean()) {
            sb.append(node.asBoolean());
        }
    }

    private String escapeJson(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
