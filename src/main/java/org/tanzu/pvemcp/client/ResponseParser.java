package org.tanzu.pvemcp.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.tanzu.pvemcp.exception.ErrorKind;
import org.tanzu.pvemcp.exception.PveException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Normalizes PVE JSON answers.
 *
 * Successful answers wrap their payload in a {@code data} member; failed answers may
 * carry an {@code errors} object mapping parameter names to messages, a {@code message}
 * member, or nothing but the HTTP reason phrase.
 */
final class ResponseParser {

    private ResponseParser() {
    }

    /**
     * Extracts the payload of a successful answer.
     *
     * @param objectMapper Mapper used to read the body
     * @param response A 2xx answer
     * @return The {@code data} member, the whole document when there is none, or a null node for an empty body
     * @throws PveException if the body is not valid JSON
     */
    static JsonNode data(ObjectMapper objectMapper, TransportResponse response) {
        String body = response.getBody();
        if (body.isBlank()) {
            return objectMapper.nullNode();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            return root.has("data") ? root.get("data") : root;
        } catch (JsonProcessingException e) {
            throw new PveException(ErrorKind.INTERNAL, "Unreadable response from endpoint: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Builds a human-readable cause from a failed answer.
     *
     * @param objectMapper Mapper used to read the body
     * @param response A non-2xx answer
     * @return For example {@code HTTP 400 Parameter verification failed (vmid: invalid format)}
     */
    static String describeError(ObjectMapper objectMapper, TransportResponse response) {
        StringBuilder message = new StringBuilder("HTTP ").append(response.getStatusCode());
        if (!response.getReason().isBlank()) {
            message.append(' ').append(response.getReason());
        }
        List<String> details = new ArrayList<>();
        if (!response.getBody().isBlank()) {
            try {
                JsonNode root = objectMapper.readTree(response.getBody());
                JsonNode errors = root.path("errors");
                for (Iterator<Map.Entry<String, JsonNode>> it = errors.fields(); it.hasNext(); ) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    details.add(entry.getKey() + ": " + entry.getValue().asText().trim());
                }
                if (root.hasNonNull("message")) {
                    details.add(root.get("message").asText().trim());
                }
            } catch (JsonProcessingException e) {
                details.add(abbreviate(response.getBody().trim()));
            }
        }
        if (!details.isEmpty()) {
            message.append(" (").append(String.join("; ", details)).append(')');
        }
        return message.toString();
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
