package com.fleetwarden.core.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Coerces the envelopes {@code gh} and the GraphQL API return for list queries into a flat item list.
 * <p>
 * Recognised, in order: a bare array; {@code {items}}; {@code {data}} holding an array or one of
 * {@code items}, {@code nodes}, {@code edges}; {@code {nodes}}; {@code {edges[].node}}.
 */
public final class ProjectPayloadDecoder {

    private static final int MAX_KEYS_IN_DESCRIPTION = 5;

    private ProjectPayloadDecoder() {}

    public static ProjectPayload decode(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return new ProjectPayload.InvalidShape(describeShape(payload));
        }
        if (payload.isArray()) {
            return new ProjectPayload.ValidShape(elements(payload));
        }
        if (!payload.isObject()) {
            return new ProjectPayload.InvalidShape(describeShape(payload));
        }

        if (payload.path("items").isArray()) {
            return new ProjectPayload.ValidShape(elements(payload.get("items")));
        }

        JsonNode data = payload.path("data");
        if (data.isArray()) {
            return new ProjectPayload.ValidShape(elements(data));
        }
        if (data.isObject()) {
            if (data.path("items").isArray()) {
                return new ProjectPayload.ValidShape(elements(data.get("items")));
            }
            if (data.path("nodes").isArray()) {
                return new ProjectPayload.ValidShape(elements(data.get("nodes")));
            }
            if (data.path("edges").isArray()) {
                return new ProjectPayload.ValidShape(edgeNodes(data.get("edges")));
            }
        }

        if (payload.path("nodes").isArray()) {
            return new ProjectPayload.ValidShape(elements(payload.get("nodes")));
        }
        if (payload.path("edges").isArray()) {
            return new ProjectPayload.ValidShape(edgeNodes(payload.get("edges")));
        }
        return new ProjectPayload.InvalidShape(describeShape(payload));
    }

    /** {@code null}, {@code array(len=N)}, {@code object(keys=a,b)} or the JSON node type. */
    public static String describeShape(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return "null";
        }
        if (payload.isArray()) {
            return "array(len=" + payload.size() + ")";
        }
        if (payload.isObject()) {
            List<String> keys = new ArrayList<>();
            Iterator<String> names = payload.fieldNames();
            while (names.hasNext() && keys.size() < MAX_KEYS_IN_DESCRIPTION) {
                keys.add(names.next());
            }
            return "object(keys=" + String.join(",", keys) + ")";
        }
        return payload.getNodeType().name().toLowerCase();
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> items = new ArrayList<>(array.size());
        array.forEach(items::add);
        return items;
    }

    private static List<JsonNode> edgeNodes(JsonNode edges) {
        List<JsonNode> items = new ArrayList<>(edges.size());
        for (JsonNode edge : edges) {
            JsonNode node = edge.path("node");
            if (!node.isMissingNode() && !node.isNull()) {
                items.add(node);
            }
        }
        return items;
    }
}
