package com.fleetwarden.core.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Result of coercing a board listing response into a list of items.
 */
public sealed interface ProjectPayload permits ProjectPayload.ValidShape, ProjectPayload.InvalidShape {

    /** Items found in the payload; empty for an invalid shape. */
    List<JsonNode> items();

    boolean validShape();

    record ValidShape(List<JsonNode> items) implements ProjectPayload {
        public ValidShape {
            items = List.copyOf(items);
        }

        @Override
        public boolean validShape() {
            return true;
        }
    }

    /**
     * A payload none of the known envelopes matched.
     *
     * @param description short shape summary for warnings
     */
    record InvalidShape(String description) implements ProjectPayload {
        @Override
        public List<JsonNode> items() {
            return List.of();
        }

        @Override
        public boolean validShape() {
            return false;
        }
    }
}
