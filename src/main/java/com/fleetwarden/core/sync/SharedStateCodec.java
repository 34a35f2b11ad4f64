package com.fleetwarden.core.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetwarden.core.model.SharedState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the claim record embedded in an issue comment as
 * {@code <!-- fleetwarden-state\n{json}\n-->}. Comments written under the older
 * {@code openfleet-state} marker are still read.
 */
public final class SharedStateCodec {

    private static final Logger log = LoggerFactory.getLogger(SharedStateCodec.class);

    public static final String MARKER = "<!-- fleetwarden-state";
    static final String LEGACY_MARKER = "<!-- openfleet-state";

    private static final Pattern BLOCK = Pattern.compile("<!-- (?:fleetwarden|openfleet)-state\\s*\\n([\\s\\S]*?)\\n-->");
    private static final Set<String> ATTEMPT_STATUSES = Set.of("claimed", "working", "stale");

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private SharedStateCodec() {}

    public static boolean isStateComment(String body) {
        return body != null && (body.contains(MARKER) || body.contains(LEGACY_MARKER));
    }

    /**
     * Copies snake_case and legacy field spellings onto the canonical names without overwriting them.
     */
    public static ObjectNode normalise(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return null;
        }
        ObjectNode node = ((ObjectNode) raw).deepCopy();
        copyIfMissing(node, "owner_id", "ownerId");
        copyIfMissing(node, "attempt_token", "attemptToken");
        copyIfMissing(node, "attempt_started", "attemptStarted");
        copyIfMissing(node, "ownerHeartbeat", "heartbeat");
        if (isMissing(node, "retryCount") && node.path("retry_count").canConvertToInt()) {
            node.put("retryCount", node.path("retry_count").asInt());
        }
        if (isMissing(node, "status") && ATTEMPT_STATUSES.contains(node.path("attemptStatus").asText(""))) {
            node.put("status", node.path("attemptStatus").asText());
        }
        return node;
    }

    /**
     * Parses the latest state comment. Incomplete or malformed claims are rejected.
     *
     * @param commentBodies comment bodies in chronological order
     */
    public static Optional<SharedState> decodeLatest(List<String> commentBodies) {
        for (int i = commentBodies.size() - 1; i >= 0; i--) {
            String body = commentBodies.get(i);
            if (isStateComment(body)) {
                return decode(body);
            }
        }
        return Optional.empty();
    }

    public static Optional<SharedState> decode(String commentBody) {
        if (commentBody == null) {
            return Optional.empty();
        }
        Matcher matcher = BLOCK.matcher(commentBody);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            ObjectNode normalised = normalise(objectMapper.readTree(matcher.group(1).trim()));
            if (normalised == null) {
                return Optional.empty();
            }
            SharedState state = objectMapper.treeToValue(normalised, SharedState.class);
            if (!state.isComplete()) {
                log.warn("Ignoring shared state with missing required fields: {}", normalised);
                return Optional.empty();
            }
            return Optional.of(state);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed shared state comment: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Comment body for a claim: the machine-readable block followed by a readable status line.
     */
    public static String encode(SharedState state) {
        String json;
        try {
            json = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise shared state", e);
        }
        String[] ownerParts = state.ownerId() == null ? new String[0] : state.ownerId().split("/");
        String agent = ownerParts.length > 0 ? ownerParts[ownerParts.length - 1] : "unknown";
        String workstation = ownerParts.length > 1 ? ownerParts[0] : "unknown";
        String verb = switch (state.status() == null ? "" : state.status()) {
            case "working" -> "working on";
            case "claimed" -> "claiming";
            default -> "stale for";
        };
        return MARKER + "\n" + json + "\n-->\n"
                + "**Fleetwarden Status**: Agent `" + agent + "` on `" + workstation + "` is " + verb + " this task.\n"
                + "*Last heartbeat: " + state.heartbeat() + "*";
    }

    private static void copyIfMissing(ObjectNode node, String from, String to) {
        if (isMissing(node, to) && !isMissing(node, from)) {
            node.set(to, node.get(from));
        }
    }

    private static boolean isMissing(ObjectNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || (value.isTextual() && value.asText().isEmpty());
    }
}
