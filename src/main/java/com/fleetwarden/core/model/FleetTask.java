package com.fleetwarden.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A unit of work reconciled between the local task store and the external board.
 *
 * @param id                  board identifier (issue number for GitHub)
 * @param title               human readable title
 * @param status              canonical status
 * @param sharedStateOwnerId  authoritative owner recorded in the shared-state comment
 * @param claimedBy           legacy claim marker
 * @param meta                free-form metadata; {@code meta.sharedState.ownerId} is the second owner source
 */
public record FleetTask(
    String id,
    String title,
    TaskStatus status,
    String sharedStateOwnerId,
    String claimedBy,
    Map<String, Object> meta
) implements Serializable {

    public FleetTask {
        meta = meta == null ? Map.of() : withoutNulls(meta);
    }

    public static FleetTask of(String id, String title, TaskStatus status) {
        return new FleetTask(id, title, status, null, null, Map.of());
    }

    public FleetTask withStatus(TaskStatus newStatus) {
        return new FleetTask(id, title, newStatus, sharedStateOwnerId, claimedBy, meta);
    }

    public FleetTask withSharedStateOwner(String ownerId) {
        return new FleetTask(id, title, status, ownerId, claimedBy, meta);
    }

    public FleetTask withMeta(String key, Object value) {
        var copy = new HashMap<>(meta);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new FleetTask(id, title, status, sharedStateOwnerId, claimedBy, copy);
    }

    // Null keys and values are dropped; withMeta(key, null) already means "absent"
    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        var copy = new HashMap<String, Object>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /** True when {@code meta.stale} marks the local record as known-stale. */
    public boolean isStale() {
        return Boolean.TRUE.equals(meta.get("stale"));
    }
}
