package com.fleetwarden.core.sync;

import com.fleetwarden.core.model.FleetTask;
import com.fleetwarden.core.model.SharedState;

import java.util.Map;

/**
 * Decides who owns a task and whether the local and remote claims disagree.
 */
public final class OwnershipResolver {

    private OwnershipResolver() {}

    /**
     * Local owner, by precedence: {@code sharedStateOwnerId}, then {@code meta.sharedState.ownerId},
     * then {@code claimedBy}. {@code null} when none is set.
     */
    public static String localOwner(FleetTask task) {
        if (task == null) {
            return null;
        }
        if (notBlank(task.sharedStateOwnerId())) {
            return task.sharedStateOwnerId();
        }
        Object shared = task.meta().get("sharedState");
        if (shared instanceof SharedState state && notBlank(state.ownerId())) {
            return state.ownerId();
        }
        if (shared instanceof Map<?, ?> map) {
            String owner = sharedOwnerId(map);
            if (owner != null) {
                return owner;
            }
        }
        return notBlank(task.claimedBy()) ? task.claimedBy() : null;
    }

    /**
     * A conflict needs both owners known, different, and a local record that is not known-stale.
     */
    public static boolean isConflict(String localOwner, String remoteOwner, boolean localStale) {
        return !localStale && localOwner != null && remoteOwner != null && !remoteOwner.equals(localOwner);
    }

    /** {@code ownerId}, falling back to the snake_case {@code owner_id}. */
    static String sharedOwnerId(Map<?, ?> sharedState) {
        for (String key : new String[]{"ownerId", "owner_id"}) {
            if (sharedState.get(key) instanceof String owner && notBlank(owner)) {
                return owner;
            }
        }
        return null;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
