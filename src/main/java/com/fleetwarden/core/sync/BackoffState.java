package com.fleetwarden.core.sync;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Board backoff bookkeeping persisted across processes. All timestamps are epoch milliseconds.
 *
 * @param rateLimitUntil      no board call before this instant
 * @param commandFailures     consecutive failures per project command key
 * @param commandBackoffUntil per command key, no retry before this instant
 * @param invalidOwners       owners the board rejected
 * @param ownerRetryUntil     when every owner was rejected, no retry before this instant
 * @param payloadWarnings     {@code role:name:reason} to the time it was last warned about
 */
public record BackoffState(
    long rateLimitUntil,
    Map<String, Integer> commandFailures,
    Map<String, Long> commandBackoffUntil,
    List<String> invalidOwners,
    long ownerRetryUntil,
    Map<String, Long> payloadWarnings
) {

    public BackoffState {
        commandFailures = commandFailures == null ? Map.of() : Map.copyOf(commandFailures);
        commandBackoffUntil = commandBackoffUntil == null ? Map.of() : Map.copyOf(commandBackoffUntil);
        invalidOwners = invalidOwners == null ? List.of() : List.copyOf(new LinkedHashSet<>(invalidOwners));
        payloadWarnings = payloadWarnings == null ? Map.of() : Map.copyOf(payloadWarnings);
    }

    public static BackoffState empty() {
        return new BackoffState(0, Map.of(), Map.of(), List.of(), 0, Map.of());
    }

    public BackoffState withRateLimitUntil(long until) {
        return new BackoffState(until, commandFailures, commandBackoffUntil, invalidOwners, ownerRetryUntil, payloadWarnings);
    }

    public BackoffState withCommandFailure(String key, int failures, Long backoffUntil) {
        var failuresCopy = new HashMap<>(commandFailures);
        failuresCopy.put(key, failures);
        var backoffCopy = new HashMap<>(commandBackoffUntil);
        if (backoffUntil == null) {
            backoffCopy.remove(key);
        } else {
            backoffCopy.put(key, backoffUntil);
        }
        return new BackoffState(rateLimitUntil, failuresCopy, backoffCopy, invalidOwners, ownerRetryUntil, payloadWarnings);
    }

    public BackoffState withCommandCleared(String key) {
        if (!commandFailures.containsKey(key) && !commandBackoffUntil.containsKey(key)) {
            return this;
        }
        var failuresCopy = new HashMap<>(commandFailures);
        failuresCopy.remove(key);
        var backoffCopy = new HashMap<>(commandBackoffUntil);
        backoffCopy.remove(key);
        return new BackoffState(rateLimitUntil, failuresCopy, backoffCopy, invalidOwners, ownerRetryUntil, payloadWarnings);
    }

    public BackoffState withInvalidOwner(String owner) {
        var owners = new LinkedHashSet<>(invalidOwners);
        owners.add(owner);
        return new BackoffState(rateLimitUntil, commandFailures, commandBackoffUntil, List.copyOf(owners), ownerRetryUntil, payloadWarnings);
    }

    public BackoffState withInvalidOwners(List<String> owners) {
        return new BackoffState(rateLimitUntil, commandFailures, commandBackoffUntil, owners, ownerRetryUntil, payloadWarnings);
    }

    public BackoffState withOwnerRetryUntil(long until) {
        return new BackoffState(rateLimitUntil, commandFailures, commandBackoffUntil, invalidOwners, until, payloadWarnings);
    }

    public BackoffState withPayloadWarning(String key, long at) {
        var copy = new HashMap<>(payloadWarnings);
        copy.put(key, at);
        return new BackoffState(rateLimitUntil, commandFailures, commandBackoffUntil, invalidOwners, ownerRetryUntil, copy);
    }

    public int failures(String key) {
        return commandFailures.getOrDefault(key, 0);
    }

    public long backoffUntil(String key) {
        return commandBackoffUntil.getOrDefault(key, 0L);
    }
}
