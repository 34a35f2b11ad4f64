package com.fleetwarden.core.events;

/**
 * Fire-and-forget operator notification channel (chat, mail, pager).
 */
@FunctionalInterface
public interface Notifier {

    void notify(String message);
}
