package com.fleetwarden.core.events;

/**
 * Per-call switches for {@link AgentEventBus#emit}.
 *
 * @param skipBroadcast record and deliver to listeners but do not push to UI clients
 */
public record EmitOptions(boolean skipBroadcast) {

    public static final EmitOptions DEFAULT = new EmitOptions(false);
    public static final EmitOptions NO_BROADCAST = new EmitOptions(true);
}
