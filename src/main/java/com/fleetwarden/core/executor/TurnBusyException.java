package com.fleetwarden.core.executor;

/**
 * An executor was asked to start a turn while another was in flight.
 */
public class TurnBusyException extends RuntimeException {

    public TurnBusyException(String executor) {
        super("Executor " + executor + " is still running a previous turn");
    }
}
