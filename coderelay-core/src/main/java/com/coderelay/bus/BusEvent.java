package com.coderelay.bus;

/**
 * Events fanned out to live subscribers.
 */
public sealed interface BusEvent permits BusEvent.NewCode, BusEvent.Exit {

    BusEvent EXIT = new Exit();

    /**
     * A code was announced or re-announced.
     */
    record NewCode(String code) implements BusEvent {
    }

    /**
     * The coordinator is shutting down. Nothing follows it.
     */
    record Exit() implements BusEvent {
    }
}
