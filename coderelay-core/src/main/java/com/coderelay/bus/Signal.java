package com.coderelay.bus;

/**
 * What a {@link Subscription} yields on each receive.
 */
public sealed interface Signal permits Signal.Event, Signal.Lagged, Signal.Closed {

    Signal CLOSED = new Closed();

    record Event(BusEvent event) implements Signal {
    }

    /**
     * The subscriber fell behind the retained buffer and {@code missed} events were overwritten.
     * The next receive continues at the oldest retained event.
     */
    record Lagged(long missed) implements Signal {
    }

    /**
     * The bus is closed and everything published before closing has been read, or the
     * subscription itself was closed.
     */
    record Closed() implements Signal {
    }
}
