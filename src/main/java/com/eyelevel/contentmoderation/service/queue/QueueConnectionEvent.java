package com.eyelevel.contentmoderation.service.queue;

/**
 * Published by the {@link QueueConnectionSupervisor} whenever the connection state changes.
 *
 * @param previous The state before the transition.
 * @param current  The new state.
 */
public record QueueConnectionEvent(ConnectionState previous, ConnectionState current) {

    public boolean isReady() {
        return current == ConnectionState.READY;
    }

    public boolean isLost() {
        return previous == ConnectionState.READY && current != ConnectionState.READY;
    }
}
