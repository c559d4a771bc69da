package com.eyelevel.contentmoderation.service.queue;

/**
 * Lifecycle of the process-wide work queue handle.
 */
public enum ConnectionState {
    /**
     * Not yet reachable, or reachability was lost. The reconnect loop keeps probing.
     */
    CONNECTING,
    /**
     * The queue exists and answered the last probe. Publishing and consuming are allowed.
     */
    READY,
    /**
     * The application is shutting down. No further reconnect attempts are made.
     */
    CLOSED
}
