package kvlite.network;

/**
 * Lifecycle of one client connection. The handler cycles
 * AWAITING_REQUEST -> DISPATCHING -> SENDING_RESPONSE -> AWAITING_REQUEST until it reaches CLOSED.
 */
public enum ConnectionState {
    AWAITING_REQUEST,
    DISPATCHING,
    SENDING_RESPONSE,
    CLOSED
}
