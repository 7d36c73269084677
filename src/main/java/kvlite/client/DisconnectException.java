package kvlite.client;

import java.io.IOException;

/**
 * The server closed the connection before a complete reply arrived.
 */
public class DisconnectException extends IOException {

    public DisconnectException(String message) {
        super(message);
    }
}
