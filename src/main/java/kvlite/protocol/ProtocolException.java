package kvlite.protocol;

import io.netty.handler.codec.CorruptedFrameException;

/**
 * Raised while decoding when the inbound bytes are not valid protocol ("Bad Request").
 * The stream position can no longer be trusted, so the connection must be closed.
 */
public class ProtocolException extends CorruptedFrameException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
