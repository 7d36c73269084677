package kvlite.protocol;

import io.netty.handler.codec.EncoderException;

/**
 * Raised when something other than a {@link RespValue} reaches the encoder.
 */
public class UnrecognizedTypeException extends EncoderException {

    public UnrecognizedTypeException(Object value) {
        super("unrecognized type: " + (value == null ? "null" : value.getClass().getName()));
    }
}
