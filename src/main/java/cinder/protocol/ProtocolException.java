package cinder.protocol;

import io.netty.handler.codec.CorruptedFrameException;

/**
 * Malformed or oversized input. The connection that sent it cannot be resynchronised and is closed.
 */
public class ProtocolException extends CorruptedFrameException {
    public ProtocolException(String message) {
        super(message);
    }
}
