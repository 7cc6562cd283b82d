package cinder.network;

import cinder.protocol.Reply;

/**
 * Where a {@link Connection} sends its replies. Implemented over a Netty channel by
 * {@link ClientHandler} and by plain collections in tests.
 */
public interface ReplySink {
    boolean isWritable();

    void write(Reply reply);

    void flush();

    /** Flushes everything written so far, then closes the transport. */
    void closeAfterFlush();
}
