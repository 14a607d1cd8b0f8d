package com.webchat.server.im.connection;

import java.io.IOException;
import java.time.Duration;

/**
 * The socket side of a {@link Connection}. Writes block the caller until the frame is
 * flushed or the deadline passes.
 */
public interface Transport {

    /**
     * Write one text frame.
     * @throws IOException if the write fails or does not complete within the deadline
     */
    void write(String text, Duration deadline) throws IOException;

    /**
     * Send a ping the peer must answer.
     */
    void ping(Duration deadline) throws IOException;

    /**
     * Stop reading from the peer until {@link #resumeReads()} is called. Frames already
     * read are still delivered.
     */
    void pauseReads();

    void resumeReads();

    /**
     * Close the socket. Safe to call more than once.
     */
    void close();

    boolean isOpen();

    String id();
}
