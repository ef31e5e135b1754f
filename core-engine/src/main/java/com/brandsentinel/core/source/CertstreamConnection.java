package com.brandsentinel.core.source;

import java.io.IOException;
import java.time.Duration;

/**
 * A live subscription to the certstream feed.
 */
public interface CertstreamConnection extends AutoCloseable {

    /**
     * Wait for the next complete text message.
     *
     * @param timeout maximum wait
     * @return the message, or {@code null} if none arrived in time
     * @throws IOException          if the connection failed or was closed by the
     *                              peer
     * @throws InterruptedException if interrupted while waiting
     */
    String receive(Duration timeout) throws IOException, InterruptedException;

    /**
     * Close the connection. Never throws.
     */
    @Override
    void close();
}
