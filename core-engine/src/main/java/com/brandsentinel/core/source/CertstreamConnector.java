package com.brandsentinel.core.source;

import java.io.IOException;
import java.net.URI;

/**
 * Opens {@link CertstreamConnection}s.
 */
@FunctionalInterface
public interface CertstreamConnector {

    /**
     * @param uri feed endpoint
     * @return an open connection
     * @throws IOException          if the connection cannot be established
     * @throws InterruptedException if interrupted while connecting
     */
    CertstreamConnection connect(URI uri) throws IOException, InterruptedException;
}
