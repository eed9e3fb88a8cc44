package io.fleetmesh.ingest;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the agent endpoint from the admin server's own listener.
 */
public final class EmbeddedIngestHost {
    private static final Logger log = LoggerFactory.getLogger(EmbeddedIngestHost.class);

    private final IngestEndpoint endpoint;

    public EmbeddedIngestHost(IngestEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    public void attach(HttpServer adminServer) {
        endpoint.mount(adminServer);
        log.info("Agent ingest endpoint mounted on admin listener {}", adminServer.getAddress());
    }
}
