package io.fleetmesh.ingest;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Agent endpoint on its own host and port, separate from the admin server.
 * Shares the store and logic with the embedded topology.
 */
public final class StandaloneIngestServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StandaloneIngestServer.class);
    static final int STOP_GRACE_SECONDS = 2;

    private final IngestEndpoint endpoint;
    private final String host;
    private final int port;
    private final int workers;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private HttpServer server;
    private ExecutorService executor;

    public StandaloneIngestServer(IngestEndpoint endpoint, String host, int port, int workers) {
        this.endpoint = endpoint;
        this.host = host;
        this.port = port;
        this.workers = Math.max(1, workers);
    }

    public synchronized StandaloneIngestServer start() {
        if (server != null) {
            return this;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(host, port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind ingest listener on " + host + ":" + port, e);
        }
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers, r -> {
            Thread thread = new Thread(r, "fleetmesh-ingest-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        endpoint.mount(server);
        server.setExecutor(executor);
        server.start();
        log.info("Standalone ingest listening on {}:{}", host, boundPort());
        return this;
    }

    public synchronized int boundPort() {
        if (server == null) {
            throw new IllegalStateException("server not started");
        }
        return server.getAddress().getPort();
    }

    /**
     * Blocks until {@link #close()} runs, typically from a shutdown hook.
     */
    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        server.stop(STOP_GRACE_SECONDS);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        server = null;
        stopped.countDown();
        log.info("Standalone ingest stopped");
    }
}
