package io.fleetmesh.runtime;

import io.fleetmesh.background.BackgroundPool;
import io.fleetmesh.background.TaskContext;
import io.fleetmesh.config.FleetMeshConfig;
import io.fleetmesh.config.FleetMeshSettings;
import io.fleetmesh.dispatch.CommandDispatcher;
import io.fleetmesh.ingest.DefaultIngestionService;
import io.fleetmesh.ingest.IngestEndpoint;
import io.fleetmesh.ingest.IngestionService;
import io.fleetmesh.links.DownloadLinkIssuer;
import io.fleetmesh.observability.AuditLogger;
import io.fleetmesh.scheduler.JobScheduler;
import io.fleetmesh.scheduler.SweepTimer;
import io.fleetmesh.security.AgentKeyRegistry;
import io.fleetmesh.security.KeyHasher;
import io.fleetmesh.security.PrincipalDirectory;
import io.fleetmesh.storage.CommandStore;
import io.fleetmesh.storage.CredentialStore;
import io.fleetmesh.storage.Database;
import io.fleetmesh.storage.DownloadLinkStore;
import io.fleetmesh.storage.JobStore;
import io.fleetmesh.storage.MessageStore;
import io.fleetmesh.util.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires one namespace's stores and services together. CLI commands and both
 * HTTP listeners work through a single instance.
 */
public final class FleetMeshRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FleetMeshRuntime.class);
    static final String DEFAULT_INSTALLER_NAME = "fleetmesh-agent-installer.bin";

    private final FleetMeshConfig config;
    private final FleetMeshSettings settings;
    private final Database database;
    private final AuditLogger audit;
    private final PrincipalDirectory principals;
    private final BackgroundPool pool;
    private final Clock clock;
    private final AgentKeyRegistry keys;
    private final MessageStore messages;
    private final CommandDispatcher dispatcher;
    private final JobScheduler scheduler;
    private final DownloadLinkIssuer links;
    private final IngestionService ingestion;
    private SweepTimer sweepTimer;

    public FleetMeshRuntime(
            FleetMeshConfig config,
            FleetMeshSettings settings,
            PrincipalDirectory principals,
            BackgroundPool pool,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings;
        this.principals = principals;
        this.pool = pool;
        this.clock = clock;
        this.database = new Database(config);
        this.audit = new AuditLogger(
                config.auditRoot().resolve("audit.log"),
                config.namespace(),
                loadOrCreateAuditSigningSecret(config.securityRoot().resolve("audit-signing.key"))
        );
        this.keys = new AgentKeyRegistry(
                new CredentialStore(database),
                new KeyHasher(settings.bcryptStrength()),
                principals,
                audit,
                clock
        );
        this.messages = new MessageStore(database);
        this.dispatcher = new CommandDispatcher(new CommandStore(database), clock);
        this.scheduler = new JobScheduler(new JobStore(database), dispatcher, audit, clock, settings.sweepBatchSize());
        this.links = new DownloadLinkIssuer(new DownloadLinkStore(database), audit, clock);
        this.ingestion = new DefaultIngestionService(keys, messages, dispatcher, clock, FleetMeshConfig.DEFAULT_PAYLOAD_MAX_BYTES);
    }

    public void init() {
        database.init();
        log.info("FleetMesh runtime ready (root={}, namespace={})", config.rootDir(), config.namespace());
    }

    public IngestEndpoint ingestEndpoint() {
        return new IngestEndpoint(ingestion, FleetMeshConfig.DEFAULT_PAYLOAD_MAX_BYTES);
    }

    /**
     * Starts periodic sweeping on the background pool; idempotent.
     */
    public synchronized SweepTimer startSweepTimer() {
        if (sweepTimer == null) {
            sweepTimer = new SweepTimer(scheduler, dispatcher, pool, systemContext(), clock);
            sweepTimer.start();
        }
        return sweepTimer;
    }

    /**
     * Installer served to holders of a granted download link.
     */
    public Path installerFile() {
        String configured = settings.installerPath();
        if (configured == null || configured.isBlank()) {
            return config.installerRoot().resolve(DEFAULT_INSTALLER_NAME);
        }
        return Path.of(configured);
    }

    public TaskContext systemContext() {
        return TaskContext.system(config.namespace(), settings);
    }

    @Override
    public synchronized void close() {
        if (sweepTimer != null) {
            sweepTimer.close();
            sweepTimer = null;
        }
    }

    public FleetMeshConfig config() {
        return config;
    }

    public FleetMeshSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public AuditLogger audit() {
        return audit;
    }

    public PrincipalDirectory principals() {
        return principals;
    }

    public BackgroundPool pool() {
        return pool;
    }

    public Clock clock() {
        return clock;
    }

    public AgentKeyRegistry keys() {
        return keys;
    }

    public MessageStore messages() {
        return messages;
    }

    public CommandDispatcher dispatcher() {
        return dispatcher;
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    public DownloadLinkIssuer links() {
        return links;
    }

    public IngestionService ingestion() {
        return ingestion;
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            String secret = Tokens.urlSafe(32);
            Files.writeString(keyFile, secret, StandardCharsets.UTF_8);
            return secret;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load audit signing key: " + keyFile, e);
        }
    }
}
