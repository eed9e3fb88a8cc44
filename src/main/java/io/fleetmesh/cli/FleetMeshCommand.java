package io.fleetmesh.cli;

import com.sun.net.httpserver.HttpServer;
import io.fleetmesh.background.BackgroundPool;
import io.fleetmesh.config.FleetMeshConfig;
import io.fleetmesh.config.FleetMeshSettings;
import io.fleetmesh.ingest.EmbeddedIngestHost;
import io.fleetmesh.ingest.StandaloneIngestServer;
import io.fleetmesh.model.CommandStatus;
import io.fleetmesh.model.DownloadLink;
import io.fleetmesh.model.JobStatus;
import io.fleetmesh.model.LinkVisibility;
import io.fleetmesh.model.Recurrence;
import io.fleetmesh.model.RemoteCommand;
import io.fleetmesh.observability.AuditLogger;
import io.fleetmesh.runtime.FleetMeshRuntime;
import io.fleetmesh.scheduler.SweepOutcome;
import io.fleetmesh.security.AuthFilePrincipalDirectory;
import io.fleetmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Command(
        name = "fleetmesh",
        mixinStandardHelpOptions = true,
        description = "FleetMesh agent control plane CLI",
        subcommands = {
                FleetMeshCommand.InitCommand.class,
                FleetMeshCommand.KeyGenerateCommand.class,
                FleetMeshCommand.KeyListCommand.class,
                FleetMeshCommand.KeyRevokeCommand.class,
                FleetMeshCommand.KeyRotateCommand.class,
                FleetMeshCommand.KeyExpireCommand.class,
                FleetMeshCommand.KeyDeleteCommand.class,
                FleetMeshCommand.JobCreateCommand.class,
                FleetMeshCommand.JobListCommand.class,
                FleetMeshCommand.JobEditCommand.class,
                FleetMeshCommand.JobRescheduleCommand.class,
                FleetMeshCommand.JobCancelCommand.class,
                FleetMeshCommand.JobDeleteCommand.class,
                FleetMeshCommand.SweepCommand.class,
                FleetMeshCommand.CommandEnqueueCommand.class,
                FleetMeshCommand.CommandListCommand.class,
                FleetMeshCommand.CommandExpireCommand.class,
                FleetMeshCommand.CommandCancelCommand.class,
                FleetMeshCommand.CommandClearCommand.class,
                FleetMeshCommand.LinkIssueCommand.class,
                FleetMeshCommand.LinkListCommand.class,
                FleetMeshCommand.LinkRevokeCommand.class,
                FleetMeshCommand.AuditVerifyCommand.class,
                FleetMeshCommand.ServeCommand.class,
                FleetMeshCommand.ServeIngestCommand.class
        }
)
public final class FleetMeshCommand implements Runnable {
    static final String CLI_ACTOR = "cli";

    @Option(names = {"--root"}, defaultValue = "data", description = "Data root directory")
    String root;

    @Option(names = {"--namespace"}, defaultValue = FleetMeshConfig.DEFAULT_NAMESPACE, description = "Namespace under the data root")
    String namespace;

    @Option(names = {"--auth-file"}, description = "Principals file (overrides settings)")
    String authFile;

    @Override
    public void run() {
        System.out.println("Use a subcommand. Try --help.");
    }

    FleetMeshRuntime runtime() {
        return runtime(null, null);
    }

    FleetMeshRuntime runtime(String ingestHost, Integer ingestPort) {
        FleetMeshConfig config = FleetMeshConfig.fromRoot(root, namespace);
        FleetMeshSettings settings = FleetMeshSettings.load(config).withIngestEndpoint(ingestHost, ingestPort);
        String principals = authFile == null || authFile.isBlank() ? settings.authFile() : authFile;
        FleetMeshRuntime runtime = new FleetMeshRuntime(
                config,
                settings,
                AuthFilePrincipalDirectory.load(principals),
                BackgroundPool.initialize(settings.backgroundWorkers()),
                Clock.systemUTC()
        );
        runtime.init();
        return runtime;
    }

    private static void print(Object value) {
        System.out.println(Jsons.toJson(value));
    }

    @Command(name = "init", description = "Create directories and the SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Override
        public Integer call() {
            FleetMeshRuntime runtime = parent.runtime();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", runtime.config().rootDir().toString());
            out.put("database", runtime.config().dbFile().toString());
            out.put("migrations", runtime.database().listSchemaMigrations());
            print(out);
            return 0;
        }
    }

    @Command(name = "key-generate", description = "Issue a new agent API key; the plain key is printed once")
    static final class KeyGenerateCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--name"}, required = true, description = "Key name")
        String name;

        @Option(names = {"--description"}, defaultValue = "", description = "Free-form description")
        String description;

        @Option(names = {"--principal"}, description = "Default principal id from the auth file")
        String principal;

        @Option(names = {"--expires-at"}, description = "ISO-8601 instant or epoch ms after which the key stops working")
        String expiresAt;

        @Override
        public Integer call() {
            print(parent.runtime().keys().generate(
                    name, description, principal, Inputs.parseInstant(expiresAt, null), CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "key-list", description = "List agent keys")
    static final class KeyListCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Override
        public Integer call() {
            print(parent.runtime().keys().list());
            return 0;
        }
    }

    @Command(name = "key-revoke", description = "Revoke an agent key")
    static final class KeyRevokeCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Credential id")
        String credentialId;

        @Override
        public Integer call() {
            print(parent.runtime().keys().revoke(credentialId, CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "key-rotate", description = "Replace an agent key's prefix and secret")
    static final class KeyRotateCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Credential id")
        String credentialId;

        @Override
        public Integer call() {
            print(parent.runtime().keys().rotate(credentialId, CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "key-expire", description = "Set or clear an agent key's expiry")
    static final class KeyExpireCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Credential id")
        String credentialId;

        @Option(names = {"--expires-at"}, description = "ISO-8601 instant or epoch ms (omit to clear)")
        String expiresAt;

        @Override
        public Integer call() {
            print(parent.runtime().keys().setExpiry(credentialId, Inputs.parseInstant(expiresAt, null), CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "key-delete", description = "Delete an agent key; its messages are kept")
    static final class KeyDeleteCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Credential id")
        String credentialId;

        @Override
        public Integer call() {
            print(parent.runtime().keys().delete(credentialId, CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "job-create", description = "Schedule a job that fans out commands to target hosts")
    static final class JobCreateCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--name"}, required = true, description = "Job name")
        String name;

        @Option(names = {"--action"}, required = true, description = "Action type sent to agents")
        String actionType;

        @Option(names = {"--run-at"}, description = "ISO-8601 instant or epoch ms (default: now)")
        String runAt;

        @Option(names = {"--recurrence"}, defaultValue = "once", description = "once|hourly|daily|weekly|monthly")
        String recurrence;

        @Option(names = {"--hosts"}, required = true, description = "Target hosts, comma-separated")
        String hosts;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "JSON object payload")
        String payload;

        @Override
        public Integer call() {
            FleetMeshRuntime runtime = parent.runtime();
            print(runtime.scheduler().create(
                    name,
                    actionType,
                    Inputs.parseInstant(runAt, runtime.clock().instant()),
                    Recurrence.fromString(recurrence),
                    Inputs.parseHosts(hosts),
                    payload,
                    CLI_ACTOR
            ));
            return 0;
        }
    }

    @Command(name = "job-list", description = "List scheduled jobs")
    static final class JobListCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--status"}, description = "Filter by status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            JobStatus filter = status == null || status.isBlank() ? null : JobStatus.fromString(status);
            print(parent.runtime().scheduler().list(filter, limit));
            return 0;
        }
    }

    @Command(name = "job-edit", description = "Change a SCHEDULED job; omitted options are kept")
    static final class JobEditCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Job id")
        String jobId;

        @Option(names = {"--name"}, description = "New job name")
        String name;

        @Option(names = {"--run-at"}, description = "ISO-8601 instant or epoch ms")
        String runAt;

        @Option(names = {"--recurrence"}, description = "once|hourly|daily|weekly|monthly")
        String recurrence;

        @Option(names = {"--hosts"}, description = "Target hosts, comma-separated")
        String hosts;

        @Option(names = {"--payload"}, description = "JSON object payload")
        String payload;

        @Override
        public Integer call() {
            print(parent.runtime().scheduler().edit(
                    jobId, Inputs.parseJobEdit(name, runAt, recurrence, hosts, payload), CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "job-reschedule", description = "Move a SCHEDULED job's next run")
    static final class JobRescheduleCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Job id")
        String jobId;

        @Option(names = {"--run-at"}, required = true, description = "ISO-8601 instant or epoch ms")
        String runAt;

        @Override
        public Integer call() {
            print(parent.runtime().scheduler().reschedule(jobId, Inputs.parseInstant(runAt, null), CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "job-delete", description = "Delete a job that is not running; its commands are kept")
    static final class JobDeleteCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            print(parent.runtime().scheduler().delete(jobId, CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "job-cancel", description = "Cancel a scheduled job")
    static final class JobCancelCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            print(parent.runtime().scheduler().cancel(jobId, CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "sweep", description = "Run one scheduler sweep now")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--recover-stale"}, defaultValue = "true", description = "Re-drive RUNNING jobs whose claim expired")
        boolean recoverStale;

        @Override
        public Integer call() {
            FleetMeshRuntime runtime = parent.runtime();
            Map<String, Object> out = new LinkedHashMap<>();
            if (recoverStale) {
                out.put("recovered", runtime.scheduler().recoverStaleRunning(
                        runtime.clock().instant(), Duration.ofMillis(runtime.settings().staleRunningMs())));
            }
            SweepOutcome outcome = runtime.scheduler().sweep(runtime.clock().instant());
            out.put("sweep", outcome);
            print(out);
            return 0;
        }
    }

    @Command(name = "command-enqueue", description = "Queue an ad-hoc command for one host")
    static final class CommandEnqueueCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--host"}, required = true, description = "Target host")
        String host;

        @Option(names = {"--action"}, required = true, description = "Action type")
        String actionType;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "JSON payload")
        String payload;

        @Override
        public Integer call() {
            print(parent.runtime().dispatcher().enqueue(host, actionType, payload));
            return 0;
        }
    }

    @Command(name = "command-list", description = "List remote commands")
    static final class CommandListCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--status"}, description = "Filter by status")
        String status;

        @Option(names = {"--host"}, description = "Only commands for this host")
        String host;

        @Option(names = {"--job"}, description = "Only commands fanned out by this job")
        String jobId;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            FleetMeshRuntime runtime = parent.runtime();
            CommandStatus filter = status == null || status.isBlank() ? null : CommandStatus.fromString(status);
            List<RemoteCommand> commands;
            if (jobId != null && !jobId.isBlank()) {
                commands = runtime.scheduler().commandsFor(jobId);
            } else if (host != null && !host.isBlank()) {
                commands = runtime.dispatcher().forHost(host, filter);
            } else {
                commands = runtime.dispatcher().list(filter, limit);
            }
            print(commands);
            return 0;
        }
    }

    @Command(name = "command-expire", description = "Expire PENDING/SENT commands older than the TTL")
    static final class CommandExpireCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--ttl-ms"}, defaultValue = "-1", description = "Age limit in ms (-1 uses settings)")
        long ttlMs;

        @Override
        public Integer call() {
            FleetMeshRuntime runtime = parent.runtime();
            Duration ttl = Duration.ofMillis(ttlMs < 0 ? runtime.settings().commandTtlMs() : ttlMs);
            int expired = runtime.dispatcher().expire(runtime.clock().millis(), ttl);
            print(Map.of("expired", expired, "ttl_ms", ttl.toMillis()));
            return 0;
        }
    }

    @Command(name = "command-cancel", description = "Cancel a PENDING command")
    static final class CommandCancelCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Command id")
        String commandId;

        @Override
        public Integer call() {
            print(parent.runtime().dispatcher().cancel(commandId, CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "command-clear", description = "Delete every command addressed to a host")
    static final class CommandClearCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--host"}, required = true, description = "Target host")
        String host;

        @Override
        public Integer call() {
            int removed = parent.runtime().dispatcher().clearForHost(host);
            print(Map.of("host", host, "removed", removed));
            return 0;
        }
    }

    @Command(name = "link-issue", description = "Issue an installer download link")
    static final class LinkIssueCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--ttl-seconds"}, description = "Lifetime in seconds (omit for no expiry)")
        String ttlSeconds;

        @Option(names = {"--visibility"}, defaultValue = "public", description = "public|restricted")
        String visibility;

        @Override
        public Integer call() {
            DownloadLink link = parent.runtime().links().issue(
                    CLI_ACTOR, Inputs.parseTtlSeconds(ttlSeconds), LinkVisibility.fromString(visibility));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("link", link);
            out.put("path", AdminApi.DOWNLOAD_PREFIX + link.token());
            print(out);
            return 0;
        }
    }

    @Command(name = "link-list", description = "List download links")
    static final class LinkListCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Override
        public Integer call() {
            print(parent.runtime().links().list());
            return 0;
        }
    }

    @Command(name = "link-revoke", description = "Revoke a download link")
    static final class LinkRevokeCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Link id")
        String linkId;

        @Override
        public Integer call() {
            print(parent.runtime().links().revoke(linkId, CLI_ACTOR));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Override
        public Integer call() {
            AuditLogger audit = parent.runtime().audit();
            AuditLogger.ChainVerification verification = audit.verify();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("verification", verification);
            out.put("head_hash", audit.headHash());
            print(out);
            return verification.valid() ? 0 : 2;
        }
    }

    @Command(name = "serve", description = "Run the admin API, the sweep timer and the agent endpoint")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--port"}, defaultValue = "-1", description = "Admin port (-1 uses settings)")
        int port;

        @Option(names = {"--http-workers"}, defaultValue = "8", description = "Admin HTTP handler threads")
        int httpWorkers;

        @Override
        public Integer call() throws Exception {
            FleetMeshRuntime runtime = parent.runtime();
            int bindPort = port < 0 ? runtime.settings().adminPort() : port;
            HttpServer server = HttpServer.create(new InetSocketAddress(bindPort), 0);
            new AdminApi(runtime).mount(server);
            StandaloneIngestServer standalone = null;
            if (runtime.settings().embeddedIngest()) {
                new EmbeddedIngestHost(runtime.ingestEndpoint()).attach(server);
            } else {
                standalone = new StandaloneIngestServer(
                        runtime.ingestEndpoint(),
                        runtime.settings().ingestHost(),
                        runtime.settings().ingestPort(),
                        runtime.settings().backgroundWorkers()
                ).start();
            }
            ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, httpWorkers));
            server.setExecutor(executor);
            server.start();
            runtime.startSweepTimer();
            if (!runtime.principals().enabled()) {
                System.err.println("warning: no principals configured, admin API is open");
            }
            System.out.println("Admin API listening on http://127.0.0.1:" + server.getAddress().getPort());
            CountDownLatch stopped = new CountDownLatch(1);
            StandaloneIngestServer ingest = standalone;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop(0);
                executor.shutdown();
                if (ingest != null) {
                    ingest.close();
                }
                runtime.close();
                stopped.countDown();
            }, "fleetmesh-serve-shutdown"));
            stopped.await();
            return 0;
        }
    }

    @Command(name = "serve-ingest", description = "Run the agent endpoint on its own listener")
    static final class ServeIngestCommand implements Callable<Integer> {
        @ParentCommand
        FleetMeshCommand parent;

        @Option(names = {"--host"}, description = "Bind host (default from settings)")
        String host;

        @Option(names = {"--port"}, description = "Bind port (default from settings)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            FleetMeshRuntime runtime = parent.runtime(host, port);
            StandaloneIngestServer server = new StandaloneIngestServer(
                    runtime.ingestEndpoint(),
                    runtime.settings().ingestHost(),
                    runtime.settings().ingestPort(),
                    runtime.settings().backgroundWorkers()
            ).start();
            System.out.println("Agent ingest listening on " + runtime.settings().ingestHost() + ":" + server.boundPort());
            Runtime.getRuntime().addShutdownHook(new Thread(server::close, "fleetmesh-ingest-shutdown"));
            server.awaitShutdown();
            return 0;
        }
    }
}
