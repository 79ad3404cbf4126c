package io.bundlemesh.cli;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.bundlemesh.config.BundleMeshConfig;
import io.bundlemesh.model.Audience;
import io.bundlemesh.model.Bundle;
import io.bundlemesh.model.DeliveredPayload;
import io.bundlemesh.model.Priority;
import io.bundlemesh.observability.AuditLogger;
import io.bundlemesh.propagation.SessionOutcome;
import io.bundlemesh.runtime.BundleNode;
import io.bundlemesh.security.NodeIdentity;
import io.bundlemesh.storage.Database;
import io.bundlemesh.util.Jsons;
import org.bouncycastle.util.encoders.Hex;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "bundlemesh",
        mixinStandardHelpOptions = true,
        description = "Delay-tolerant bundle mesh node CLI",
        subcommands = {
                BundleMeshCommand.InitCommand.class,
                BundleMeshCommand.IdentityCommand.class,
                BundleMeshCommand.SubscribeCommand.class,
                BundleMeshCommand.SubmitCommand.class,
                BundleMeshCommand.InboxCommand.class,
                BundleMeshCommand.PendingCommand.class,
                BundleMeshCommand.SyncCommand.class,
                BundleMeshCommand.ServeCommand.class,
                BundleMeshCommand.ReapCommand.class,
                BundleMeshCommand.NeighborsCommand.class,
                BundleMeshCommand.StatsCommand.class,
                BundleMeshCommand.MetricsCommand.class,
                BundleMeshCommand.HealthCommand.class,
                BundleMeshCommand.WipeCommand.class,
                BundleMeshCommand.SecretSealCommand.class,
                BundleMeshCommand.SecretOpenCommand.class,
                BundleMeshCommand.EphemeralAttachCommand.class,
                BundleMeshCommand.EphemeralListCommand.class,
                BundleMeshCommand.AuditVerifyCommand.class,
                BundleMeshCommand.SchemaMigrationsCommand.class
        }
)
public final class BundleMeshCommand implements Runnable {

    @Option(names = {"--root"}, description = "Node data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | identity | subscribe | submit | inbox | pending | sync | serve | reap | neighbors | stats | metrics | health | wipe | secret-seal | secret-open | ephemeral-attach | ephemeral-list | audit-verify | schema-migrations");
    }

    BundleMeshConfig config() {
        return BundleMeshConfig.fromRoot(root);
    }

    BundleNode node() {
        BundleNode node = new BundleNode(config());
        node.init();
        return node;
    }

    @Command(name = "init", description = "Create the data root, schema and node keys")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--community-key"}, description = "Hex community key to join an existing mesh")
        String communityKeyHex;

        @Override
        public Integer call() {
            BundleMeshConfig config = parent.config();
            if (communityKeyHex != null && !communityKeyHex.isBlank()) {
                boolean installed = NodeIdentity.installCommunityKey(config.securityRoot(), Hex.decode(communityKeyHex.trim()));
                if (!installed) {
                    System.err.println("Community key already present; keeping the existing one");
                }
            }
            try (BundleNode node = parent.node()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("root", config.rootDir().toString());
                out.put("address", node.address());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "identity", description = "Show this node's address and public keys")
    static final class IdentityCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--export-community-key"}, description = "Also print the shared community key (secret)")
        boolean exportCommunity;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("address", node.address());
                out.put("trustedMember", node.settings().trustedMember());
                if (exportCommunity) {
                    out.put("communityKey", Hex.toHexString(NodeIdentity.exportCommunityKey(parent.config().securityRoot())));
                }
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "subscribe", description = "Subscribe to (or with --remove, leave) a topic")
    static final class SubscribeCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--topic"}, required = true, description = "Topic name")
        String topic;

        @Option(names = {"--remove"}, description = "Unsubscribe instead")
        boolean remove;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                if (remove) {
                    node.unsubscribe(topic);
                } else {
                    node.subscribe(topic);
                }
                System.out.println(Jsons.toJson(Map.of("subscriptions", node.subscriptions())));
            }
            return 0;
        }
    }

    @Command(name = "submit", description = "Create, sign and queue a bundle")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--to"}, required = true, description = "Destination dtn://<address|*|trusted>/<topic>")
        String destination;

        @Option(names = {"--topic"}, required = true, description = "Topic")
        String topic;

        @Option(names = {"--text"}, required = true, description = "UTF-8 payload")
        String text;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "emergency|expedited|normal|bulk")
        String priority;

        @Option(names = {"--audience"}, defaultValue = "public", description = "public|trusted|destination_only")
        String audience;

        @Option(names = {"--ttl-ms"}, defaultValue = "0", description = "Time to live; 0 uses the configured default")
        long ttlMs;

        @Option(names = {"--hop-limit"}, defaultValue = "0", description = "Hop limit; 0 uses the configured default")
        int hopLimit;

        @Option(names = {"--custody"}, description = "Request custody acknowledgement (unicast only)")
        boolean custody;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                long ttl = ttlMs > 0L ? ttlMs : node.settings().defaultTtlMs();
                int hops = hopLimit > 0 ? hopLimit : node.settings().defaultHopLimit();
                String id = node.submit(
                        destination,
                        topic,
                        text.getBytes(StandardCharsets.UTF_8),
                        Priority.fromString(priority),
                        Audience.fromString(audience),
                        ttl,
                        hops,
                        custody
                );
                System.out.println(Jsons.toJson(Map.of("bundleId", id)));
            }
            return 0;
        }
    }

    @Command(name = "inbox", description = "Print delivered payloads in delivery order")
    static final class InboxCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--topic"}, description = "Only this topic")
        String topic;

        @Option(names = {"--after"}, defaultValue = "0", description = "Only deliveries after this sequence")
        long after;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                List<Map<String, Object>> rows = new ArrayList<>();
                for (DeliveredPayload d : node.deliveries(topic, after)) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("sequence", d.sequence());
                    row.put("bundleId", d.bundleId());
                    row.put("topic", d.topic());
                    row.put("priority", d.priority().label());
                    row.put("audience", d.audience().label());
                    row.put("createdAtMs", d.createdAtMs());
                    row.put("text", d.plaintextUtf8());
                    rows.add(row);
                }
                System.out.println(Jsons.toJson(rows));
            }
            return 0;
        }
    }

    @Command(name = "pending", description = "List stored bundles still awaiting propagation")
    static final class PendingCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--topic"}, description = "Only this topic")
        String topic;

        @Option(names = {"--to"}, description = "Only this destination")
        String destination;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                List<Map<String, Object>> rows = new ArrayList<>();
                for (Bundle b : node.pending(topic, destination)) {
                    if (rows.size() >= limit) {
                        break;
                    }
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("bundleId", b.id());
                    row.put("destination", b.destination().toString());
                    row.put("topic", b.topic());
                    row.put("priority", b.priority().label());
                    row.put("expiresAtMs", b.expiresAtMs());
                    row.put("hopCount", b.hopCount());
                    row.put("hopLimit", b.hopLimit());
                    rows.add(row);
                }
                System.out.println(Jsons.toJson(rows));
            }
            return 0;
        }
    }

    @Command(name = "sync", description = "Run one exchange with a neighbor over TCP")
    static final class SyncCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--peer"}, required = true, description = "Neighbor host:port")
        String peer;

        @Override
        public Integer call() throws Exception {
            int colon = peer.lastIndexOf(':');
            if (colon <= 0 || colon == peer.length() - 1) {
                throw new IllegalArgumentException("--peer must look like host:port");
            }
            String host = peer.substring(0, colon);
            int port = Integer.parseInt(peer.substring(colon + 1));
            try (BundleNode node = parent.node()) {
                SessionOutcome outcome = node.connect(host, port).get();
                System.out.println(Jsons.toJson(outcome));
                return outcome.completed() ? 0 : 1;
            }
        }
    }

    @Command(name = "serve", description = "Accept neighbors and expose /metrics and /health over HTTP")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--port"}, defaultValue = "4556", description = "Neighbor exchange port")
        int port;

        @Option(names = {"--http-port"}, defaultValue = "9464", description = "Metrics/health HTTP port; 0 disables")
        int httpPort;

        @Override
        public Integer call() throws Exception {
            BundleNode node = parent.node();
            int bound = node.serve(port);
            HttpServer server = null;
            if (httpPort > 0) {
                server = HttpServer.create(new InetSocketAddress(httpPort), 0);
                server.createContext("/metrics", exchange ->
                        respond(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", node.metricsText()));
                server.createContext("/health", exchange -> {
                    BundleNode.HealthOutcome health = node.health();
                    respond(exchange, health.ok() ? 200 : 503, "application/json", Jsons.toJson(health));
                });
                server.setExecutor(null);
                server.start();
                System.out.println("HTTP listening on http://127.0.0.1:" + httpPort + "/metrics");
            }
            System.out.println("Node " + node.address() + " accepting neighbors on port " + bound);
            CountDownLatch stopped = new CountDownLatch(1);
            HttpServer http = server;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (http != null) {
                    http.stop(0);
                }
                node.close();
                stopped.countDown();
            }, "bundlemesh-shutdown"));
            stopped.await();
            return 0;
        }

        private static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", contentType);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    @Command(name = "reap", description = "Delete expired bundles and due ephemeral records now")
    static final class ReapCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                System.out.println(Jsons.toJson(node.reap()));
            }
            return 0;
        }
    }

    @Command(name = "neighbors", description = "Show neighbor contact bookkeeping")
    static final class NeighborsCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                System.out.println(Jsons.toJson(node.neighbors()));
            }
            return 0;
        }
    }

    @Command(name = "stats", description = "Show store and propagation counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                System.out.println(Jsons.toJson(node.stats()));
            }
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                System.out.print(node.metricsText());
            }
            return 0;
        }
    }

    @Command(name = "health", description = "Check node health")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                BundleNode.HealthOutcome out = node.health();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "wipe", description = "Irreversibly destroy this node's keys")
    static final class WipeCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--confirm"}, description = "Required; wiping cannot be undone")
        boolean confirm;

        @Override
        public Integer call() {
            if (!confirm) {
                System.err.println("Refusing to wipe keys without --confirm");
                return 2;
            }
            try (BundleNode node = parent.node()) {
                node.wipe();
                System.out.println(Jsons.toJson(Map.of("wiped", true)));
            }
            return 0;
        }
    }

    @Command(name = "secret-seal", description = "Seal a secret (e.g. recovery phrase) under a passphrase")
    static final class SecretSealCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--name"}, required = true, description = "Secret name")
        String name;

        @Option(names = {"--secret"}, required = true, interactive = true, arity = "0..1", description = "Secret text")
        char[] secret;

        @Option(names = {"--passphrase"}, required = true, interactive = true, arity = "0..1", description = "Passphrase")
        char[] passphrase;

        @Override
        public Integer call() {
            byte[] bytes = new String(secret).getBytes(StandardCharsets.UTF_8);
            try (BundleNode node = parent.node()) {
                System.out.println(Jsons.toJson(Map.of("sealed", node.sealSecret(name, passphrase, bytes).toString())));
            } finally {
                Arrays.fill(bytes, (byte) 0);
                Arrays.fill(secret, '\0');
                Arrays.fill(passphrase, '\0');
            }
            return 0;
        }
    }

    @Command(name = "secret-open", description = "Open a sealed secret")
    static final class SecretOpenCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--name"}, required = true, description = "Secret name")
        String name;

        @Option(names = {"--passphrase"}, required = true, interactive = true, arity = "0..1", description = "Passphrase")
        char[] passphrase;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                byte[] secret = node.openSecret(name, passphrase);
                System.out.println(new String(secret, StandardCharsets.UTF_8));
                Arrays.fill(secret, (byte) 0);
            } finally {
                Arrays.fill(passphrase, '\0');
            }
            return 0;
        }
    }

    @Command(name = "ephemeral-attach", description = "Attach a record that is purged at a fixed time")
    static final class EphemeralAttachCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--parent"}, required = true, description = "Parent entity id")
        String parentId;

        @Option(names = {"--kind"}, required = true, description = "Record kind")
        String kind;

        @Option(names = {"--body"}, required = true, description = "Record body")
        String body;

        @Option(names = {"--purge-at-ms"}, required = true, description = "Parent closure time (epoch ms)")
        long purgeAtMs;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                System.out.println(Jsons.toJson(node.attachEphemeral(parentId, kind, body, purgeAtMs)));
            }
            return 0;
        }
    }

    @Command(name = "ephemeral-list", description = "List ephemeral records of a parent")
    static final class EphemeralListCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--parent"}, required = true, description = "Parent entity id")
        String parentId;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                System.out.println(Jsons.toJson(node.ephemeralRecords(parentId)));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Override
        public Integer call() {
            try (BundleNode node = parent.node()) {
                AuditLogger.ChainCheck check = node.verifyAudit();
                System.out.println(Jsons.toJson(check));
                return check.intact() ? 0 : 1;
            }
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        BundleMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations(limit)));
            return 0;
        }
    }
}
