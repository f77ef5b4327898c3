package io.gossipledger.core;

import io.gossipledger.core.api.ApiServer;
import io.gossipledger.core.node.Node;
import io.gossipledger.core.node.NodeConfig;
import io.gossipledger.core.node.PeerIdentity;
import io.gossipledger.core.p2p.P2pServer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }
        configureLogging();

        PeerIdentity identity = options.nodeId() == null ? PeerIdentity.random() : new PeerIdentity(options.nodeId());
        NodeConfig config = NodeConfig.defaultLocal()
                .withIdentity(identity)
                .withNetwork(options.p2pPort(), options.p2pPeers())
                .withSyncInterval(options.syncIntervalMillis());
        if (options.minerMaxTries() > 0) {
            config = config.withMinerMaxTries(options.minerMaxTries());
        }
        Node node = Node.inMemory(config);

        ApiServer apiServer = null;
        P2pServer p2pServer = null;
        try {
            node.start();
            LOG.info("Peer Id: " + identity);

            p2pServer = new P2pServer(
                    identity.value(),
                    config.p2pPort,
                    node,
                    node.membership(),
                    config.pingIntervalMillis,
                    config.idleTimeoutMillis,
                    true,
                    config.maxFrameBytes
            );
            p2pServer.subscribe(config.chainTopic);
            p2pServer.subscribe(config.blockTopic);
            node.bindTransport(p2pServer);
            p2pServer.start();
            p2pServer.connect(config.bootstrapPeers);

            if (options.enableApi()) {
                apiServer = new ApiServer(node, options.apiBind(), options.apiPort(), options.apiToken());
                apiServer.start();
            }

            if (options.console()) {
                LOG.info("Console ready. Type 'help' for commands.");
                BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                new ConsoleCommands(node, System.out).run(stdin);
            } else {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "gossip-ledger-shutdown"));
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (apiServer != null) {
                apiServer.stop();
            }
            if (p2pServer != null) {
                p2pServer.stop();
            }
            node.close();
        }
    }

    /** Load the bundled logging.properties unless the JVM was given its own. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null
                || System.getProperty("java.util.logging.config.class") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load bundled logging.properties", e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            String nodeId,
            int p2pPort,
            List<String> p2pPeers,
            boolean enableApi,
            String apiBind,
            int apiPort,
            String apiToken,
            long syncIntervalMillis,
            long minerMaxTries,
            boolean console
    ) {
        static CliOptions parse(String[] args) {
            String nodeId = envOrDefault("GOSSIP_LEDGER_NODE_ID", null);
            int p2pPort = 9000;
            long syncIntervalMillis = 0L;
            long minerMaxTries = 0L;
            boolean enableApi = "true".equalsIgnoreCase(System.getenv("GOSSIP_LEDGER_ENABLE_API"));
            String apiBind = envOrDefault("GOSSIP_LEDGER_API_BIND", "127.0.0.1");
            int apiPort = 8080;
            String apiToken = System.getenv("GOSSIP_LEDGER_API_TOKEN");
            boolean console = !"false".equalsIgnoreCase(System.getenv("GOSSIP_LEDGER_CONSOLE"));
            boolean showHelp = false;
            String error = null;

            try {
                p2pPort = envPort("GOSSIP_LEDGER_P2P_PORT", p2pPort);
                apiPort = envPort("GOSSIP_LEDGER_API_PORT", apiPort);
                String syncEnv = System.getenv("GOSSIP_LEDGER_SYNC_INTERVAL_MS");
                if (syncEnv != null && !syncEnv.isBlank()) {
                    syncIntervalMillis = parseNonNegativeLong(syncEnv, "GOSSIP_LEDGER_SYNC_INTERVAL_MS");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            List<String> p2pPeers = new ArrayList<>();
            String peersEnv = System.getenv("GOSSIP_LEDGER_P2P_PEERS");
            if (peersEnv != null && !peersEnv.isBlank()) {
                for (String endpoint : peersEnv.split(",")) {
                    if (endpoint != null && !endpoint.isBlank()) {
                        p2pPeers.add(endpoint.trim());
                    }
                }
            }

            for (String arg : args == null ? new String[0] : args) {
                if (arg == null || arg.isBlank()) {
                    continue;
                }
                int eq = arg.indexOf('=');
                String flag = eq < 0 ? arg : arg.substring(0, eq);
                String value = eq < 0 ? null : arg.substring(eq + 1);
                try {
                    switch (flag) {
                        case "--help":
                        case "-h":
                            showHelp = true;
                            break;
                        case "--node-id":
                            nodeId = required(flag, value);
                            break;
                        case "--p2p-port":
                            p2pPort = parsePort(required(flag, value), flag);
                            break;
                        case "--p2p-peer":
                            p2pPeers.add(required(flag, value).trim());
                            break;
                        case "--enable-api":
                            enableApi = true;
                            break;
                        case "--api-bind":
                            apiBind = required(flag, value);
                            break;
                        case "--api-port":
                            apiPort = parsePort(required(flag, value), flag);
                            break;
                        case "--api-token":
                            apiToken = required(flag, value);
                            break;
                        case "--sync-interval-ms":
                            syncIntervalMillis = parseNonNegativeLong(required(flag, value), flag);
                            break;
                        case "--miner-max-tries":
                            minerMaxTries = parsePositiveLong(required(flag, value), flag);
                            break;
                        case "--no-console":
                            console = false;
                            break;
                        default:
                            throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    if (error == null) {
                        error = ex.getMessage();
                    }
                }
            }

            if (nodeId != null && nodeId.isBlank()) {
                nodeId = null;
            }
            if (apiToken != null && apiToken.isBlank()) {
                apiToken = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    nodeId,
                    p2pPort,
                    List.copyOf(p2pPeers),
                    enableApi,
                    apiBind,
                    apiPort,
                    apiToken,
                    syncIntervalMillis,
                    minerMaxTries,
                    console
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: gossip-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --node-id=<id>             Peer identity advertised to other nodes (default: random UUID)
  --p2p-port=<port>          Port for the P2P listener (default 9000)
  --p2p-peer=<host:port>     Add a bootstrap peer (repeatable)
  --enable-api               Start the REST API server (default bind 127.0.0.1:8080)
  --api-bind=<host>          Bind address for the REST API
  --api-port=<port>          Port for the REST API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the REST API
  --sync-interval-ms=<ms>    Periodically request a random peer's chain (default 0 = off)
  --miner-max-tries=<n>      Nonce attempts before a mining job gives up (default 50000000)
  --no-console               Do not read commands from stdin; run until interrupted

Console commands:
  ls p                       List active peers
  ls c                       Print the local chain
  create b <data>            Mine a block carrying <data> and announce it
  sync [peer]                Request a peer's chain (all active peers if omitted)
  exit                       Stop the node

Environment overrides:
  GOSSIP_LEDGER_NODE_ID          Override the generated peer identity
  GOSSIP_LEDGER_P2P_PORT         P2P listener port
  GOSSIP_LEDGER_P2P_PEERS        Comma-separated bootstrap peers (host:port)
  GOSSIP_LEDGER_ENABLE_API       Set to "true" to enable the REST API without CLI flag
  GOSSIP_LEDGER_API_BIND         REST API bind address
  GOSSIP_LEDGER_API_PORT         REST API port
  GOSSIP_LEDGER_API_TOKEN        Token for REST API auth (if --api-token not supplied)
  GOSSIP_LEDGER_SYNC_INTERVAL_MS Periodic re-sync interval
  GOSSIP_LEDGER_CONSOLE          Set to "false" to disable the console
""");
        }

        private static String required(String flag, String value) {
            if (value == null) {
                throw new IllegalArgumentException("Missing value for " + flag + " (use " + flag + "=<value>)");
            }
            return value;
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            long parsed = parseNonNegativeLong(value, flag);
            if (parsed == 0) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": must be at least 1");
            }
            return parsed;
        }

        private static long parseNonNegativeLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
