package io.governance.core;

import io.governance.core.node.GovernanceNode;
import io.governance.core.node.NodeConfig;
import io.governance.core.rpc.RpcServer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
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

        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        Files.createDirectories(dataPath);
        NodeConfig config = NodeConfig.loadOrDefault(dataPath);

        GovernanceNode node = options.inMemory()
                ? GovernanceNode.inMemory(config)
                : GovernanceNode.rocks(config, dataPath.resolve("db").toString());

        RpcServer rpcServer = null;
        ScheduledExecutorService ticker = null;
        try {
            node.start();
            LOG.info("Governance contract " + config.contractAddress + " (token " + config.tokenAddress
                    + ", owner " + config.owner + ")" + (options.inMemory() ? " in memory" : " at " + dataPath));

            if (options.enableRpc()) {
                rpcServer = new RpcServer(node, options.rpcBind(), options.rpcPort(), options.rpcToken());
                rpcServer.start();
            }

            CountDownLatch shutdownLatch = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "governance-shutdown"));
            ticker = startTicker(node, options.blockIntervalMillis());

            LOG.info("Node running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            if (ticker != null) {
                ticker.shutdownNow();
            }
            if (rpcServer != null) {
                rpcServer.stop();
            }
            node.close();
        }
    }

    private static ScheduledExecutorService startTicker(GovernanceNode node, long intervalMillis) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "governance-ticker");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                long height = node.tick();
                LOG.finest(() -> "Height " + height);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Background height tick failed", e);
            }
        };
        executor.scheduleAtFixedRate(task, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        return executor;
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean enableRpc,
            String rpcBind,
            int rpcPort,
            String rpcToken,
            long blockIntervalMillis
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("GOV_DATA_DIR", Path.of("./data/governance"));
            boolean inMemory = "true".equalsIgnoreCase(System.getenv("GOV_IN_MEMORY"));
            boolean enableRpc = !"false".equalsIgnoreCase(System.getenv("GOV_ENABLE_RPC"));
            String rpcBind = envOrDefault("GOV_RPC_BIND", "127.0.0.1");
            String rpcToken = System.getenv("GOV_RPC_TOKEN");
            boolean showHelp = false;
            String error = null;

            int rpcPort = 9090;
            long blockIntervalMillis = 1_000L;
            try {
                rpcPort = envPort("GOV_RPC_PORT", rpcPort);
                String intervalEnv = System.getenv("GOV_BLOCK_INTERVAL_MS");
                if (intervalEnv != null && !intervalEnv.isBlank()) {
                    blockIntervalMillis = parseInterval(intervalEnv, "GOV_BLOCK_INTERVAL_MS");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--no-rpc")) {
                        enableRpc = false;
                    } else if (arg.startsWith("--rpc-bind=")) {
                        rpcBind = arg.substring("--rpc-bind=".length());
                    } else if (arg.startsWith("--rpc-port=")) {
                        try {
                            rpcPort = parsePort(arg.substring("--rpc-port=".length()), "--rpc-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--rpc-token=")) {
                        rpcToken = arg.substring("--rpc-token=".length());
                    } else if (arg.startsWith("--block-interval-ms=")) {
                        try {
                            blockIntervalMillis = parseInterval(arg.substring("--block-interval-ms=".length()), "--block-interval-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (rpcToken != null && rpcToken.isBlank()) {
                rpcToken = null;
            }

            return new CliOptions(showHelp, error, dataDir, inMemory, enableRpc, rpcBind, rpcPort, rpcToken,
                    blockIntervalMillis);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: token-governance [options] [data-dir]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for governance data and governance.json (default ./data/governance)
  --in-memory                Keep governance state in memory instead of RocksDB
  --no-rpc                   Do not start the RPC server
  --rpc-bind=<host>          Bind address for the RPC server (default 127.0.0.1)
  --rpc-port=<port>          Port for the RPC server (default 9090)
  --rpc-token=<token>        Require Bearer/X-API-Key token for the RPC server
  --block-interval-ms=<ms>   Milliseconds between block heights (default 1000)

Environment overrides:
  GOV_DATA_DIR               Override --data-dir
  GOV_IN_MEMORY              Set to "true" for --in-memory
  GOV_ENABLE_RPC             Set to "false" for --no-rpc
  GOV_RPC_BIND               Override --rpc-bind
  GOV_RPC_PORT               Override --rpc-port
  GOV_RPC_TOKEN              Token for RPC auth (if --rpc-token not supplied)
  GOV_BLOCK_INTERVAL_MS      Override --block-interval-ms
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
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

        private static long parseInterval(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
