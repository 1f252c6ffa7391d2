package io.txledger.core;

import io.txledger.core.api.ApiServer;
import io.txledger.core.node.Genesis;
import io.txledger.core.node.LedgerConfig;
import io.txledger.core.node.TransactionLedger;
import io.txledger.core.protocol.Hash;

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

        Path genesisPath = options.genesis().toAbsolutePath().normalize();
        if (!Files.isRegularFile(genesisPath)) {
            System.err.println("Error: genesis file not found: " + genesisPath);
            System.exit(1);
        }
        Genesis genesis = Genesis.load(genesisPath);
        LOG.info("Loaded genesis with " + genesis.accounts().size() + " accounts from " + genesisPath);

        LedgerConfig config = LedgerConfig.defaultLocal()
                .withKeepAlive(options.txKeepAliveSeconds());
        if (options.dataDir() != null) {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            Files.createDirectories(dataPath);
            config = config.withDataDir(dataPath.toString());
        }

        ApiServer apiServer = null;
        ScheduledExecutorService purger = null;
        try (TransactionLedger ledger = TransactionLedger.open(config, genesis)) {
            Hash finalized = ledger.start(genesis);
            LOG.info("Last finalized block " + finalized.hex());

            if (options.enableApi()) {
                apiServer = new ApiServer(ledger, options.apiBind(), options.apiPort(), options.apiToken());
                apiServer.start();
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "txledger-shutdown"));
                purger = startPurger(ledger);
                LOG.info("Ledger running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (purger != null) {
                purger.shutdownNow();
            }
            if (apiServer != null) {
                apiServer.stop();
            }
        }
    }

    private static ScheduledExecutorService startPurger(TransactionLedger ledger) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "txledger-purge");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                ledger.purge(System.currentTimeMillis() / 1000);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Background purge failed", e);
            }
        };
        executor.scheduleAtFixedRate(task, 10, 10, TimeUnit.SECONDS);
        return executor;
    }

    record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path genesis,
            Path dataDir,
            boolean keepAlive,
            long txKeepAliveSeconds,
            boolean enableApi,
            String apiBind,
            int apiPort,
            String apiToken
    ) {
        static CliOptions parse(String[] args) {
            Path genesis = envPath("TXLEDGER_GENESIS", null);
            Path dataDir = envPath("TXLEDGER_DATA_DIR", null);
            boolean keepAlive = false;
            long txKeepAlive = LedgerConfig.defaultLocal().transactionKeepAliveSeconds;
            boolean enableApi = "true".equalsIgnoreCase(System.getenv("TXLEDGER_ENABLE_API"));
            String apiBind = envOrDefault("TXLEDGER_API_BIND", "127.0.0.1");
            int apiPort = 8080;
            String apiToken = null;
            boolean showHelp = false;
            String error = null;

            String portEnv = System.getenv("TXLEDGER_API_PORT");
            if (portEnv != null && !portEnv.isBlank()) {
                try {
                    apiPort = parsePort(portEnv, "TXLEDGER_API_PORT");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }
            String txKeepAliveEnv = System.getenv("TXLEDGER_TX_KEEP_ALIVE");
            if (txKeepAliveEnv != null && !txKeepAliveEnv.isBlank()) {
                try {
                    txKeepAlive = parseNonNegativeLong(txKeepAliveEnv, "TXLEDGER_TX_KEEP_ALIVE");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--genesis=")) {
                        genesis = Path.of(arg.substring("--genesis=".length()));
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.startsWith("--tx-keep-alive=")) {
                        try {
                            txKeepAlive = parseNonNegativeLong(arg.substring("--tx-keep-alive=".length()), "--tx-keep-alive");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.equals("--enable-api")) {
                        enableApi = true;
                    } else if (arg.startsWith("--api-bind=")) {
                        apiBind = arg.substring("--api-bind=".length());
                    } else if (arg.startsWith("--api-port=")) {
                        try {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--api-token=")) {
                        apiToken = arg.substring("--api-token=".length());
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (apiToken == null || apiToken.isBlank()) {
                apiToken = System.getenv("TXLEDGER_API_TOKEN");
            }
            keepAlive = keepAlive || enableApi || "true".equalsIgnoreCase(System.getenv("TXLEDGER_KEEP_ALIVE"));

            if (genesis == null && !showHelp) {
                showHelp = true;
                error = "--genesis=<file> is required";
            }

            return new CliOptions(
                    showHelp,
                    error,
                    genesis,
                    dataDir,
                    keepAlive,
                    txKeepAlive,
                    enableApi,
                    apiBind,
                    apiPort,
                    apiToken
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: txledger --genesis=<file> [options]

Options:
  --help, -h                 Show this help message and exit
  --genesis=<file>           Genesis JSON (accounts, updateKeys, chainParameters)
  --data-dir=<path>          Persist governance state in RocksDB under this path (default: in memory)
  --keep-alive               Keep the ledger running until interrupted
  --tx-keep-alive=<seconds>  Drop received, uncommitted transactions after this long (default 300)
  --enable-api               Start the HTTP API (default bind 127.0.0.1:8080)
  --api-bind=<host>          Bind address for the HTTP API
  --api-port=<port>          Port for the HTTP API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the HTTP API

Environment overrides:
  TXLEDGER_GENESIS           Default for --genesis
  TXLEDGER_DATA_DIR          Default for --data-dir
  TXLEDGER_TX_KEEP_ALIVE     Default for --tx-keep-alive
  TXLEDGER_ENABLE_API        Set to "true" to enable the HTTP API without CLI flag
  TXLEDGER_API_BIND          Default for --api-bind
  TXLEDGER_API_PORT          Default for --api-port
  TXLEDGER_API_TOKEN         Token for API auth (if --api-token not supplied)
  TXLEDGER_KEEP_ALIVE        Set to "true" to force keep-alive mode
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

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
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
