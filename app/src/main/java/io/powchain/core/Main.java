package io.powchain.core;

import io.powchain.core.consensus.ProofOfWork;
import io.powchain.core.metrics.BlockMetrics;
import io.powchain.core.node.GenesisBuilder;
import io.powchain.core.node.Node;
import io.powchain.core.node.NodeConfig;
import io.powchain.core.p2p.P2pServer;
import io.powchain.core.protocol.Block;
import io.powchain.core.protocol.Hex;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = options.toConfig();
        Node node = new Node(config);
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "powchain-shutdown"));

        try {
            node.start();
            if (options.referenceGenesis() && node.chain().height() == 0) {
                try {
                    Block genesis = node.submit(GenesisBuilder.referenceGenesis()).join();
                    LOG.info(() -> "Reference genesis in place: " + genesis);
                } catch (CompletionException e) {
                    LOG.log(Level.WARNING, "Could not mine the reference genesis", e.getCause());
                }
            }
            LOG.info("Type a line to mine it into a block (:chain, :peers, :metrics for status).");
            runConsole(node, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);

            LOG.info("Input closed. Node running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            node.stop();
        }
    }

    /** Read lines until EOF; each non-command line is mined into a block and broadcast. */
    static void runConsole(Node node, BufferedReader reader, PrintStream out) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            String input = line.strip();
            if (input.isEmpty()) {
                continue;
            }
            switch (input) {
                case ":chain":
                    printChain(node, out);
                    break;
                case ":peers":
                    printPeers(node, out);
                    break;
                case ":metrics":
                    out.print(BlockMetrics.scrapeMetrics());
                    break;
                default:
                    try {
                        Block block = node.submit(input).join();
                        out.println("Mined " + block);
                    } catch (CompletionException e) {
                        LOG.log(Level.WARNING, "Mining failed for input '" + input + "'", e.getCause());
                    }
            }
        }
    }

    private static void printChain(Node node, PrintStream out) {
        List<Block> blocks = node.chain().blocks();
        out.println("=== Chain (height " + blocks.size() + ", difficulty " + node.pow().difficulty() + ") ===");
        for (Block b : blocks) {
            out.println("#" + b.index()
                    + " ts=" + Long.toUnsignedString(b.timestamp())
                    + " nonce=" + Long.toUnsignedString(b.nonce())
                    + " txs=" + b.transactions().size()
                    + " data=" + b.data());
            out.println("    prev=" + Hex.encode(b.prevHash()));
            out.println("    hash=" + Hex.encode(b.hash()));
        }
    }

    private static void printPeers(Node node, PrintStream out) {
        out.println("=== Peers (" + node.peers().size() + ") ===");
        for (P2pServer.Peer peer : node.peers()) {
            out.println(peer.remoteAddress() + (peer.outbound() ? " (outbound)" : " (inbound)"));
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null && System.getProperty("java.util.logging.config.file") == null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not load logging.properties", e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            int port,
            List<String> peers,
            int difficulty,
            long reconnectDelayMillis,
            int maxFrameBytes,
            boolean strictContinuity,
            boolean verifyOnReplace,
            boolean referenceGenesis
    ) {
        static CliOptions parse(String[] args) {
            NodeConfig defaults = NodeConfig.defaultLocal();
            int port = defaults.listenPort;
            int difficulty = defaults.difficulty;
            long reconnectDelayMillis = defaults.reconnectDelayMillis;
            int maxFrameBytes = defaults.maxFrameBytes;
            boolean strictContinuity = defaults.strictContinuity;
            boolean verifyOnReplace = defaults.verifyOnReplace;
            boolean referenceGenesis = false;
            boolean showHelp = false;
            String error = null;

            List<String> peers = new ArrayList<>();
            String peersEnv = System.getenv("POWCHAIN_P2P_PEERS");
            if (peersEnv != null && !peersEnv.isBlank()) {
                for (String endpoint : peersEnv.split(",")) {
                    if (endpoint != null && !endpoint.isBlank()) {
                        peers.add(endpoint.trim());
                    }
                }
            }
            try {
                port = envPort("POWCHAIN_P2P_PORT", port);
                String difficultyEnv = System.getenv("POWCHAIN_DIFFICULTY");
                if (difficultyEnv != null && !difficultyEnv.isBlank()) {
                    difficulty = parseDifficulty(difficultyEnv.trim(), "POWCHAIN_DIFFICULTY");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            boolean portSeen = false;
            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--difficulty=")) {
                            difficulty = parseDifficulty(arg.substring("--difficulty=".length()), "--difficulty");
                        } else if (arg.startsWith("--reconnect-ms=")) {
                            reconnectDelayMillis = parsePositiveLong(arg.substring("--reconnect-ms=".length()), "--reconnect-ms");
                        } else if (arg.startsWith("--max-frame-bytes=")) {
                            maxFrameBytes = (int) Math.min(Integer.MAX_VALUE,
                                    parsePositiveLong(arg.substring("--max-frame-bytes=".length()), "--max-frame-bytes"));
                        } else if (arg.equals("--loose-continuity")) {
                            strictContinuity = false;
                        } else if (arg.equals("--no-verify-on-replace")) {
                            verifyOnReplace = false;
                        } else if (arg.equals("--reference-genesis")) {
                            referenceGenesis = true;
                        } else if (arg.startsWith("--")) {
                            if (error == null) {
                                showHelp = true;
                                error = "Unknown option: " + arg;
                            }
                        } else if (!portSeen) {
                            port = parsePort(arg, "<port>");
                            portSeen = true;
                        } else {
                            peers.add(parseEndpoint(arg));
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            return new CliOptions(
                    showHelp,
                    error,
                    port,
                    List.copyOf(peers),
                    difficulty,
                    reconnectDelayMillis,
                    maxFrameBytes,
                    strictContinuity,
                    verifyOnReplace,
                    referenceGenesis
            );
        }

        NodeConfig toConfig() {
            return NodeConfig.defaultLocal()
                    .withListenPort(port)
                    .withPeers(peers)
                    .withDifficulty(difficulty)
                    .withReconnectDelayMillis(reconnectDelayMillis)
                    .withMaxFrameBytes(maxFrameBytes)
                    .withStrictContinuity(strictContinuity)
                    .withVerifyOnReplace(verifyOnReplace);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: powchain <port> [host:port ...] [options]

Arguments:
  <port>                     Port to listen on for peers (default 8080)
  host:port                  Peer to dial; re-dialed forever until it answers (repeatable)

Options:
  --help, -h                 Show this help message and exit
  --difficulty=<n>           Leading zero bytes required of a block hash, 0-32 (default 2)
  --reconnect-ms=<ms>        Delay between dial attempts (default 5000)
  --max-frame-bytes=<n>      Largest accepted message line (default 4096)
  --loose-continuity         Accept any block with valid proof-of-work, linked or not
  --no-verify-on-replace     Adopt a longer chain on length alone
  --reference-genesis        Mine the shared reference genesis block at start-up

Environment overrides:
  POWCHAIN_P2P_PORT          Default listen port
  POWCHAIN_P2P_PEERS         Comma-separated peers (host:port)
  POWCHAIN_DIFFICULTY        Default difficulty

Console:
  <text>                     Mine <text> into a new block and broadcast it
  :chain                     Print the chain
  :peers                     Print connected peers
  :metrics                   Print mining and block metrics
""");
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value.trim(), key);
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

        private static int parseDifficulty(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < 0 || parsed > ProofOfWork.MAX_DIFFICULTY) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
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

        private static String parseEndpoint(String value) {
            try {
                P2pServer.parseEndpoint(value);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid peer endpoint (expected host:port): " + value);
            }
            return value;
        }
    }
}
