package kvlite;

import kvlite.server.KvServer;
import kvlite.utils.Log;

import java.util.Map;

/**
 * Command line entry point.
 * <pre>
 *   KvLite [config-file] [--host addr] [--port n] [--max-clients n]
 * </pre>
 * Settings are layered: config file (default kvlite.yaml), then KVLITE_* environment variables,
 * then command line flags.
 */
public class KvLite {

    public static void printBanner() {
        Log.info("\n" +
                "  _  __       _     _ _       \n" +
                " | |/ /_   __| |   (_) |_ ___ \n" +
                " | ' /\\ \\ / /| |   | | __/ _ \\\n" +
                " | . \\ \\ V / | |___| | ||  __/\n" +
                " |_|\\_\\ \\_/  |_____|_|\\__\\___|\n" +
                "                              \n" +
                " :: KvLite ::       (v0.1.0) \n" +
                " :: Engine ::       Java / Netty \n");
    }

    public static void main(String[] args) throws Exception {
        Config config;
        try {
            config = configure(args, System.getenv());
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: KvLite [config-file] [--host addr] [--port n] [--max-clients n]");
            System.exit(1);
            return;
        }

        Log.setLevel(config.logLevel);
        printBanner();

        KvServer server = new KvServer(config);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            server.stop();
        }, "shutdown"));

        server.awaitTermination();
    }

    static Config configure(String[] args, Map<String, String> env) {
        String configFile = Config.DEFAULT_FILE;
        String host = null;
        String port = null;
        String maxClients = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--host": host = requireValue(args, ++i, arg); break;
                case "--port": port = requireValue(args, ++i, arg); break;
                case "--max-clients": maxClients = requireValue(args, ++i, arg); break;
                default:
                    if (arg.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + arg);
                    configFile = arg;
            }
        }

        Config config = Config.load(configFile).applyEnvironment(env);
        if (host != null) config.host = host;
        if (port != null) config.port = parseInt("--port", port);
        if (maxClients != null) config.maxClients = parseInt("--max-clients", maxClients);
        return config.validate();
    }

    private static String requireValue(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + option + ": " + value, e);
        }
    }
}
