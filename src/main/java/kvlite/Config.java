package kvlite;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import kvlite.protocol.RespCodec;
import kvlite.utils.Log;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

public class Config {
    public static final String DEFAULT_FILE = "kvlite.yaml";

    public String host = "127.0.0.1";
    public int port = 31337;

    @JsonProperty("max_clients")
    public int maxClients = 64;

    // 0 lets Netty pick (2 * cores)
    @JsonProperty("worker_threads")
    public int workerThreads = 0;

    @JsonProperty("accept_backlog")
    public int acceptBacklog = 128;

    @JsonProperty("max_nesting_depth")
    public int maxNestingDepth = RespCodec.DEFAULT_MAX_NESTING_DEPTH;

    @JsonProperty("max_bulk_length")
    public int maxBulkLength = RespCodec.DEFAULT_MAX_BULK_LENGTH;

    @JsonProperty("max_line_length")
    public int maxLineLength = RespCodec.DEFAULT_MAX_LINE_LENGTH;

    @JsonProperty("stats_interval_seconds")
    public int statsIntervalSeconds = 0;

    @JsonProperty("log_level")
    public String logLevel = "INFO";

    public Config() {
        // Default constructor for Jackson
    }

    public static Config load(String filename) {
        File f = new File(filename);
        if (!f.exists()) {
            // Try looking for .yaml extension if .conf was passed
            if (filename.endsWith(".conf")) {
                File yamlFile = new File(filename.substring(0, filename.length() - ".conf".length()) + ".yaml");
                if (yamlFile.exists()) f = yamlFile;
            }
        }

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
            return new Config();
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        JsonNode root;
        try {
            root = mapper.readTree(f);
        } catch (JsonProcessingException e) {
            Log.warn("Failed to load config as YAML (" + e.getOriginalMessage() + "). Attempting legacy parse...");
            return loadLegacy(f, new Config());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + f.getPath() + ": " + e.getMessage(), e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            return new Config(); // empty document
        }
        if (!root.isObject()) {
            // "key value" lines read as one plain YAML scalar
            return loadLegacy(f, new Config());
        }

        try {
            return mapper.treeToValue(root, Config.class);
        } catch (UnrecognizedPropertyException e) {
            throw new IllegalArgumentException("Unknown config key '" + e.getPropertyName() + "' in " + f.getPath(), e);
        } catch (JsonMappingException e) {
            List<JsonMappingException.Reference> path = e.getPath();
            String key = path.isEmpty() ? "?" : path.get(path.size() - 1).getFieldName();
            throw new IllegalArgumentException("Invalid value for config key '" + key + "' in " + f.getPath()
                    + ": " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config file " + f.getPath() + ": " + e.getOriginalMessage(), e);
        }
    }

    // Legacy "key value" lines, as in a redis.conf
    static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0];
                String val = parts[1].trim();

                switch (key) {
                    case "bind": config.host = val; break;
                    case "port": config.port = parseInt(key, val); break;
                    case "maxclients": config.maxClients = parseInt(key, val); break;
                    case "worker-threads": config.workerThreads = parseInt(key, val); break;
                    case "tcp-backlog": config.acceptBacklog = parseInt(key, val); break;
                    case "max-nesting-depth": config.maxNestingDepth = parseInt(key, val); break;
                    case "proto-max-bulk-len": config.maxBulkLength = (int) parseMemory(key, val); break;
                    case "max-line-length": config.maxLineLength = (int) parseMemory(key, val); break;
                    case "stats-interval": config.statsIntervalSeconds = parseInt(key, val); break;
                    case "loglevel": config.logLevel = val; break;
                    default: Log.warn("Ignoring unknown config directive: " + key);
                }
            }
            Log.info("Loaded legacy config.");
        } catch (IOException e) {
            Log.error("Error loading legacy config: " + e.getMessage());
        }
        return config;
    }

    /**
     * Applies KVLITE_HOST, KVLITE_PORT and KVLITE_MAX_CLIENTS when present.
     */
    public Config applyEnvironment(Map<String, String> env) {
        if (env.get("KVLITE_HOST") != null) host = env.get("KVLITE_HOST");
        if (env.get("KVLITE_PORT") != null) port = parseInt("KVLITE_PORT", env.get("KVLITE_PORT"));
        if (env.get("KVLITE_MAX_CLIENTS") != null) maxClients = parseInt("KVLITE_MAX_CLIENTS", env.get("KVLITE_MAX_CLIENTS"));
        return this;
    }

    public Config validate() {
        if (host == null || host.isEmpty()) throw new IllegalArgumentException("host must not be empty");
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (maxClients < 1) throw new IllegalArgumentException("max_clients must be >= 1");
        if (workerThreads < 0) throw new IllegalArgumentException("worker_threads must be >= 0");
        if (acceptBacklog < 1) throw new IllegalArgumentException("accept_backlog must be >= 1");
        if (maxNestingDepth < 1) throw new IllegalArgumentException("max_nesting_depth must be >= 1");
        if (maxBulkLength < 0) throw new IllegalArgumentException("max_bulk_length must be >= 0");
        if (maxLineLength < 1) throw new IllegalArgumentException("max_line_length must be >= 1");
        if (statsIntervalSeconds < 0) throw new IllegalArgumentException("stats_interval_seconds must be >= 0");
        Log.toLevel(logLevel);
        return this;
    }

    public RespCodec newCodec() {
        return new RespCodec(maxNestingDepth, maxBulkLength, maxLineLength);
    }

    private static int parseInt(String key, String val) {
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + val, e);
        }
    }

    private static long parseMemory(String key, String val) {
        String v = val.toUpperCase();
        long factor = 1;
        if (v.endsWith("GB")) { factor = 1024 * 1024 * 1024L; v = v.substring(0, v.length() - 2); }
        else if (v.endsWith("MB")) { factor = 1024 * 1024L; v = v.substring(0, v.length() - 2); }
        else if (v.endsWith("KB")) { factor = 1024L; v = v.substring(0, v.length() - 2); }
        long bytes;
        try {
            bytes = Long.parseLong(v.trim()) * factor;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + val, e);
        }
        if (bytes > Integer.MAX_VALUE) throw new IllegalArgumentException("Value too large for " + key + ": " + val);
        return bytes;
    }
}
