package org.unicitylabs.hydrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link HydratorConfig} from a YAML document.
 *
 * <pre>
 * relays:
 *   local: ws://localhost:7777
 *   defaults: [wss://nos.lol, wss://relay.damus.io]
 * timeouts:
 *   connect-ms: 30000
 *   per-relay-ms: 15000
 *   overall-ms: 30000
 *   receive-ms: 1000
 * worker:
 *   backoff-ms: 5000
 * pool:
 *   max-age-seconds: 300
 *   cleanup-interval-seconds: 60
 *   ping-interval-ms: 25000
 * store:
 *   jdbc-url: jdbc:hsqldb:file:data/hydrator;hsqldb.tx=mvcc
 *   username: SA
 *   password: ""
 * hydration:
 *   batch-size: 50
 * </pre>
 *
 * Unknown keys are logged and ignored.
 */
public final class HydratorConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(HydratorConfigLoader.class);

    /**
     * Load configuration from a file.
     *
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public static HydratorConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            throw new ConfigurationException("Config file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            HydratorConfig config = load(reader, path.toString());
            logger.info("Loaded configuration from {}", path);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file " + path, e);
        }
    }

    /**
     * Load configuration from YAML text.
     */
    public static HydratorConfig parse(String yaml) {
        return load(new StringReader(yaml), "<string>");
    }

    private static HydratorConfig load(Reader reader, String source) {
        Object document;
        try {
            document = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new ConfigurationException("Failed to parse YAML config at " + source, e);
        }

        HydratorConfig config = new HydratorConfig();
        if (document == null) {
            return config;
        }
        Map<String, Object> flattened = new LinkedHashMap<>();
        flatten(asMap(document, "root"), "", flattened);

        for (Map.Entry<String, Object> entry : flattened.entrySet()) {
            apply(config, entry.getKey(), entry.getValue());
        }
        return config;
    }

    private static void apply(HydratorConfig config, String key, Object value) {
        switch (key) {
            case "relays.local":
                config.setLocalRelay(string(key, value));
                break;
            case "relays.defaults":
                config.setDefaultRelays(stringList(key, value));
                break;
            case "timeouts.connect-ms":
                config.setConnectTimeoutMs(number(key, value));
                break;
            case "timeouts.per-relay-ms":
                config.setPerRelayTimeoutMs(number(key, value));
                break;
            case "timeouts.overall-ms":
                config.setOverallTimeoutMs(number(key, value));
                break;
            case "timeouts.receive-ms":
                config.setReceiveTimeoutMs(number(key, value));
                break;
            case "worker.backoff-ms":
                config.setBackoffMs(number(key, value));
                break;
            case "pool.max-age-seconds":
                config.setPoolMaxAgeSeconds(number(key, value));
                break;
            case "pool.cleanup-interval-seconds":
                config.setPoolCleanupIntervalSeconds(number(key, value));
                break;
            case "pool.ping-interval-ms":
                config.setPingIntervalMs(number(key, value));
                break;
            case "store.jdbc-url":
                config.setJdbcUrl(string(key, value));
                break;
            case "store.username":
                config.setStoreUsername(string(key, value));
                break;
            case "store.password":
                config.setStorePassword(value == null ? "" : value.toString());
                break;
            case "hydration.batch-size":
                config.setBatchSize((int) number(key, value));
                break;
            default:
                logger.warn("Ignoring unknown config key: {}", key);
                break;
        }
    }

    private static Map<String, Object> asMap(Object node, String context) {
        if (!(node instanceof Map)) {
            throw new ConfigurationException(context + " section must be a mapping");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new ConfigurationException(context + " section contains non-string key");
            }
            map.put((String) entry.getKey(), entry.getValue());
        }
        return map;
    }

    private static void flatten(Map<String, Object> source, String prefix, Map<String, Object> target) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            String key = entry.getKey();
            if (key.isBlank()) {
                throw new ConfigurationException("YAML contains blank keys");
            }
            String composite = prefix.isEmpty() ? key : prefix + '.' + key;
            Object value = entry.getValue();
            if (value instanceof Map) {
                flatten(asMap(value, composite), composite, target);
            } else {
                target.put(composite, value);
            }
        }
    }

    private static String string(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Iterable) {
            throw new ConfigurationException(key + " must be a scalar");
        }
        return value.toString();
    }

    private static long number(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value == null) {
            throw new ConfigurationException(key + " must be a number");
        }
        try {
            return Long.parseLong(string(key, value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number, got " + value);
        }
    }

    private static List<String> stringList(String key, Object value) {
        List<String> out = new ArrayList<>();
        if (value == null) {
            return out;
        }
        if (value instanceof String) {
            // Comma-separated form: "wss://a, wss://b"
            for (String part : ((String) value).split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
            return out;
        }
        if (!(value instanceof Iterable)) {
            throw new ConfigurationException(key + " must be a list");
        }
        for (Object item : (Iterable<?>) value) {
            if (item != null) {
                out.add(item.toString());
            }
        }
        return out;
    }

    private HydratorConfigLoader() {
        // Utility class
    }
}
