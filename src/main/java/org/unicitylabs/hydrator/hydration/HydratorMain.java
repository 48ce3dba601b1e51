package org.unicitylabs.hydrator.hydration;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unicitylabs.hydrator.config.ConfigurationException;
import org.unicitylabs.hydrator.config.HydratorConfig;
import org.unicitylabs.hydrator.config.HydratorConfigLoader;
import org.unicitylabs.hydrator.projection.EventProjector;
import org.unicitylabs.hydrator.projection.InvalidEventException;
import org.unicitylabs.hydrator.protocol.EventKinds;
import org.unicitylabs.hydrator.protocol.Filter;
import org.unicitylabs.hydrator.query.FanOutQuery;
import org.unicitylabs.hydrator.relay.ConnectionException;
import org.unicitylabs.hydrator.relay.PoolStats;
import org.unicitylabs.hydrator.relay.RelayConnectionPool;
import org.unicitylabs.hydrator.relay.WebSocketRelayConnectionFactory;
import org.unicitylabs.hydrator.store.JdbcRecordStore;
import org.unicitylabs.hydrator.store.StoreDataSources;
import org.unicitylabs.hydrator.subscription.SubscriptionWorker;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point.
 *
 * <pre>
 * backfill  [--kinds 30023,1111] [--days 7] [--limit 500] [--config hydrator.yml]
 * subscribe [--kinds 30023,1111] [--config hydrator.yml]
 * stats     [--config hydrator.yml]
 * </pre>
 *
 * Exit status 1 is reserved for configuration errors and for a backfill that could not
 * reach any relay.
 */
public class HydratorMain {

    private static final Logger logger = LoggerFactory.getLogger(HydratorMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    static final List<Integer> DEFAULT_KINDS = Arrays.asList(
        EventKinds.LONG_FORM, EventKinds.COMMENT, EventKinds.HIGHLIGHT,
        EventKinds.PICTURE, EventKinds.VIDEO, EventKinds.SHORT_VIDEO
    );
    static final int DEFAULT_DAYS = 7;
    static final int DEFAULT_LIMIT = 500;

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return EXIT_FAILURE;
        }
        String command = args[0];
        try {
            Map<String, String> options = parseOptions(Arrays.copyOfRange(args, 1, args.length));
            HydratorConfig config = options.containsKey("config")
                    ? HydratorConfigLoader.load(Paths.get(options.get("config")))
                    : new HydratorConfig();

            switch (command) {
                case "backfill":
                    return backfill(config, options);
                case "subscribe":
                    return subscribe(config, options);
                case "stats":
                    return stats(config);
                default:
                    printUsage();
                    return EXIT_FAILURE;
            }
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static int backfill(HydratorConfig config, Map<String, String> options) {
        List<Integer> kinds = parseKinds(options.get("kinds"));
        int days = (int) parseNumber(options, "days", DEFAULT_DAYS);
        int limit = (int) parseNumber(options, "limit", DEFAULT_LIMIT);
        long since = System.currentTimeMillis() / 1000 - days * 86400L;
        Filter filter = Filter.builder().kinds(kinds).since(since).limit(limit).build();

        WebSocketRelayConnectionFactory factory = newFactory(config);
        RelayConnectionPool pool = new RelayConnectionPool(factory);
        FanOutQuery query = new FanOutQuery(pool);
        try (HikariDataSource dataSource = openStore(config)) {
            BackfillJob job = new BackfillJob(query, new JdbcRecordStore(dataSource));
            job.setPerRelayTimeoutMs(config.getPerRelayTimeoutMs());
            job.setOverallTimeoutMs(config.getOverallTimeoutMs());
            job.setBatchSize(config.getBatchSize());

            HydrationSummary summary = job.run(config.getRelays(), filter);
            System.out.println("Saved: " + summary.getSaved());
            System.out.println("Skipped: " + summary.getSkipped());
            System.out.println("Errors: " + summary.getErrors());
            System.out.println("Rejected: " + summary.getRejected());
            if (!summary.isSuccessful()) {
                logger.error("No relay could be reached");
                return EXIT_FAILURE;
            }
            return EXIT_OK;
        } finally {
            query.shutdown();
            pool.closeAll();
            factory.shutdown();
        }
    }

    static int subscribe(HydratorConfig config, Map<String, String> options) {
        List<Integer> kinds = parseKinds(options.get("kinds"));
        Filter filter = Filter.builder()
                .kinds(kinds)
                .since(System.currentTimeMillis() / 1000)
                .build();
        List<String> relays = config.getRelays();

        WebSocketRelayConnectionFactory factory = newFactory(config);
        RelayConnectionPool pool = new RelayConnectionPool(factory);
        HikariDataSource dataSource = openStore(config);
        EventProjector projector = new EventProjector(new JdbcRecordStore(dataSource));
        projector.setAllowedKinds(kinds);

        List<SubscriptionWorker> workers = new ArrayList<>();
        ExecutorService workerExecutor = Executors.newFixedThreadPool(relays.size());
        ScheduledExecutorService cleanupExecutor = Executors.newScheduledThreadPool(1);

        long maxAgeMs = TimeUnit.SECONDS.toMillis(config.getPoolMaxAgeSeconds());
        long interval = config.getPoolCleanupIntervalSeconds();
        cleanupExecutor.scheduleAtFixedRate(() -> {
            try {
                pool.cleanupStale(maxAgeMs);
            } catch (Exception e) {
                logger.error("Pool cleanup failed", e);
            }
        }, interval, interval, TimeUnit.SECONDS);

        for (String relay : relays) {
            SubscriptionWorker worker = new SubscriptionWorker(pool);
            worker.setReceiveTimeoutMs(config.getReceiveTimeoutMs());
            worker.setBackoffMs(config.getBackoffMs());
            workers.add(worker);
            workerExecutor.submit(() -> worker.run(relay, filter, (event, relayUrl) -> {
                try {
                    projector.project(event, relayUrl);
                } catch (InvalidEventException e) {
                    logger.warn("Skipping event from {}: {}", relayUrl, e.getMessage());
                }
            }));
        }
        workerExecutor.shutdown();
        logger.info("Subscribed to {} relay(s) for kinds {}", relays.size(), kinds);

        Thread shutdownHook = new Thread(() -> {
            logger.info("Shutting down subscription workers");
            for (SubscriptionWorker worker : workers) {
                worker.shutdown();
            }
            try {
                // Workers close their connections before run() returns
                workerExecutor.awaitTermination(config.getReceiveTimeoutMs() + 5000, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "hydrator-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            while (!workerExecutor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.debug("Pool: {}", pool.stats());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (SubscriptionWorker worker : workers) {
                worker.shutdown();
            }
        } finally {
            cleanupExecutor.shutdownNow();
            pool.closeAll();
            factory.shutdown();
            dataSource.close();
        }
        return EXIT_OK;
    }

    static int stats(HydratorConfig config) {
        WebSocketRelayConnectionFactory factory = newFactory(config);
        RelayConnectionPool pool = new RelayConnectionPool(factory);
        try {
            for (String relay : config.getRelays()) {
                try {
                    pool.getConnection(relay);
                } catch (ConnectionException e) {
                    logger.warn("Probe failed: {}", e.getMessage());
                }
            }
            PoolStats stats = pool.stats();
            System.out.println("Active connections: " + stats.getActiveConnections());
            for (PoolStats.RelayStats relay : stats.getRelays()) {
                System.out.printf("  %-40s connected=%-5s failures=%d%n",
                        relay.getUrl(), relay.isConnected(), relay.getFailedAttempts());
            }
            return stats.getActiveConnections() > 0 ? EXIT_OK : EXIT_FAILURE;
        } finally {
            pool.closeAll();
            factory.shutdown();
        }
    }

    private static WebSocketRelayConnectionFactory newFactory(HydratorConfig config) {
        return new WebSocketRelayConnectionFactory(config.getConnectTimeoutMs(), config.getPingIntervalMs(),
                Clock.systemUTC());
    }

    private static HikariDataSource openStore(HydratorConfig config) {
        HikariDataSource dataSource = StoreDataSources.create(config.getJdbcUrl(),
                config.getStoreUsername(), config.getStorePassword());
        StoreDataSources.migrate(dataSource);
        return dataSource;
    }

    static Map<String, String> parseOptions(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--") || arg.length() == 2) {
                throw new ConfigurationException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            int eq = name.indexOf('=');
            if (eq > 0) {
                options.put(name.substring(0, eq), name.substring(eq + 1));
            } else if (i + 1 < args.length) {
                options.put(name, args[++i]);
            } else {
                throw new ConfigurationException("Missing value for --" + name);
            }
        }
        return options;
    }

    static List<Integer> parseKinds(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_KINDS;
        }
        List<Integer> kinds = new ArrayList<>();
        for (String part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                kinds.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid kind: " + part.trim());
            }
        }
        if (kinds.isEmpty()) {
            throw new ConfigurationException("--kinds lists no kind");
        }
        return kinds;
    }

    private static long parseNumber(Map<String, String> options, String name, long defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            long number = Long.parseLong(value.trim());
            if (number <= 0) {
                throw new ConfigurationException("--" + name + " must be positive");
            }
            return number;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--" + name + " is not a number: " + value);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: nostr-hydrator <backfill|subscribe|stats> [options]");
        System.err.println("  backfill  [--kinds 30023,1111] [--days 7] [--limit 500] [--config hydrator.yml]");
        System.err.println("  subscribe [--kinds 30023,1111] [--config hydrator.yml]");
        System.err.println("  stats     [--config hydrator.yml]");
    }
}
