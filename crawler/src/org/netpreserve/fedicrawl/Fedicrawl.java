package org.netpreserve.fedicrawl;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.checkpoint.Checkpoint;
import org.netpreserve.fedicrawl.checkpoint.CheckpointStore;
import org.netpreserve.fedicrawl.checkpoint.ImportResult;
import org.netpreserve.fedicrawl.config.ConfigurationException;
import org.netpreserve.fedicrawl.config.CrawlerConfig;
import org.netpreserve.fedicrawl.frontier.CrawlResult;
import org.netpreserve.fedicrawl.frontier.FrontierCrawler;
import org.netpreserve.fedicrawl.proxy.*;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class Fedicrawl {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Fedicrawl.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        Path configFile = null;
        boolean dumpConfig = false;
        boolean resume = false;
        String seedQuery = null;
        var positional = new ArrayList<String>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> configFile = Path.of(args[++i]);
                case "--dump-config" -> dumpConfig = true;
                case "--log-file" -> startLogFile(args[++i]);
                case "--resume" -> resume = true;
                case "--seed-query" -> seedQuery = args[++i];
                case "--help", "-h" -> {
                    printUsage();
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    positional.add(args[i]);
                }
            }
        }

        String command = positional.isEmpty() ? "crawl" : positional.get(0);
        List<String> commandArgs;
        if (List.of("crawl", "proxies", "checkpoints").contains(command)) {
            commandArgs = positional.subList(1, positional.size());
        } else {
            command = "crawl";
            commandArgs = positional;
        }

        CrawlerConfig config;
        try {
            config = loadConfig(configFile, command.equals("crawl") ? commandArgs : List.of());
        } catch (ConfigurationException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(2);
            return;
        }
        if (dumpConfig) {
            System.out.println(YAML.writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }

        // let the JDK client answer Basic challenges from proxies when tunnelling HTTPS
        System.setProperty("jdk.http.auth.tunneling.disabledSchemes", "");

        try {
            switch (command) {
                case "crawl" -> crawl(config, resume, seedQuery);
                case "proxies" -> proxies(config, commandArgs);
                case "checkpoints" -> checkpoints(config, commandArgs);
                default -> throw new IllegalStateException(command);
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
        } catch (StoreUnavailableException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(3);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: fedicrawl [options] [crawl] [SEED...]");
        System.out.println("       fedicrawl [options] proxies add|remove URI... | list [STATUS] | stats | health | reset");
        System.out.println("       fedicrawl [options] checkpoints list [TYPE] | delete ID | prune [TYPE]");
        System.out.println("       fedicrawl [options] checkpoints export|import [TYPE] FILE");
        System.out.println("Options:");
        System.out.println("  -c, --config FILE        YAML config merged over the defaults");
        System.out.println("      --dump-config        Print the effective config and exit");
        System.out.println("  -h, --help");
        System.out.println("      --log-file FILE      Also write the log to FILE");
        System.out.println("      --resume             Continue from the latest unfinished checkpoint");
        System.out.println("      --seed-query QUERY   Seed from an actor search");
    }

    /**
     * Reads the bundled defaults, merges the user's file over them and binds the result.
     *
     * @param seeds seeds given on the command line, replacing configured seeds when not empty
     */
    static CrawlerConfig loadConfig(@Nullable Path configFile, List<String> seeds) throws IOException {
        JsonNode configTree;
        try (InputStream stream = Objects.requireNonNull(Fedicrawl.class.getResourceAsStream("config/defaults.yaml"),
                "missing config/defaults.yaml")) {
            configTree = YAML.readTree(stream);
        }
        if (configFile != null) {
            configTree = deepMerge(configTree, YAML.readTree(configFile.toFile()));
        }
        if (!seeds.isEmpty()) {
            ArrayNode seedArray = ((ObjectNode) configTree).putArray("seeds");
            seeds.forEach(seedArray::add);
        }
        try {
            return YAML.treeToValue(configTree, CrawlerConfig.class);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof ConfigurationException ce) throw ce;
            throw new ConfigurationException(e.getOriginalMessage(), e);
        }
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars and arrays are replaced wholesale
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    private static void crawl(CrawlerConfig config, boolean resume, @Nullable String seedQuery) throws Exception {
        var done = new CountDownLatch(1);
        try (Crawl crawl = new Crawl(config)) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                crawl.cancel();
                try {
                    if (!done.await(60, TimeUnit.SECONDS)) {
                        System.err.println("Timed out waiting for the crawl to checkpoint");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-hook"));

            CrawlResult result = crawl.run(resume, seedQuery);
            System.out.printf("Crawl %s: %d nodes, %d edges, %d discovered, %d duplicates, %d errors in %s%n",
                    result.status().label(), result.nodesProcessed(), result.edgesEmitted(),
                    result.nodesDiscovered(), result.duplicatesSkipped(), result.errors(), result.elapsed());
            if (result.checkpointId() != null) {
                System.out.println("Final checkpoint: " + result.checkpointId());
            }
        } finally {
            done.countDown();
        }
    }

    private static void proxies(CrawlerConfig config, List<String> args) throws InterruptedException {
        if (args.isEmpty()) throw new IllegalArgumentException("proxies needs a subcommand");
        List<String> rest = args.subList(1, args.size());
        try (Database db = Database.open(config.store().jdbcUrl())) {
            var probe = new HttpProxyProbe(new ProxyHttpClients(config.proxies().probeTimeout()),
                    URI.create(config.proxies().probeUrl()), config.proxies().probeTimeout(),
                    config.api().userAgent());
            var pool = new ProxyPool(db.proxies(), probe, config.proxies());
            switch (args.get(0)) {
                case "add" -> {
                    RegistrationResult result = pool.register(rest);
                    System.out.println("Added " + result.added().size() + ", already present " +
                                       result.existing().size());
                    result.rejected().forEach((entry, reason) ->
                            System.out.println("Rejected " + entry + ": " + reason));
                }
                case "remove" -> System.out.println("Removed " + pool.remove(rest));
                case "list" -> {
                    List<ProxyRecord> proxies = rest.isEmpty() ? pool.list() :
                            pool.list(ProxyStatus.valueOf(rest.get(0).toUpperCase(Locale.ROOT)));
                    for (ProxyRecord proxy : proxies) {
                        System.out.printf("%-40s %-12s requests=%d success=%.1f%% avg=%dms%s%n",
                                proxy.uri().masked(), proxy.status(), proxy.requests(),
                                proxy.successRate() * 100, proxy.averageResponseTime().toMillis(),
                                proxy.lastFailureReason() == null ? "" : " last failure: " + proxy.lastFailureReason());
                    }
                }
                case "stats" -> {
                    ProxyStats stats = pool.stats();
                    System.out.printf("total=%d healthy=%d unhealthy=%d rateLimited=%d requests=%d success=%.1f%%%n",
                            stats.total(), stats.healthy(), stats.unhealthy(), stats.rateLimited(),
                            stats.requests(), stats.successRate() * 100);
                }
                case "health" -> System.out.println(pool.healthCheck() + " of " + pool.list().size() + " passed");
                case "reset" -> pool.resetStats();
                default -> throw new IllegalArgumentException("Unknown proxies subcommand: " + args.get(0));
            }
        }
    }

    private static void checkpoints(CrawlerConfig config, List<String> args) throws IOException {
        if (args.isEmpty()) throw new IllegalArgumentException("checkpoints needs a subcommand");
        List<String> rest = args.subList(1, args.size());
        try (Database db = Database.open(config.store().jdbcUrl())) {
            var store = new CheckpointStore(db.checkpoints(), config.checkpoint());
            switch (args.get(0)) {
                case "list" -> {
                    for (Checkpoint checkpoint : store.list(rest.isEmpty() ? null : rest.get(0))) {
                        System.out.printf("%s %-14s #%-6d %s %s %s%n", checkpoint.id(), checkpoint.scraperType(),
                                checkpoint.sequence(), checkpoint.timestamp(), checkpoint.status(),
                                checkpoint.metadata().toJson());
                    }
                }
                case "delete" -> {
                    for (String id : rest) {
                        System.out.println(store.delete(id) ? "Deleted " + id : "No such checkpoint " + id);
                    }
                }
                case "prune" -> System.out.println("Pruned " + store.prune(scraperType(rest, 1)));
                case "export" -> {
                    Path file = Path.of(rest.get(rest.size() - 1));
                    System.out.println("Exported " + store.exportTo(scraperType(rest, 2), file));
                }
                case "import" -> {
                    Path file = Path.of(rest.get(rest.size() - 1));
                    ImportResult result = store.importFrom(scraperType(rest, 2), file);
                    System.out.println("Imported " + result.imported() + " (" + result.renumbered() + " renumbered), skipped "
                                       + result.skipped());
                }
                default -> throw new IllegalArgumentException("Unknown checkpoints subcommand: " + args.get(0));
            }
        }
    }

    private static String scraperType(List<String> args, int arity) {
        if (args.size() < arity - 1) throw new IllegalArgumentException("Missing argument");
        return args.size() >= arity ? args.get(0) : FrontierCrawler.SCRAPER_TYPE;
    }

    private static void startLogFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{20} %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("log-file");
        fileAppender.setFile(file);
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
        log.info("Logging to {}", file);
    }
}
