package com.brandsentinel.app;

import ch.qos.logback.classic.Level;
import com.brandsentinel.core.config.ConfigLoader;
import com.brandsentinel.core.config.Durations;
import com.brandsentinel.core.config.SentinelConfig;
import com.brandsentinel.core.engine.Engine;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the Brand Sentinel monitor.
 *
 * <h3>Commands</h3>
 * <pre>
 *   brand-sentinel run [--config=&lt;path&gt;] [--dry-run] [--storage=&lt;type&gt;] [--duration=&lt;dur&gt;]
 *   brand-sentinel config init [--config=&lt;path&gt;]
 *   brand-sentinel version
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * {@code --config} wins over {@code SENTINEL_CONFIG_PATH}, which wins over
 * {@code brand-sentinel.yml} on the classpath. Process settings come from
 * {@link AppConfig}.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * SIGINT/SIGTERM fire the shutdown signal through a JVM shutdown hook, which
 * then waits for the engine to drain and close storage.
 * </p>
 *
 * @since 1.0.0
 */
public final class BrandSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(BrandSentinelApp.class);

    static final String VERSION = "1.0.0";
    static final String DEFAULT_CONFIG_FILE = "brand-sentinel.yml";
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private static final Set<String> RUN_OPTIONS = Set.of("config", "dry-run", "storage", "duration");
    private static final Set<String> INIT_OPTIONS = Set.of("config");

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private BrandSentinelApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        int code = execute(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int execute(String[] args, PrintStream out, PrintStream err) {
        CliArguments cli;
        try {
            cli = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        String command = cli.command(0).orElse("");
        switch (command) {
            case "version":
                out.println("brand-sentinel " + VERSION);
                return EXIT_OK;
            case "config":
                if (!"init".equals(cli.command(1).orElse("")) || !allowed(cli, INIT_OPTIONS, err)) {
                    printUsage(err);
                    return EXIT_USAGE;
                }
                return initConfig(cli, out, err);
            case "run":
                if (!allowed(cli, RUN_OPTIONS, err)) {
                    printUsage(err);
                    return EXIT_USAGE;
                }
                try {
                    return run(cli, AppConfig.fromEnvironment(), out, err);
                } catch (IllegalArgumentException | IllegalStateException e) {
                    return fail(err, e);
                }
            default:
                printUsage(err);
                return EXIT_USAGE;
        }
    }

    // ---------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------

    static int initConfig(CliArguments cli, PrintStream out, PrintStream err) {
        Path target = Path.of(cli.option("config").orElse(DEFAULT_CONFIG_FILE));
        try {
            ConfigLoader.writeSample(target);
        } catch (IllegalStateException e) {
            return fail(err, e);
        }
        out.println("Configuration written to " + target);
        return EXIT_OK;
    }

    /**
     * Load configuration, start the status server and run the engine until
     * the duration elapses or the process is asked to stop.
     */
    static int run(CliArguments cli, AppConfig appConfig, PrintStream out, PrintStream err) {
        LOG.info("Starting Brand Sentinel {} with {}", VERSION, appConfig);
        SentinelConfig config = loadConfig(cli, appConfig);
        applyOverrides(cli, config);
        applyLogLevel(config.getLogging().getLevel());

        Engine engine = Engine.fromConfig(config);
        ShutdownSignal signal = cli.option("duration")
                .map(Durations::parse)
                .map(ShutdownSignal::withDeadline)
                .orElseGet(ShutdownSignal::create);
        if (config.isDryRun()) {
            LOG.warn("Running in DRY-RUN mode: no enforcement action will be taken");
        }

        StatusServer statusServer = new StatusServer(engine.getStatistics());
        if (appConfig.isStatusServerEnabled()) {
            statusServer.start(appConfig.getStatusPort());
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            LOG.info("Shutdown requested");
            signal.cancel();
            try {
                if (!finished.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Engine did not stop within {}s", SHUTDOWN_GRACE.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            engine.run(signal);
        } finally {
            finished.countDown();
            statusServer.stop();
            removeHook(hook);
        }
        out.println(engine.getStatistics().snapshot());
        return EXIT_OK;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static SentinelConfig loadConfig(CliArguments cli, AppConfig appConfig) {
        if (cli.option("config").isPresent()) {
            return ConfigLoader.fromFile(Path.of(cli.option("config").get()));
        }
        if (appConfig.hasConfigPath()) {
            return ConfigLoader.fromFile(Path.of(appConfig.getConfigPath()));
        }
        return ConfigLoader.load();
    }

    private static void applyOverrides(CliArguments cli, SentinelConfig config) {
        boolean changed = false;
        if (cli.flag("dry-run")) {
            config.setDryRun(true);
            changed = true;
        }
        if (cli.option("storage").isPresent()) {
            config.getStorage().setType(cli.option("storage").get());
            changed = true;
        }
        if (changed) {
            config.validate();
        }
    }

    static void applyLogLevel(String level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(level.toUpperCase(Locale.ROOT), Level.INFO));
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM already shutting down; hook stays registered");
        }
    }

    private static boolean allowed(CliArguments cli, Set<String> options, PrintStream err) {
        for (String name : cli.optionNames()) {
            if (!options.contains(name)) {
                err.println("Error: unknown option --" + name);
                return false;
            }
        }
        return true;
    }

    private static int fail(PrintStream err, RuntimeException e) {
        LOG.error("{}", e.getMessage());
        err.println("Error: " + e.getMessage());
        return EXIT_FAILURE;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage:");
        err.println("  brand-sentinel run [--config=<path>] [--dry-run] [--storage=<type>] [--duration=<dur>]");
        err.println("  brand-sentinel config init [--config=<path>]");
        err.println("  brand-sentinel version");
    }
}
