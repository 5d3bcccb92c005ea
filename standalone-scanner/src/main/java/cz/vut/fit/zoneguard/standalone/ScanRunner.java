package cz.vut.fit.zoneguard.standalone;

import cz.vut.fit.zoneguard.ScanSettings;
import cz.vut.fit.zoneguard.ScannerConfig;
import cz.vut.fit.zoneguard.errors.ConfigurationException;
import cz.vut.fit.zoneguard.models.ScanStatus;
import cz.vut.fit.zoneguard.models.results.BatchResult;
import cz.vut.fit.zoneguard.serialization.JsonReportSerializer;
import cz.vut.fit.zoneguard.standalone.collectors.dns.DNSCollector;
import cz.vut.fit.zoneguard.standalone.collectors.whois.WhoisCollector;
import cz.vut.fit.zoneguard.standalone.logging.LoggingConfigurator;
import cz.vut.fit.zoneguard.standalone.report.MarkdownReportWriter;
import cz.vut.fit.zoneguard.standalone.rules.RuleEngine;
import cz.vut.fit.zoneguard.standalone.scanner.DomainScanner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The command-line entry point of the scanner.
 * <p>
 * Parses the arguments, loads the configuration, scans the domains and writes the JSON and Markdown reports.
 * Without a report path, the JSON report is printed to the standard output.
 */
public class ScanRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(ScanRunner.class);

    /**
     * At least one domain was scanned successfully or partially.
     */
    public static final int EXIT_OK = 0;
    /**
     * Every scanned domain failed.
     */
    public static final int EXIT_ALL_FAILED = 1;
    /**
     * Invalid arguments, settings or domain names.
     */
    public static final int EXIT_CONFIGURATION_ERROR = 2;
    /**
     * A report could not be written.
     */
    public static final int EXIT_REPORT_ERROR = 3;
    /**
     * The scan was cancelled by a shutdown signal.
     */
    public static final int EXIT_CANCELLED = 130;

    /**
     * Creates the scanner for the loaded configuration.
     */
    @FunctionalInterface
    interface ScannerFactory {
        DomainScanner create(Properties properties) throws ConfigurationException;
    }

    public static void main(String[] args) {
        System.exit(run(args, ScanRunner::createScanner, System.out));
    }

    /**
     * Runs the scanner.
     *
     * @param args           The command line arguments.
     * @param scannerFactory The factory of the domain scanner.
     * @param out            The stream for the help text and the JSON report without a target file.
     * @return The process exit code.
     */
    static int run(String[] args, ScannerFactory scannerFactory, PrintStream out) {
        final var options = makeOptions();
        final var cmd = parseCommandLine(args, options, out);
        if (cmd == null) {
            return isHelpRequested(args) ? EXIT_OK : EXIT_CONFIGURATION_ERROR;
        }

        if (cmd.hasOption("verbose")) {
            LoggingConfigurator.enableVerboseLogging();
        }

        final Properties properties;
        final ScanSettings settings;
        try {
            properties = initProperties(cmd);
            settings = ScanSettings.fromProperties(properties);
        } catch (ConfigurationException e) {
            Logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }

        final var domains = Arrays.stream(cmd.getOptionValue("domains").split(","))
                .map(String::trim)
                .filter(domain -> !domain.isEmpty())
                .toList();

        final DomainScanner scanner;
        try {
            scanner = scannerFactory.create(properties);
        } catch (ConfigurationException e) {
            Logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }

        final BatchResult batch;
        final var signalled = new AtomicBoolean();
        try {
            final var handle = scanner.start(domains, settings);

            // A latch used to let the shutdown hook wait until the reports are written
            final var finished = new CountDownLatch(1);
            final var hook = new Thread(() -> {
                signalled.set(true);
                handle.cancel();
                try {
                    finished.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "system-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);

            try {
                batch = handle.await();
                final var exitCode = writeReports(cmd, batch, settings, out);
                if (exitCode != EXIT_OK)
                    return exitCode;
            } finally {
                finished.countDown();
                removeShutdownHook(hook);
            }
        } catch (ConfigurationException e) {
            Logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        } finally {
            try {
                scanner.close();
            } catch (IOException e) {
                Logger.warn("Failed to close the scanner", e);
            }
        }

        final var summary = batch.summary();
        Logger.info("Findings: {} critical, {} warning, {} info; domains: {} ok, {} partial, {} failed",
                summary.criticalCount(), summary.warningCount(), summary.infoCount(),
                summary.domainsOk(), summary.domainsPartial(), summary.domainsFailed());

        return signalled.get() ? EXIT_CANCELLED : exitCodeFor(batch);
    }

    /**
     * @return {@link #EXIT_ALL_FAILED} if every scanned domain failed, {@link #EXIT_OK} otherwise
     */
    static int exitCodeFor(@NotNull BatchResult batch) {
        if (batch.results().isEmpty())
            return batch.cancelled() ? EXIT_CANCELLED : EXIT_ALL_FAILED;

        final var allFailed = batch.results().values().stream()
                .allMatch(result -> result.status() == ScanStatus.FAILED);
        return allFailed ? EXIT_ALL_FAILED : EXIT_OK;
    }

    static DomainScanner createScanner(Properties properties) throws ConfigurationException {
        return new DomainScanner(DNSCollector.fromProperties(properties), WhoisCollector.fromProperties(properties));
    }

    private static int writeReports(CommandLine cmd, BatchResult batch, ScanSettings settings, PrintStream out) {
        final var serializer = new JsonReportSerializer();
        final var jsonPath = cmd.getOptionValue("json-out");
        final var reportPath = cmd.getOptionValue("report-out");

        try {
            if (jsonPath != null) {
                serializer.write(batch, Path.of(jsonPath));
                Logger.info("JSON report written to {}", jsonPath);
            }

            if (reportPath != null) {
                final var remediations = RuleEngine.withDefaultRules(settings).remediations();
                new MarkdownReportWriter(remediations).write(batch, Path.of(reportPath));
                Logger.info("Markdown report written to {}", reportPath);
            }
        } catch (IOException e) {
            Logger.error("Failed to write a report: {}", e.getMessage());
            return EXIT_REPORT_ERROR;
        }

        if (jsonPath == null && reportPath == null) {
            out.println(new String(serializer.serialize(batch), StandardCharsets.UTF_8));
            out.flush();
        }

        return EXIT_OK;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // The hook is running
            Logger.debug("Shutdown in progress, keeping the shutdown hook");
        }
    }

    /**
     * Parses the command line arguments.
     *
     * @return The parsed CommandLine instance, or null if parsing fails or help is requested.
     */
    @Nullable
    private static CommandLine parseCommandLine(String[] args, Options options, PrintStream out) {
        final var parser = new DefaultParser();

        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            if (isHelpRequested(args)) {
                printHelp(options, out);
                return null;
            }

            Logger.error("{}", e.getMessage());
            printHelp(options, out);
            return null;
        }

        if (cmd.hasOption("help")) {
            printHelp(options, out);
            return null;
        }
        return cmd;
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> arg.equals("-h") || arg.equals("--help"));
    }

    /**
     * Creates the command line options.
     */
    @NotNull
    private static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");
        options.addOption("v", "verbose", false, "Log debug messages");

        options.addOption(Option.builder("d")
                .longOpt("domains")
                .desc("The domains to scan, separated by commas (required)")
                .argName("a,b,c")
                .hasArg()
                .required()
                .build());
        options.addOption(Option.builder("t")
                .longOpt("threads")
                .desc("The number of domains scanned in parallel (default " + ScannerConfig.THREADS_DEFAULT + ")")
                .argName("n")
                .hasArg()
                .build());
        options.addOption(Option.builder()
                .longOpt("timeout")
                .desc("The timeout of a single collector call in milliseconds (default "
                        + ScannerConfig.TIMEOUT_PER_DOMAIN_MS_DEFAULT + ")")
                .argName("ms")
                .hasArg()
                .build());
        options.addOption(Option.builder("j")
                .longOpt("json-out")
                .desc("Path of the JSON report")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("r")
                .longOpt("report-out")
                .desc("Path of the Markdown report")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("p")
                .longOpt("properties")
                .desc("Path to a configuration file")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("o")
                .longOpt("option")
                .desc("A properties key/value to add to the configuration")
                .argName("key=value")
                .hasArg()
                .build());

        return options;
    }

    /**
     * Initializes the properties from the file, the --option values and the --threads and --timeout options,
     * in this order of increasing precedence.
     *
     * @param cmd The parsed command line arguments.
     * @return The initialized Properties instance.
     * @throws ConfigurationException if the properties file cannot be read.
     */
    private static Properties initProperties(CommandLine cmd) throws ConfigurationException {
        final Properties props = new Properties();

        if (cmd.hasOption("properties")) {
            // Open the file and load the properties
            final var path = cmd.getOptionValue("properties");
            try (var inStream = new FileInputStream(path)) {
                props.load(inStream);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load properties from " + path + ": " + e.getMessage(), e);
            }
        }

        // Add the --option properties
        final var cmdLineProperties = cmd.getOptionValues("option");
        if (cmdLineProperties != null) {
            for (var option : cmdLineProperties) {
                if (option.contains("=")) {
                    var parts = option.split("=", 2);
                    props.put(parts[0].trim(), parts[1]);
                } else {
                    Logger.warn("Ignoring invalid command-line option: {}", option);
                }
            }
        }

        if (cmd.hasOption("threads")) {
            props.put(ScannerConfig.THREADS_CONFIG, cmd.getOptionValue("threads"));
        }
        if (cmd.hasOption("timeout")) {
            props.put(ScannerConfig.TIMEOUT_PER_DOMAIN_MS_CONFIG, cmd.getOptionValue("timeout"));
        }

        return props;
    }

    private static void printHelp(Options options, PrintStream out) {
        final var formatter = new HelpFormatter();
        final var writer = new PrintWriter(out);
        formatter.printHelp(writer, 119, "zoneguard -d <domain[,domain...]> [options]", "", options,
                formatter.getLeftPadding(), formatter.getDescPadding(), "");
        writer.flush();
    }
}
