package com.heimdall.app;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import com.heimdall.bootstrap.HeimdallOrchestrator;
import com.heimdall.bootstrap.ShutdownReport;
import com.heimdall.bootstrap.StartupReport;
import com.heimdall.config.ConfigDiff;
import com.heimdall.config.ConfigReader;
import com.heimdall.config.ConfigSource;
import com.heimdall.config.EnvironmentConfigSource;
import com.heimdall.config.FileConfigSource;
import com.heimdall.config.HeimdallConfig;
import com.heimdall.config.OverrideConfigSource;
import com.heimdall.events.Topics;
import com.heimdall.internal.plugins.InternalPlugins;
import com.heimdall.plugin.ServiceLoaderPluginSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Heimdall entry point. Headless runs start the runtime, print the startup report and shut down again;
 * interactive runs keep the runtime up until the JVM is asked to exit.
 * <p>
 * Exit codes: 0 clean shutdown, 1 unrecoverable startup failure (e.g. a required configuration key is
 * missing), 2 invalid command line.
 */
@Command(
        name = "heimdall",
        version = "heimdall 0.1.0",
        mixinStandardHelpOptions = true,
        description = "Start the Heimdall runtime: configuration, event bus, task executor and plugins."
)
public class HeimdallApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HeimdallApplication.class);

    static final String DEFAULT_CONFIG = ".heimdall/config.json";

    @Option(names = "--config", paramLabel = "<path>",
            description = "Configuration file (JSON). Default: ~/" + DEFAULT_CONFIG + " when it exists.")
    private Path configFile;

    @Option(names = "--headless", description = "Do not register UI components; print the startup report and exit.")
    private boolean headless;

    @Option(names = "--log-level", paramLabel = "<level>",
            description = "DEBUG, INFO, WARNING, ERROR or CRITICAL. Pins the level against configuration changes.")
    private LogLevel logLevel;

    @Option(names = "--set", paramLabel = "<key=value>",
            description = "Configuration override, e.g. --set executor.pool_size=8. Repeatable.")
    private List<String> overrides = new ArrayList<>();

    @Option(names = "--json", description = "Print reports as JSON.")
    private boolean json;

    private final PrintStream out;
    private final Supplier<Map<String, String>> environment;
    private final Path userHome;

    public HeimdallApplication() {
        this(System.out, System::getenv, Path.of(System.getProperty("user.home")));
    }

    HeimdallApplication(PrintStream out, Supplier<Map<String, String>> environment, Path userHome) {
        this.out = out;
        this.environment = environment;
        this.userHome = userHome;
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine(new HeimdallApplication()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine(HeimdallApplication application) {
        return new CommandLine(application)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO));
    }

    @Override
    public Integer call() {
        List<ConfigSource> sources;
        try {
            sources = configSources();
        } catch (IllegalArgumentException e) {
            out.println("Invalid --set: " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }
        if (logLevel != null) {
            LoggingSetup.applyLevel(logLevel);
        }

        HeimdallOrchestrator orchestrator = HeimdallOrchestrator.builder()
                .headless(headless)
                .pluginSource(InternalPlugins.createSource())
                .pluginSource(new ServiceLoaderPluginSource())
                .build();
        StartupReport report = orchestrator.start(sources);
        out.print(json ? report.toJson() + System.lineSeparator() : report.toText());
        if (report.isFatal()) {
            return CommandLine.ExitCode.SOFTWARE;
        }

        Optional<RollingFileAppender<ILoggingEvent>> fileAppender = LoggingSetup.attachFileAppender(
                Path.of(orchestrator.config().getString(HeimdallConfig.LOGGING_DIRECTORY)));
        if (logLevel == null) {
            applyConfiguredLevel(orchestrator.config());
            orchestrator.bus().subscribe(Topics.CONFIG_CHANGED, envelope -> {
                if (envelope.payload() instanceof ConfigDiff diff && diff.touches(HeimdallConfig.APP_LOGGING_LEVEL)) {
                    applyConfiguredLevel(orchestrator.config());
                }
            });
        }

        if (headless) {
            ShutdownReport shutdown = orchestrator.shutdown();
            out.print(json ? shutdown.toJson() + System.lineSeparator() : shutdown.toText());
            fileAppender.ifPresent(LoggingSetup::detach);
            return CommandLine.ExitCode.OK;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            orchestrator.shutdown();
        }, "heimdall-shutdown"));
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down");
            orchestrator.shutdown();
        }
        return CommandLine.ExitCode.OK;
    }

    /**
     * Defaults, then the configuration file, then {@code APP_*} environment variables, then {@code --set}
     * overrides. An explicit {@code --config} file must be readable; the default one is optional.
     *
     * @throws IllegalArgumentException when an override is not {@code key=value}
     */
    List<ConfigSource> configSources() {
        List<ConfigSource> sources = new ArrayList<>();
        sources.add(HeimdallConfig.defaultsSource());
        if (configFile != null) {
            sources.add(new FileConfigSource(configFile, true));
        } else {
            Path defaultFile = userHome.resolve(DEFAULT_CONFIG);
            if (Files.isRegularFile(defaultFile)) {
                sources.add(new FileConfigSource(defaultFile));
            }
        }
        sources.add(new EnvironmentConfigSource(HeimdallConfig.ENV_PREFIX, environment));
        if (!overrides.isEmpty()) {
            OverrideConfigSource cli = new OverrideConfigSource("cli");
            overrides.forEach(cli::putAssignment);
            sources.add(cli);
        }
        return sources;
    }

    private static void applyConfiguredLevel(ConfigReader config) {
        String configured = config.getOrDefault(HeimdallConfig.APP_LOGGING_LEVEL, String.class, "INFO");
        try {
            LoggingSetup.applyLevel(LogLevel.parse(configured));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring {}: {}", HeimdallConfig.APP_LOGGING_LEVEL, e.getMessage());
        }
    }
}
