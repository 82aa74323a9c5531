package io.github.yok.pgmigrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.pgmigrator.command.CommandOptions;
import io.github.yok.pgmigrator.command.ExportCommand;
import io.github.yok.pgmigrator.command.ImportCommand;
import io.github.yok.pgmigrator.command.MigrateCommand;
import io.github.yok.pgmigrator.config.ConnectionConfig;
import io.github.yok.pgmigrator.config.MigrationConfig;
import io.github.yok.pgmigrator.core.MigrationListener;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.model.MigrationResult;
import io.github.yok.pgmigrator.parser.JsonMappers;
import io.github.yok.pgmigrator.util.ErrorHandler;
import io.github.yok.pgmigrator.util.MaskingLogUtil;
import java.time.Clock;
import java.util.Arrays;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Usage: {@code <command> [options]}
 * </p>
 * <ul>
 * <li>{@code export}: write schema, function, trigger and data artifacts of the source</li>
 * <li>{@code import}: replay the artifacts of a migration directory against the target</li>
 * <li>{@code schema}, {@code functions}, {@code triggers}, {@code data}: migrate one kind of object
 * directly from source to target</li>
 * <li>{@code migrate-all}: schema, functions, triggers and data in one run</li>
 * </ul>
 *
 * <p>
 * Options: {@code --source/-s}, {@code --target/-t}, {@code --dir/-d}, {@code --output/-o},
 * {@code --schema}, {@code --table}, {@code --function}, {@code --trigger}, {@code --format},
 * {@code --batch-size}, {@code --dry-run}, {@code --truncate}, {@code --data-only},
 * {@code --include-data}, {@code --no-data}. Options not given fall back to
 * {@link ConnectionConfig} and {@link MigrationConfig} from {@code application.yml}.
 * </p>
 *
 * <p>
 * The process exits with 0 when the command succeeded and 1 otherwise.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final String EXPORT = "export";
    static final String IMPORT = "import";
    static final Set<String> MIGRATE_COMMANDS =
            Set.of(MigrateCommand.SCHEMA, MigrateCommand.FUNCTIONS, MigrateCommand.TRIGGERS,
                    MigrateCommand.DATA, MigrateCommand.ALL);

    private final ConnectionConfig connectionConfig;
    private final MigrationConfig migrationConfig;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context != null) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.stream(args)
                .map(MaskingLogUtil::maskConnectionString).collect(Collectors.joining(" ")));

        CommandOptions options;
        try {
            options = parseArguments(args);
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit(e.getMessage());
            exitCode = 1;
            return;
        }

        Function<String, Database> connector =
                url -> new Database(url, connectionConfig.getSslMode());
        ObjectMapper objectMapper = JsonMappers.create();
        Clock clock = Clock.systemUTC();
        String command = options.getCommand();

        try {
            MigrationResult result;
            if (EXPORT.equals(command)) {
                result = new ExportCommand(connector, migrationConfig, clock, objectMapper)
                        .run(options);
            } else if (IMPORT.equals(command)) {
                result = new ImportCommand(connector, migrationConfig, objectMapper,
                        MigrationListener.NOOP).run(options);
            } else {
                result = new MigrateCommand(connector, migrationConfig, clock, objectMapper)
                        .run(options);
            }
            exitCode = result.isSuccess() ? 0 : 1;
            log.info("Command [{}] finished: {}", command, result.getMessage());
        } catch (Exception e) {
            log.error("Fatal error occurred (command={}): {}", command, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Parses the command and its options on top of the configured defaults.
     *
     * @param args command-line arguments
     * @return options
     * @throws IllegalArgumentException if the command is missing or unknown, or an option value
     *         is invalid
     */
    CommandOptions parseArguments(String... args) {
        if (args.length == 0 || args[0].startsWith("-")) {
            throw new IllegalArgumentException("A command is required: export, import, "
                    + String.join(", ", MIGRATE_COMMANDS.stream().sorted()
                            .collect(Collectors.toList())));
        }
        String command = args[0];
        if (!EXPORT.equals(command) && !IMPORT.equals(command)
                && !MIGRATE_COMMANDS.contains(command)) {
            throw new IllegalArgumentException("Unknown command: " + command);
        }

        CommandOptions.CommandOptionsBuilder b =
                CommandOptions.defaults(connectionConfig, migrationConfig).toBuilder()
                        .command(command);
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--source":
                case "-s":
                    b.source(value(args, ++i));
                    break;
                case "--target":
                case "-t":
                    b.target(value(args, ++i));
                    break;
                case "--dir":
                case "-d":
                case "--output":
                case "-o":
                    b.dir(value(args, ++i));
                    break;
                case "--schema":
                    b.schema(value(args, ++i));
                    break;
                case "--table":
                    b.table(value(args, ++i));
                    break;
                case "--function":
                    b.function(value(args, ++i));
                    break;
                case "--trigger":
                    b.trigger(value(args, ++i));
                    break;
                case "--format":
                    b.format(value(args, ++i));
                    break;
                case "--batch-size":
                    b.batchSize(positiveInt(value(args, ++i)));
                    break;
                case "--dry-run":
                    b.dryRun(true);
                    break;
                case "--truncate":
                    b.truncate(true);
                    break;
                case "--data-only":
                    b.dataOnly(true);
                    break;
                case "--include-data":
                    b.includeData(true);
                    break;
                case "--no-data":
                    b.includeData(false);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        return b.build();
    }

    private static String value(String[] args, int index) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }

    private static int positiveInt(String text) {
        try {
            int n = Integer.parseInt(text);
            if (n > 0) {
                return n;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid batch size: " + text, e);
        }
        throw new IllegalArgumentException("Batch size must be positive: " + text);
    }
}
