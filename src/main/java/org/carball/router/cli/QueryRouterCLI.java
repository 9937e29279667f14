package org.carball.router.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.router.catalog.CatalogSnapshot;
import org.carball.router.config.ConfigurationLoader;
import org.carball.router.config.RouterConfig;
import org.carball.router.engine.QueryRequest;
import org.carball.router.engine.RoutingDecision;
import org.carball.router.engine.RoutingPlanner;
import org.carball.router.exception.RouterException;
import org.carball.router.model.cost.Backend;
import org.carball.router.output.RoutingReport;
import org.carball.router.parser.SqlQueryParser;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

/**
 * Command-line front end. Shows how queries would be routed against a dataset;
 * it does not bundle any execution engine.
 */
@Slf4j
public class QueryRouterCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════╗
        ║            Intelligent Query Router v%s        ║
        ╚═══════════════════════════════════════════════════╝
        """;

    enum OutputFormat {
        JSON, MARKDOWN
    }

    static final class Options {
        String command;
        String argument;
        String dataPath;
        OutputFormat format = OutputFormat.MARKDOWN;
        String profile;
        Path configFile;
        Backend pinnedBackend;
        final List<String> overrides = new ArrayList<>();
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || isHelpRequested(args)) {
            out.printf((BANNER) + "%n", VERSION);
            printUsage(out);
            return args.length == 0 ? 1 : 0;
        }

        try {
            Options options = parseArgs(args);
            RouterConfig config = loadConfig(options);
            RoutingPlanner planner = RoutingPlanner.fromConfig(config, new SqlQueryParser(),
                    EnumSet.allOf(Backend.class));

            switch (options.command) {
                case "catalog":
                    CatalogSnapshot snapshot = planner.refreshCatalog();
                    out.print(RoutingReport.describeCatalog(snapshot));
                    break;
                case "explain":
                    explain(planner, options.argument, options, out);
                    break;
                case "explain-file":
                    Path sqlFile = Paths.get(options.argument);
                    if (!Files.isRegularFile(sqlFile)) {
                        throw new IllegalArgumentException("SQL file not found: " + sqlFile);
                    }
                    explain(planner, Files.readString(sqlFile), options, out);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown command: " + options.command);
            }
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (RouterException e) {
            err.println("Routing error: " + e.getMessage());
            log.debug("Routing error details", e);
            return 2;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private static void explain(RoutingPlanner planner, String sql, Options options, PrintStream out) {
        QueryRequest request = QueryRequest.builder()
                .sql(sql)
                .pinnedBackend(options.pinnedBackend)
                .build();
        RoutingDecision decision = planner.plan(request).decision();
        RoutingReport report = new RoutingReport(decision);
        out.println(options.format == OutputFormat.JSON ? report.toJson() : report.toMarkdown());
    }

    private static RouterConfig loadConfig(Options options) throws IOException {
        List<String> cliOverrides = new ArrayList<>(options.overrides);
        if (options.dataPath != null) {
            cliOverrides.add("--router.data-path");
            cliOverrides.add(options.dataPath);
        }
        return new ConfigurationLoader().loadConfiguration(options.profile, options.configFile,
                cliOverrides.toArray(new String[0]));
    }

    static Options parseArgs(String[] args) {
        Options options = new Options();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--router.")) {
                options.overrides.add(arg);
                options.overrides.add(requireValue(args, ++i, "No value given for " + arg));
                continue;
            }
            switch (arg) {
                case "--data-path":
                case "-d":
                    options.dataPath = requireValue(args, ++i, "Data path not specified");
                    break;
                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        options.format = OutputFormat.valueOf(format.toUpperCase());
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json or markdown");
                    }
                    break;
                case "--profile":
                    options.profile = requireValue(args, ++i, "Profile not specified");
                    break;
                case "--config":
                    options.configFile = Paths.get(requireValue(args, ++i, "Config file not specified"));
                    break;
                case "--backend":
                case "-b":
                    options.pinnedBackend = Backend.fromName(requireValue(args, ++i, "Backend not specified"));
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    positional.add(arg);
            }
        }

        if (positional.isEmpty()) {
            throw new IllegalArgumentException("No command given");
        }
        options.command = positional.get(0);
        if (options.command.startsWith("explain")) {
            if (positional.size() != 2) {
                throw new IllegalArgumentException(options.command + " takes exactly one argument");
            }
            options.argument = positional.get(1);
        } else if (positional.size() > 1) {
            throw new IllegalArgumentException("Unexpected arguments: " + positional.subList(1, positional.size()));
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: java -jar query-router.jar <command> [arguments] [options]");
        out.println();
        out.println("Commands:");
        out.println("  explain <sql>         Show how a query would be routed");
        out.println("  explain-file <file>   Same, reading the query from a .sql file");
        out.println("  catalog               List the partitions discovered under the data path");
        out.println("  help                  Show this help message");
        out.println();
        out.println("Options:");
        out.println("  --data-path, -d       Dataset root with key=value partition directories");
        out.println("  --format, -f          Output format: json|markdown (default: markdown)");
        out.println("  --profile             Routing profile: balanced|laptop|workstation|cluster-first");
        out.println("  --config              YAML file with router settings");
        out.println("  --backend, -b         Pin the backend: duckdb|polars|spark");
        out.println("  --router.<key> <val>  Override a single setting");
        out.println();
        out.println("Examples:");
        out.println("  java -jar query-router.jar explain \"SELECT count(*) FROM sales WHERE date = '2024-11-01'\" -d ./data");
        out.println("  java -jar query-router.jar catalog -d ./data --profile laptop");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
    }
}
