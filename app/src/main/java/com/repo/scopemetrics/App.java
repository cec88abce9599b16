package com.repo.scopemetrics;

import com.repo.scopemetrics.ast.EstreeFormatException;
import com.repo.scopemetrics.ast.EstreeReader;
import com.repo.scopemetrics.ast.Program;
import com.repo.scopemetrics.config.ConfigurationException;
import com.repo.scopemetrics.config.MetricsConfig;
import com.repo.scopemetrics.core.DocumentAnalyzer;
import com.repo.scopemetrics.core.RuleRegistry;
import com.repo.scopemetrics.report.ConsoleReporter;
import com.repo.scopemetrics.report.CsvReporter;
import com.repo.scopemetrics.report.DocumentReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scope Metrics - complexity and statement counts for ESTree programs.
 *
 * Usage: java -jar scope-metrics.jar --input <file|dir> [--config <yaml>] [--csv <file>]
 */
public class App {

    static final int EXIT_CLEAN = 0;
    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(new App().run(args));
    }

    private record CliArgs(Path input, Path configPath, Path csvPath) {
    }

    private static CliArgs parseArgs(String[] args) {
        Path input = null;
        Path configPath = null;
        Path csvPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--input" -> {
                    if (i + 1 < args.length)
                        input = Path.of(args[++i]);
                }
                case "--config" -> {
                    if (i + 1 < args.length)
                        configPath = Path.of(args[++i]);
                }
                case "--csv" -> {
                    if (i + 1 < args.length)
                        csvPath = Path.of(args[++i]);
                }
                default -> {
                    System.err.println("Unknown argument: " + args[i]);
                    return null;
                }
            }
        }

        if (input == null) {
            return null;
        }
        return new CliArgs(input, configPath, csvPath);
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar scope-metrics.jar --input <file|dir> [--config <yaml>] [--csv <file>]

                Arguments:
                  --input <path>    ESTree JSON document, or a directory searched for *.json files (required)
                  --config <file>   Configuration file (default: scope-metrics.yaml next to the input)
                  --csv <file>      Also write violations as CSV
                """);
    }

    int run(String[] args) {
        System.out.println("=== Scope Metrics ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            return EXIT_USAGE;
        }

        MetricsConfig config;
        try {
            config = cliArgs.configPath() != null
                    ? MetricsConfig.loadFile(cliArgs.configPath())
                    : MetricsConfig.load(projectRoot(cliArgs.input()));
        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        RuleRegistry registry = RuleRegistry.defaults();
        registry.printSummary(config);

        List<Path> documents;
        try {
            documents = findDocuments(cliArgs.input(), config);
        } catch (IOException e) {
            System.err.println("Error: Could not list " + cliArgs.input() + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        System.out.println("Analyzing " + documents.size() + " document(s)\n");

        EstreeReader reader = new EstreeReader();
        DocumentAnalyzer analyzer = new DocumentAnalyzer(config, registry);
        ConsoleReporter console = new ConsoleReporter();
        List<DocumentReport> reports = new ArrayList<>();

        for (Path document : documents) {
            try {
                Program program = reader.read(document);
                DocumentReport report = analyzer.analyze(program, document.toString());
                console.print(report);
                reports.add(report);
            } catch (EstreeFormatException e) {
                System.err.println("Warning: Skipping " + document + ": " + e.getMessage());
            }
        }
        console.printSummary(reports);

        if (cliArgs.csvPath() != null) {
            try {
                new CsvReporter().generate(reports, cliArgs.csvPath());
            } catch (IOException e) {
                System.err.println("Error: Could not write CSV report: " + e.getMessage());
                return EXIT_USAGE;
            }
        }

        boolean clean = reports.stream().allMatch(DocumentReport::isClean);
        return clean ? EXIT_CLEAN : EXIT_VIOLATIONS;
    }

    private static Path projectRoot(Path input) {
        Path absolute = input.toAbsolutePath();
        if (Files.isDirectory(absolute)) {
            return absolute;
        }
        Path parent = absolute.getParent();
        return parent != null ? parent : absolute;
    }

    static List<Path> findDocuments(Path input, MetricsConfig config) throws IOException {
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (Stream<Path> paths = Files.walk(input)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .filter(p -> !config.shouldExclude(p))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
