/*
 * PDF-Forge - Batch PDF Document Operations
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.forge.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.batch.BatchJob;
import net.boyechko.pdf.forge.batch.BatchListener;
import net.boyechko.pdf.forge.batch.BatchProcessor;
import net.boyechko.pdf.forge.batch.JobSnapshot;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.core.VerbosityLevel;
import net.boyechko.pdf.forge.operation.Operation;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operations.OperationRegistry;
import net.boyechko.pdf.forge.ui.BatchReporter;
import net.boyechko.pdf.forge.ui.LoggingListener;
import net.boyechko.pdf.forge.ui.SettingsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfForgeCLI {
    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_JOB_FAILED = 2;

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            OperationKind operation,
            Map<String, String> parameters,
            List<Path> inputs,
            Path outputPath,
            Path configPath,
            String password,
            boolean overwrite,
            boolean ocrFirst,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (operation == null) {
                throw new IllegalArgumentException("Operation is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
            parameters = Map.copyOf(parameters);
            inputs = List.copyOf(inputs);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        OperationKind operation;
        Map<String, String> parameters = new LinkedHashMap<>();
        List<Path> inputs = new ArrayList<>();
        Path outputPath;
        Path configPath;
        String password;
        boolean overwrite;
        boolean ocrFirst;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (operation == null) {
                throw new CLIException("No operation specified");
            }
            if (inputs.isEmpty() && operation.minInputs() > 0) {
                throw new CLIException("No input file specified");
            }
            if (operation.maxInputs() > 1 && inputs.size() < operation.minInputs()) {
                throw new CLIException(
                        operation.id() + " needs at least " + operation.minInputs() + " inputs");
            }
            for (Path input : inputs) {
                if (!Files.exists(input)) {
                    throw new CLIException("File not found: " + input);
                }
            }
            if (configPath != null && !Files.isRegularFile(configPath)) {
                throw new CLIException("Settings file not found: " + configPath);
            }
            return new CLIConfig(
                    operation,
                    parameters,
                    inputs,
                    outputPath,
                    configPath,
                    password,
                    overwrite,
                    ocrFirst,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the command line and returns the process exit code. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return EXIT_OK;
            }
            if (args.length == 1 && "--list".equals(args[0])) {
                out.print(operationList());
                return EXIT_OK;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting {} on {} input(s) with verbosity level {}",
                            config.operation().id(),
                            config.inputs().size(),
                            config.verbosity());
            EngineSettings settings = loadSettings(config);
            List<BatchJob> jobs = buildJobs(config, settings);
            return runBatch(config, settings, jobs, out);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (PdfForgeException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No operation specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();
        try {
            b.operation = OperationKind.fromId(args[0]);
        } catch (PdfForgeException e) {
            throw new CLIException(e.getMessage());
        }

        for (int i = 1; i < args.length; i++) {
            if (args[i].startsWith("--param=")) {
                addParameter(b, args[i].substring("--param=".length()));
            } else if (args[i].startsWith("--config=")) {
                b.configPath = Paths.get(args[i].substring("--config=".length()));
            } else {
                switch (args[i]) {
                    case "-P", "--param" -> addParameter(b, next(args, ++i, "--param"));
                    case "-o", "--output" -> b.outputPath = Paths.get(next(args, ++i, "-o"));
                    case "-c", "--config" -> b.configPath = Paths.get(next(args, ++i, "--config"));
                    case "-p", "--password" -> b.password = next(args, ++i, "-p");
                    case "--overwrite" -> b.overwrite = true;
                    case "--ocr" -> b.ocrFirst = true;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    default -> {
                        if (args[i].startsWith("-") && args[i].length() > 1) {
                            throw new CLIException("Unknown option: " + args[i]);
                        }
                        b.inputs.add(Paths.get(args[i]));
                    }
                }
            }
        }

        return b.build();
    }

    private static String next(String[] args, int i, String option) throws CLIException {
        if (i >= args.length) {
            throw new CLIException("Value not specified after " + option);
        }
        return args[i];
    }

    private static void addParameter(CLIConfigBuilder b, String pair) throws CLIException {
        int eq = pair.indexOf('=');
        if (eq <= 0) {
            throw new CLIException("Parameter must be key=value: " + pair);
        }
        b.parameters.put(pair.substring(0, eq).trim(), pair.substring(eq + 1));
    }

    private static EngineSettings loadSettings(CLIConfig config) {
        EngineSettings settings =
                config.configPath() != null
                        ? SettingsLoader.load(config.configPath())
                        : SettingsLoader.loadDefault();
        if (config.overwrite()) {
            settings = settings.toBuilder().withOverwrite(true).build();
        }
        return settings;
    }

    /** One job per input, except for operations that combine their inputs. */
    static List<BatchJob> buildJobs(CLIConfig config, EngineSettings settings)
            throws CLIException {
        OperationKind kind = config.operation();
        Operation operation = OperationRegistry.standard().get(kind);
        // unknown or malformed parameters are usage errors, reported before any job runs
        operation.schema().validate(config.parameters(), settings);

        List<List<Path>> groups = new ArrayList<>();
        if (kind.maxInputs() > 1 || config.inputs().isEmpty()) {
            groups.add(config.inputs());
        } else {
            for (Path input : config.inputs()) {
                groups.add(List.of(input));
            }
        }

        Path output = config.outputPath();
        if (output != null && groups.size() > 1) {
            output = prepareOutputDirectory(output);
        }

        List<BatchJob> jobs = new ArrayList<>(groups.size());
        for (List<Path> group : groups) {
            jobs.add(
                    BatchJob.builder(kind)
                            .withInputs(group)
                            .withParameters(config.parameters())
                            .withOutput(output)
                            .withPassword(config.password())
                            .withOcrFirst(config.ocrFirst())
                            .build());
        }
        return jobs;
    }

    private static Path prepareOutputDirectory(Path output) throws CLIException {
        if (Files.exists(output) && !Files.isDirectory(output)) {
            throw new CLIException("Output must be a directory when processing several files");
        }
        try {
            Files.createDirectories(output);
        } catch (IOException e) {
            throw new CLIException("Cannot create output directory " + output);
        }
        return output;
    }

    private static int runBatch(
            CLIConfig config, EngineSettings settings, List<BatchJob> jobs, PrintStream out) {
        BatchReporter reporter = new BatchReporter(out, config.verbosity());
        BatchListener listener =
                config.verbosity().isAtLeast(VerbosityLevel.DEBUG)
                        ? BatchListener.of(reporter, new LoggingListener())
                        : reporter;
        reporter.begin(config.operation().id() + ": " + jobs.size() + " job(s)");

        List<JobSnapshot> results;
        try (BatchProcessor processor = new BatchProcessor(settings)) {
            results = processor.run(jobs, listener);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger().warn("Interrupted while waiting for jobs");
            return EXIT_JOB_FAILED;
        }
        boolean anyFailed = results.stream().anyMatch(job -> !job.succeeded());
        return anyFailed ? EXIT_JOB_FAILED : EXIT_OK;
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx) {
            ctx.getLogger("net.boyechko.pdf.forge").setLevel(Level.toLevel(verbosity.logLevel()));
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfForgeCLI.class);
        }
        return logger;
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String operationList() {
        OperationRegistry registry = OperationRegistry.standard();
        StringBuilder sb = new StringBuilder();
        for (OperationKind kind : OperationKind.values()) {
            sb.append(String.format("  %-16s %s%n", kind.id(), kind.description()));
            for (ParameterSpec spec : registry.get(kind).schema().specs()) {
                sb.append(String.format("      %s%n", describe(spec)));
            }
        }
        return sb.toString();
    }

    private static String describe(ParameterSpec spec) {
        StringBuilder sb = new StringBuilder(spec.name());
        if (!spec.choices().isEmpty()) {
            sb.append(" (").append(String.join("|", spec.choices())).append(")");
        }
        if (spec.required()) {
            sb.append(", required");
        } else if (spec.defaultValue() != null) {
            sb.append(", default ").append(spec.defaultValue());
        }
        return sb.toString();
    }

    private static String usageMessage() {
        return String.join(
                "\n",
                "Usage: pdf-forge <operation> [options] input...",
                "",
                "Options:",
                "  -P, --param key=value  Operation parameter (repeatable)",
                "  -o, --output path      Output file, or directory for several inputs",
                "  -c, --config file      Settings file (YAML)",
                "  -p, --password pw      Password for encrypted inputs",
                "      --overwrite        Replace existing output files",
                "      --ocr              Add a text layer to scanned pages first",
                "  -q, --quiet            Only show errors",
                "  -v, --verbose          Show per-job progress",
                "  -vv, --debug           Show debug output",
                "      --list             List operations and their parameters",
                "  -h, --help             Show this help message",
                "",
                "Operations: " + OperationKind.ids(),
                "",
                "Exit codes: 0 all jobs succeeded, 1 usage error, 2 a job failed");
    }
}
