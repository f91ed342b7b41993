package com.rbdesugar.lowertool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rbdesugar.ast.Expression;
import com.rbdesugar.ast.TreePrinter;
import com.rbdesugar.desugar.Desugar;
import com.rbdesugar.desugar.LoweringContext;
import com.rbdesugar.errors.CollectingDiagnosticSink;
import com.rbdesugar.errors.Diagnostic;
import com.rbdesugar.errors.LoweringException;
import com.rbdesugar.jackson.JacksonAstJsonProvider;
import com.rbdesugar.json.AstJsonException;
import com.rbdesugar.names.NameTable;
import com.rbdesugar.parser.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Batch driver for the lowering pass.
 *
 * Reads parse trees serialized as JSON, lowers each one in its own compilation unit and writes
 * the lowered tree next to a summary of the diagnostics. All units share one name table.
 *
 * Usage:
 *   java -cp ... com.rbdesugar.lowertool.LowerTool [options] <source-dirs...>
 *
 * Options:
 *   --threads=N           Number of worker threads (default: available processors)
 *   --output-dir=PATH     Directory for lowered trees and reports (default: ./lower-tool-output)
 *   --extensions=ext,...  File extensions to process (default: json)
 *   --pretty              Pretty-print the lowered JSON
 *   --verbose             Print every lowered tree
 */
public class LowerTool {

    private static final Logger log = LoggerFactory.getLogger(LowerTool.class);

    private final Config config;
    private final JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
    private final ObjectMapper reportMapper = provider.getObjectMapper();
    private final NameTable names = new NameTable();

    // Statistics (thread-safe)
    private final AtomicLong totalFiles = new AtomicLong(0);
    private final AtomicLong loweredFiles = new AtomicLong(0);
    private final AtomicLong failedFiles = new AtomicLong(0);
    private final AtomicLong diagnosticCount = new AtomicLong(0);

    private final ConcurrentLinkedQueue<FailureRecord> failures = new ConcurrentLinkedQueue<>();

    private final ExecutorService executor;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(1);
        }

        LowerTool tool = new LowerTool(config);
        try {
            int exitCode = tool.run();
            System.exit(exitCode);
        } catch (Exception e) {
            System.err.println("Fatal error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    public LowerTool(Config config) {
        this.config = config;
        this.executor = Executors.newFixedThreadPool(config.threads);
    }

    /**
     * Lowers every matching file below the source directories.
     *
     * @return 0 when every unit lowered, 1 when at least one unit aborted
     */
    public int run() throws IOException, InterruptedException {
        System.out.println("╔══════════════════════════════════════════════════════════════╗");
        System.out.println("║                     Desugar Lower Tool                       ║");
        System.out.println("╚══════════════════════════════════════════════════════════════╝");
        System.out.println();
        System.out.println("Configuration:");
        System.out.println("  Threads:       " + config.threads);
        System.out.println("  Output dir:    " + config.outputDir);
        System.out.println("  Extensions:    " + config.extensions);
        System.out.println("  Source dirs:   " + config.sourceDirs);
        System.out.println();

        Files.createDirectories(config.outputDir);

        List<SourceFile> allFiles = discoverFiles();
        totalFiles.set(allFiles.size());
        System.out.println("Found " + totalFiles.get() + " files to process");

        long startTime = System.currentTimeMillis();

        // Claimed in discovery order so that the first input keeps a contested output
        Set<Path> claimedOutputs = new HashSet<>();
        List<Future<?>> futures = new ArrayList<>();
        for (SourceFile source : allFiles) {
            Path output = outputFileFor(source.root(), source.file());
            if (!claimedOutputs.add(output.toAbsolutePath().normalize())) {
                recordFailure(source.file(), FailureType.OUTPUT_COLLISION,
                    "Output " + output + " is already written by another input");
                continue;
            }
            futures.add(executor.submit(() -> processFile(source.file(), output)));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                // processFile records its own failures; anything here escaped it
                log.error("Worker failed", e.getCause());
                failedFiles.incrementAndGet();
            }
        }

        executor.shutdown();
        executor.awaitTermination(10, TimeUnit.SECONDS);

        long elapsedMs = System.currentTimeMillis() - startTime;
        printFinalResults(elapsedMs);
        writeFailureReport();

        return failedFiles.get() > 0 ? 1 : 0;
    }

    private List<SourceFile> discoverFiles() throws IOException {
        List<SourceFile> files = new ArrayList<>();

        for (Path sourceDir : config.sourceDirs) {
            if (!Files.exists(sourceDir)) {
                System.err.println("Warning: Source directory does not exist: " + sourceDir);
                continue;
            }

            try (Stream<Path> paths = Files.walk(sourceDir)) {
                paths.filter(Files::isRegularFile)
                     .filter(this::hasValidExtension)
                     .filter(p -> !p.startsWith(config.outputDir))
                     .sorted()
                     .forEach(file -> files.add(new SourceFile(sourceDir, file)));
            }
        }

        return files;
    }

    boolean hasValidExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        return config.extensions.stream().anyMatch(ext -> name.endsWith("." + ext));
    }

    void processFile(Path file, Path output) {
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink();
        LoweringContext ctx = LoweringContext.builder()
            .names(names)
            .diagnostics(sink)
            .file(file.toString())
            .build();

        try {
            String json = Files.readString(file);
            Node parseTree = provider.getDeserializer().deserializeParseTree(json);
            Expression lowered = Desugar.node2Tree(ctx, parseTree);

            String out = config.pretty
                ? provider.getSerializer().serializePretty(lowered)
                : provider.getSerializer().serialize(lowered);
            Files.createDirectories(output.toAbsolutePath().getParent());
            Files.writeString(output, out);

            if (config.verbose) {
                System.out.println("[OK] " + file + ": " + TreePrinter.print(lowered));
            }
            loweredFiles.incrementAndGet();
        } catch (LoweringException e) {
            recordFailure(file, FailureType.LOWERING_ABORTED, e.getMessage());
        } catch (AstJsonException e) {
            recordFailure(file, FailureType.INVALID_PARSE_TREE, e.getMessage());
        } catch (IOException e) {
            recordFailure(file, FailureType.IO_ERROR, e.getMessage());
        } catch (StackOverflowError e) {
            recordFailure(file, FailureType.TOO_DEEP, "Tree nested too deeply to lower");
        } catch (RuntimeException e) {
            log.error("Unexpected failure lowering {}", file, e);
            recordFailure(file, FailureType.UNEXPECTED_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            diagnosticCount.addAndGet(sink.diagnostics().size());
            for (Diagnostic diagnostic : sink.diagnostics()) {
                System.out.println(file + ":" + diagnostic);
            }
        }
    }

    private void recordFailure(Path file, FailureType type, String message) {
        failedFiles.incrementAndGet();
        failures.add(new FailureRecord(file.toAbsolutePath(), type, message));
        if (config.verbose) {
            System.out.println("[FAIL] " + type + ": " + file + " - " + message);
        }
    }

    /**
     * Where the lowered tree of {@code file} goes: its path below {@code root}, mirrored under
     * the output directory, with the extension replaced by {@code .core.json}.
     */
    Path outputFileFor(Path root, Path file) {
        Path relative = root.equals(file) ? file.getFileName() : root.relativize(file);
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return config.outputDir.resolve(relative).resolveSibling(base + ".core.json");
    }

    private void printFinalResults(long elapsedMs) {
        System.out.println();
        System.out.println("╔══════════════════════════════════════════════════════════════╗");
        System.out.println("║                       Final Results                          ║");
        System.out.println("╚══════════════════════════════════════════════════════════════╝");
        System.out.println();
        System.out.printf("  Total files:              %d%n", totalFiles.get());
        System.out.printf("  ✓ Lowered:                %d%n", loweredFiles.get());
        System.out.printf("  ✗ Failed:                 %d%n", failedFiles.get());
        System.out.printf("  Diagnostics:              %d%n", diagnosticCount.get());
        System.out.println();
        System.out.printf("  Elapsed time:             %.2f seconds%n", elapsedMs / 1000.0);
        System.out.println();

        if (failedFiles.get() > 0) {
            System.out.println("  ❌ FAILURES DETECTED - see " + config.outputDir + " for details");
        } else {
            System.out.println("  ✅ ALL UNITS LOWERED");
        }
    }

    private void writeFailureReport() throws IOException {
        if (failures.isEmpty()) {
            return;
        }

        Path summaryFile = config.outputDir.resolve("failure-summary.txt");
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(summaryFile))) {
            writer.println("Desugar Lower Tool - Failure Summary");
            writer.println("====================================");
            writer.println();
            writer.printf("Total failures: %d%n", failures.size());
            writer.println();

            Map<FailureType, List<FailureRecord>> byType = failures.stream()
                .collect(Collectors.groupingBy(FailureRecord::type));

            for (Map.Entry<FailureType, List<FailureRecord>> entry : byType.entrySet()) {
                writer.println(entry.getKey() + ": " + entry.getValue().size());
                for (FailureRecord failure : entry.getValue()) {
                    writer.println("  - " + failure.file());
                    if (failure.message() != null) {
                        writer.println("    " + failure.message());
                    }
                }
                writer.println();
            }
        }
        System.out.println("Wrote failure summary to: " + summaryFile);

        Path jsonFile = config.outputDir.resolve("failures.json");
        List<Map<String, Object>> jsonFailures = new ArrayList<>();
        for (FailureRecord failure : failures) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("file", failure.file().toString());
            map.put("type", failure.type().name());
            map.put("message", failure.message());
            jsonFailures.add(map);
        }
        Files.writeString(jsonFile, reportMapper.writerWithDefaultPrettyPrinter().writeValueAsString(jsonFailures));
        System.out.println("Wrote JSON failures to: " + jsonFile);
    }

    long loweredCount() {
        return loweredFiles.get();
    }

    long failedCount() {
        return failedFiles.get();
    }

    private static void printUsage() {
        System.out.println("Usage: LowerTool [options] <source-dirs...>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --threads=N           Number of worker threads (default: CPU count)");
        System.out.println("  --output-dir=PATH     Directory for lowered trees (default: ./lower-tool-output)");
        System.out.println("  --extensions=ext,...  File extensions to process (default: json)");
        System.out.println("  --pretty              Pretty-print the lowered JSON");
        System.out.println("  --verbose             Print every lowered tree");
        System.out.println("  --help                Show this help");
    }

    // ========== Inner classes ==========

    public enum FailureType {
        INVALID_PARSE_TREE,
        LOWERING_ABORTED,
        TOO_DEEP,
        IO_ERROR,
        OUTPUT_COLLISION,
        UNEXPECTED_ERROR
    }

    record SourceFile(Path root, Path file) {}

    public record FailureRecord(
        Path file,
        FailureType type,
        String message
    ) {}

    public static class Config {
        int threads = Runtime.getRuntime().availableProcessors();
        Path outputDir = Path.of("lower-tool-output");
        List<String> extensions = List.of("json");
        List<Path> sourceDirs = new ArrayList<>();
        boolean pretty = false;
        boolean verbose = false;

        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--threads=")) {
                    try {
                        config.threads = Integer.parseInt(arg.substring(10));
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid thread count: " + arg.substring(10));
                        return null;
                    }
                    if (config.threads < 1) {
                        System.err.println("Thread count must be positive: " + config.threads);
                        return null;
                    }
                } else if (arg.startsWith("--output-dir=")) {
                    config.outputDir = Path.of(arg.substring(13));
                } else if (arg.startsWith("--extensions=")) {
                    config.extensions = Arrays.asList(arg.substring(13).split(","));
                } else if (arg.equals("--pretty")) {
                    config.pretty = true;
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.sourceDirs.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.sourceDirs.isEmpty()) {
                System.err.println("Error: No source directories specified");
                return null;
            }

            return config;
        }
    }
}
