package com.forcetree.cli;

import com.forcetree.ForceTree;
import com.forcetree.ParseException;
import com.forcetree.ast.CompilationUnit;
import com.forcetree.json.AstJsonException;
import com.forcetree.json.AstJsonProvider;
import com.forcetree.json.AstJsonSerializer;
import com.forcetree.symbols.ClassResolver;
import com.forcetree.symbols.SymbolResolutionException;
import com.forcetree.symbols.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Translates every Apex file found under the given paths, optionally writing the
 * JSON form of each tree next to its source.
 *
 * <pre>
 * BatchTranslator --json --threads=4 src/classes src/triggers
 * </pre>
 */
public class BatchTranslator {

    private static final Logger logger = LoggerFactory.getLogger(BatchTranslator.class);

    static final String JSON_SUFFIX = ".json";

    static final String WORKER_THREAD_PREFIX = "forcetree-worker-";

    private final Config config;

    private final AtomicLong totalFiles = new AtomicLong(0);
    private final AtomicLong translatedFiles = new AtomicLong(0);
    private final AtomicLong failedFiles = new AtomicLong(0);
    private final AtomicLong writtenFiles = new AtomicLong(0);

    private final ConcurrentLinkedQueue<CompilationUnit> units = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<String> failures = new ConcurrentLinkedQueue<>();

    private SymbolTable symbolTable;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(1);
        }

        BatchTranslator translator = new BatchTranslator(config);
        try {
            int exitCode = translator.run();
            System.exit(exitCode);
        } catch (Exception e) {
            logger.error("Fatal error: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    public BatchTranslator(Config config) {
        this.config = config;
    }

    public int run() throws Exception {
        AstJsonSerializer serializer = null;
        if (config.json) {
            AstJsonProvider provider = AstJsonProvider.getProvider();
            serializer = config.compact ? provider.getCompactSerializer() : provider.getSerializer();
        }

        List<Path> files = discoverFiles();
        totalFiles.set(files.size());
        logger.info("Found {} Apex files to translate", files.size());

        long startTime = System.currentTimeMillis();

        AstJsonSerializer jsonOut = serializer;
        ExecutorService executor = newWorkerPool(config.threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> processFile(file, jsonOut)));
            }

            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    failedFiles.incrementAndGet();
                    failures.add(e.getCause().toString());
                    logger.error("Unexpected failure in worker", e.getCause());
                }
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        resolveSymbols();

        long elapsedMs = System.currentTimeMillis() - startTime;
        logger.info("Translated {} of {} files in {} ms ({} failed, {} JSON files written)",
            translatedFiles.get(), totalFiles.get(), elapsedMs, failedFiles.get(), writtenFiles.get());
        for (String failure : failures) {
            logger.warn("FAILED {}", failure);
        }

        return failedFiles.get() > 0 ? 1 : 0;
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger(0);
        return Executors.newFixedThreadPool(threads, task -> {
            Thread thread = new Thread(task, WORKER_THREAD_PREFIX + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private List<Path> discoverFiles() throws IOException {
        List<Path> files = new ArrayList<>();

        for (Path input : config.inputs) {
            if (!Files.exists(input)) {
                logger.warn("Input does not exist: {}", input);
                continue;
            }

            try (Stream<Path> paths = Files.walk(input)) {
                paths.filter(Files::isRegularFile)
                     .filter(ForceTree::isApexSourceFile)
                     .forEach(files::add);
            }
        }

        Collections.sort(files);
        return files;
    }

    private void processFile(Path file, AstJsonSerializer serializer) {
        CompilationUnit unit;
        try {
            unit = ForceTree.parseAndTranslate(file);
        } catch (ParseException e) {
            recordFailure(file, e.getMessage());
            return;
        } catch (IOException e) {
            recordFailure(file, "IO error: " + e.getMessage());
            return;
        }

        translatedFiles.incrementAndGet();
        units.add(unit);
        if (config.verbose) {
            logger.info("[OK] {}", file);
        }

        if (serializer != null) {
            Path target = file.resolveSibling(file.getFileName() + JSON_SUFFIX);
            try {
                Files.writeString(target, serializer.serializePretty(unit));
                writtenFiles.incrementAndGet();
            } catch (IOException | AstJsonException e) {
                recordFailure(file, "Could not write " + target + ": " + e.getMessage());
            }
        }
    }

    private void recordFailure(Path file, String message) {
        failedFiles.incrementAndGet();
        failures.add(file + " - " + message);
        if (config.verbose) {
            logger.warn("[FAIL] {}: {}", file, message);
        }
    }

    private void resolveSymbols() {
        try {
            symbolTable = ClassResolver.resolveClassesAndMethods(new ArrayList<>(units));
        } catch (SymbolResolutionException e) {
            failedFiles.incrementAndGet();
            failures.add(e.getMessage());
            return;
        }
        logger.info("Resolved {} classes", symbolTable.size());
        if (config.verbose) {
            logger.info("Symbols:\n{}", symbolTable.describe());
        }
    }

    public long getTotalFiles() {
        return totalFiles.get();
    }

    public long getTranslatedFiles() {
        return translatedFiles.get();
    }

    public long getFailedFiles() {
        return failedFiles.get();
    }

    /**
     * Symbols of the successfully translated classes, or null before {@link #run()} finishes.
     */
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    private static void printUsage() {
        System.out.println("Usage: BatchTranslator [options] <files or dirs...>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --json                Write <file>.json next to each translated source");
        System.out.println("  --compact             Omit source locations from the JSON output");
        System.out.println("  --threads=N           Number of worker threads (default: CPU count)");
        System.out.println("  --verbose             Log every file and dump resolved symbols");
        System.out.println("  --help                Show this help");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  BatchTranslator src/classes");
        System.out.println("  BatchTranslator --json --compact --threads=8 Account.cls Contact.trigger");
    }

    public static class Config {
        int threads = Runtime.getRuntime().availableProcessors();
        boolean json = false;
        boolean compact = false;
        boolean verbose = false;
        List<Path> inputs = new ArrayList<>();

        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.equals("--json")) {
                    config.json = true;
                } else if (arg.equals("--compact")) {
                    config.compact = true;
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
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.inputs.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.inputs.isEmpty()) {
                System.err.println("Error: No input files or directories specified");
                return null;
            }

            return config;
        }

        public int threads() {
            return threads;
        }

        public boolean json() {
            return json;
        }

        public boolean compact() {
            return compact;
        }

        public boolean verbose() {
            return verbose;
        }

        public List<Path> inputs() {
            return inputs;
        }
    }
}
