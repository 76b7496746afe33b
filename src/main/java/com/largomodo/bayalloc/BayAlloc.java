package com.largomodo.bayalloc;

import com.largomodo.bayalloc.core.AllocationObserver;
import com.largomodo.bayalloc.core.AllocationPipeline;
import com.largomodo.bayalloc.core.FifoAllocationEngine;
import com.largomodo.bayalloc.core.PipelineResult;
import com.largomodo.bayalloc.core.domain.AllocationRecord;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.Finding;
import com.largomodo.bayalloc.core.domain.InputDataset;
import com.largomodo.bayalloc.core.domain.OverflowRecord;
import com.largomodo.bayalloc.service.CsvInputReader;
import com.largomodo.bayalloc.service.CsvReportWriter;
import com.largomodo.bayalloc.service.InputReader;
import com.largomodo.bayalloc.service.InputSources;
import com.largomodo.bayalloc.service.ReportWriter;
import com.largomodo.bayalloc.util.PickFileMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * CLI entry point for bay slot allocation.
 * <p>
 * Reads the three client exports of one dataset directory, allocates bay slots to the most
 * recent demand, writes the report set and maps validation findings to the exit code.
 * <p>
 * Smart defaults:
 * - Location and article masters are looked up by their export names inside INPUT
 * - The pick history is the single file in INPUT ending in "pick.csv"
 * - Reports go to INPUT/output unless -o is given
 */
@Command(
        name = "bayalloc",
        mixinStandardHelpOptions = true,
        resourceBundle = "bayalloc.bayalloc",
        version = "${bundle:application.version}",
        header = "Allocates warehouse bay slots to recent pick demand.",
        description = {
                "Groups storage locations into bays, sizes each bay's slot inventory from the slot types of" +
                        " its locations, and assigns articles to slots first-come-first-served by pick recency.",
                "",
                "Demand that finds its bay's slots exhausted is logged as overflow. A validation report" +
                        " checks the result for consistency."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, malformed input file)",
                "2:Invalid command line arguments",
                "3:Validation reported at least one error"
        }
)
public class BayAlloc implements Callable<Integer> {

    static final int EXIT_VALIDATION_ERRORS = 3;
    static final String DEFAULT_LOCATIONS = "Locations.csv";
    static final String DEFAULT_ARTICLES = "Artikelinformatie.csv";
    static final String MDC_DATASET = "dataset";

    private static final Logger log = LoggerFactory.getLogger(BayAlloc.class);

    @Parameters(index = "0", paramLabel = "INPUT",
            description = "Dataset directory holding the location master, article master and pick export.")
    File inputDir;

    @Option(names = "--locations", paramLabel = "FILE",
            description = "Location master export. Default: INPUT/" + DEFAULT_LOCATIONS)
    File locationsFile;

    @Option(names = "--articles", paramLabel = "FILE",
            description = "Article master export. Default: INPUT/" + DEFAULT_ARTICLES)
    File articlesFile;

    @Option(names = "--picks", paramLabel = "FILE",
            description = "Pick history export. Default: the single file in INPUT whose name ends in 'pick.csv'.")
    File picksFile;

    @Option(names = {"-o", "--output-dir"}, paramLabel = "DIR",
            description = {
                    "Directory under which the report is written.",
                    "Default: a folder named 'output' inside INPUT."
            })
    File outputDir;

    @Option(names = "--max-picks", paramLabel = "N", defaultValue = "100000",
            description = "Only the N most recent demand events are allocated. Default: ${DEFAULT-VALUE}")
    int maxPicks;

    @Option(names = "--area", paramLabel = "CODE",
            description = "Keep only locations in this pick area and picks whose location starts with it.")
    String area;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    private final InputReader reader;
    private final ReportWriter writer;

    public BayAlloc() {
        this(new CsvInputReader(), new CsvReportWriter());
    }

    BayAlloc(InputReader reader, ReportWriter writer) {
        this.reader = reader;
        this.writer = writer;
    }

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new BayAlloc());
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (!inputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path must be an existing directory: " + inputDir.getAbsolutePath());
        }
        if (maxPicks <= 0) {
            throw new ParameterException(spec.commandLine(),
                    "--max-picks must be greater than 0, got " + maxPicks);
        }

        Path input = inputDir.toPath();
        Path locations = locationsFile != null ? locationsFile.toPath() : input.resolve(DEFAULT_LOCATIONS);
        Path articles = articlesFile != null ? articlesFile.toPath() : input.resolve(DEFAULT_ARTICLES);
        Path picks = picksFile != null ? picksFile.toPath() : findPickExport(input);

        if (outputDir == null) {
            outputDir = new File(inputDir, "output");
        }
        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }

        MDC.put(MDC_DATASET, input.toAbsolutePath().getFileName().toString());
        try {
            InputDataset dataset = reader.read(new InputSources(locations, articles, picks, area));
            AllocationPipeline pipeline = new AllocationPipeline(new FifoAllocationEngine(new ProgressLogger()));
            PipelineResult result = pipeline.run(dataset, maxPicks);

            Files.createDirectories(outputDir.toPath());
            Path reportDir = writer.write(result, dataset, outputDir.toPath());

            logFindings(result.report().findings());
            if (result.report().hasErrors()) {
                log.error("Validation failed with {} error(s); see {}", result.report().errors().size(),
                        reportDir);
                return EXIT_VALIDATION_ERRORS;
            }
            log.info("Allocation complete: {}", reportDir);
            return 0;
        } finally {
            MDC.remove(MDC_DATASET);
        }
    }

    private Path findPickExport(Path input) throws IOException {
        List<Path> candidates;
        try (Stream<Path> stream = Files.list(input)) {
            candidates = stream.filter(PickFileMatcher::isPickFile).sorted().collect(Collectors.toList());
        }
        if (candidates.isEmpty()) {
            throw new ParameterException(spec.commandLine(),
                    "No pick export (*pick.csv) found in " + input.toAbsolutePath() + "; use --picks");
        }
        if (candidates.size() > 1) {
            throw new ParameterException(spec.commandLine(),
                    "Multiple pick exports found in " + input.toAbsolutePath() + ": " + candidates.stream()
                            .map(p -> p.getFileName().toString()).collect(Collectors.joining(", "))
                            + "; use --picks");
        }
        return candidates.get(0);
    }

    private static void logFindings(List<Finding> findings) {
        for (Finding finding : findings) {
            if (finding.isError()) {
                log.error("{} [{}] {}: {} (e.g. {})", finding.category(), finding.scope(), finding.description(),
                        finding.count(), finding.samples());
            } else {
                log.warn("{} [{}] {}: {} (e.g. {})", finding.category(), finding.scope(), finding.description(),
                        finding.count(), finding.samples());
            }
        }
    }

    /**
     * Debug-level trace of individual allocation decisions.
     */
    private static final class ProgressLogger implements AllocationObserver {

        @Override
        public void onAllocated(DemandEvent event, AllocationRecord record) {
            log.debug("Allocated article {} to {} ({})", record.article(), record.bayCode(), record.sizeClass());
        }

        @Override
        public void onOverflow(DemandEvent event, OverflowRecord record) {
            log.debug("Overflow: article {} in {} ({} exhausted)", record.article(), record.bayCode(),
                    record.sizeClass());
        }

        @Override
        public void onUnroutable(DemandEvent event) {
            log.debug("Unroutable location {} for article {}", event.locationCode(), event.article());
        }
    }
}
