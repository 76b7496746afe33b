package com.largomodo.bayalloc.service;

import com.largomodo.bayalloc.core.PipelineResult;
import com.largomodo.bayalloc.core.SizeClass;
import com.largomodo.bayalloc.core.domain.AllocationRecord;
import com.largomodo.bayalloc.core.domain.ArticleRecord;
import com.largomodo.bayalloc.core.domain.Bay;
import com.largomodo.bayalloc.core.domain.BayPick;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.Finding;
import com.largomodo.bayalloc.core.domain.InputDataset;
import com.largomodo.bayalloc.core.domain.Location;
import com.largomodo.bayalloc.core.domain.LocationAudit;
import com.largomodo.bayalloc.core.domain.OverflowRecord;
import com.largomodo.bayalloc.util.Decimals;
import com.largomodo.bayalloc.util.OutputNaming;
import com.largomodo.bayalloc.util.PickDates;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes the report set as semicolon-delimited files with European decimal commas.
 * <p>
 * Files land in {@code outputRoot/<descriptive name>/}; an existing report of the same name is
 * overwritten file by file.
 */
public class CsvReportWriter implements ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    static final String PICK_FILE = "Pick.csv";
    static final String LOCATION_FILE = "Location.csv";
    static final String ARTICLE_LOCATION_FILE = "ArticleLocation.csv";
    static final String OVERFLOW_FILE = "Overflow.csv";
    static final String LOCATION_MAPPING_FILE = "LocationMapping.csv";
    static final String DATASET_INFO_FILE = "DatasetInfo.csv";
    static final String BAY_ANALYSIS_FILE = "BayAnalysis.csv";
    static final String VALIDATION_REPORT_FILE = "ValidationReport.csv";

    static final int TOP_PATTERNS = 20;

    static final CSVFormat REPORT_FORMAT = CSVFormat.DEFAULT.withDelimiter(';').withRecordSeparator('\n');

    private final Clock clock;

    public CsvReportWriter() {
        this(Clock.systemDefaultZone());
    }

    public CsvReportWriter(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Path write(PipelineResult result, InputDataset dataset, Path outputRoot) throws IOException {
        if (result == null || dataset == null || outputRoot == null) {
            throw new IllegalArgumentException("Result, dataset and output root cannot be null");
        }

        List<LocalDate> dates = parseableDates(result.consideredEvents());
        Path reportDir = outputRoot.resolve(OutputNaming.describe(dates, result.consideredEvents().size()));
        Files.createDirectories(reportDir);

        Map<Long, ArticleRecord> articles = new HashMap<>();
        for (ArticleRecord article : dataset.articles()) {
            articles.putIfAbsent(article.article(), article);
        }

        writePicks(reportDir.resolve(PICK_FILE), result.bayPicks());
        writeBays(reportDir.resolve(LOCATION_FILE), result.bays());
        writeAssignments(reportDir.resolve(ARTICLE_LOCATION_FILE), result, articles);
        writeOverflow(reportDir.resolve(OVERFLOW_FILE), result.allocation().overflows());
        writeMapping(reportDir.resolve(LOCATION_MAPPING_FILE), result.mapping().audit());
        writeDatasetInfo(reportDir.resolve(DATASET_INFO_FILE), result, dataset, dates);
        writeBayAnalysis(reportDir.resolve(BAY_ANALYSIS_FILE), result.bays());
        writeFindings(reportDir.resolve(VALIDATION_REPORT_FILE), result.report().findings());

        log.info("Report written to {}", reportDir);
        return reportDir;
    }

    private void writePicks(Path file, List<BayPick> picks) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        for (BayPick pick : picks) {
            rows.add(List.of(
                    String.valueOf(pick.pickList()),
                    pick.bayCode(),
                    String.valueOf(pick.article()),
                    String.valueOf(pick.quantity()),
                    pick.pickDate(),
                    pick.salesOrder(),
                    pick.salesOrderCategory(),
                    pick.originalLocation()));
        }
        writeTable(file, List.of("pickList", "location", "article", "quantity", "pickDate", "salesOrder",
                "salesOrderCategory", "originalLocation"), rows);
    }

    private void writeBays(Path file, Map<String, Bay> bays) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        for (Bay bay : bays.values()) {
            rows.add(List.of(
                    bay.code(),
                    String.valueOf(bay.isEvenZone()),
                    renderLayout(bay.capacityLayout()),
                    bay.code(),
                    bay.compositionSignature(),
                    String.valueOf(bay.slotCount())));
        }
        writeTable(file, List.of("location", "zone", "capacityLayout", "locationGroup", "composition",
                "totalSlots"), rows);
    }

    private void writeAssignments(Path file, PipelineResult result, Map<Long, ArticleRecord> articles)
            throws IOException {
        List<List<String>> rows = new ArrayList<>();
        for (AllocationRecord record : result.allocation().allocations()) {
            Optional<ArticleRecord> article = Optional.ofNullable(articles.get(record.article()));
            Bay bay = result.bays().get(record.bayCode());
            boolean caseLocation = bay != null && "C".equals(bay.locationClass());
            boolean synthetic = bay != null && bay.isSynthesized();
            rows.add(List.of(
                    String.valueOf(record.article()),
                    record.bayCode(),
                    article.map(ArticleRecord::description).orElse(""),
                    String.valueOf(article.map(ArticleRecord::volume).orElse(0L)),
                    weight(record.sizeClass()),
                    record.bayCode(),
                    caseLocation ? "C" : "R",
                    article.isPresent() ? "" : "NO_MASTER_DATA",
                    synthetic ? "SYNTHETIC_BAY" : "",
                    record.sourceLocation()));
        }
        writeTable(file, List.of("article", "location", "description", "volume", "locationSize",
                "locationGroup", "remarkOne", "remarkTwo", "remarkThree", "originalPickLocation"), rows);
    }

    private void writeOverflow(Path file, List<OverflowRecord> overflows) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        for (OverflowRecord record : overflows) {
            rows.add(List.of(
                    String.valueOf(record.article()),
                    record.bayCode(),
                    weight(record.sizeClass()),
                    record.sourceLocation(),
                    record.timestamp(),
                    OverflowRecord.REASON));
        }
        writeTable(file, List.of("article", "location", "locationSize", "pickLocation", "pickTimestamp",
                "reason"), rows);
    }

    private void writeMapping(Path file, List<LocationAudit> audit) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        for (LocationAudit entry : audit) {
            Location location = entry.location();
            rows.add(List.of(
                    location.code(),
                    location.bayCode(),
                    location.slotType(),
                    location.slotTypeDescription(),
                    location.provenance().name(),
                    String.valueOf(entry.inLocations()),
                    String.valueOf(entry.inArticles()),
                    String.valueOf(entry.inPicks()),
                    String.valueOf(entry.pickCount())));
        }
        writeTable(file, List.of("originalLocation", "bay", "slotType", "slotTypeDescription", "provenance",
                "inLocations", "inArticles", "inPicks", "pickCount"), rows);
    }

    private void writeDatasetInfo(Path file, PipelineResult result, InputDataset dataset, List<LocalDate> dates)
            throws IOException {
        Optional<LocalDate> first = dates.stream().min(Comparator.naturalOrder());
        Optional<LocalDate> last = dates.stream().max(Comparator.naturalOrder());

        Map<String, String> metrics = new LinkedHashMap<>();
        metrics.put("Demand events read", String.valueOf(result.totalEvents()));
        metrics.put("Demand events considered", String.valueOf(result.consideredEvents().size()));
        metrics.put("Bay-level picks", String.valueOf(result.bayPicks().size()));
        metrics.put("Bays", String.valueOf(result.bays().size()));
        metrics.put("Locations", String.valueOf(result.mapping().size()));
        metrics.put("Synthesized locations", String.valueOf(result.mapping().synthesizedCount()));
        metrics.put("Articles in master", String.valueOf(dataset.articles().size()));
        metrics.put("Assignments", String.valueOf(result.allocation().allocations().size()));
        metrics.put("Overflows", String.valueOf(result.allocation().overflows().size()));
        for (SizeClass sizeClass : SizeClass.values()) {
            int available = result.bays().values().stream().mapToInt(bay -> bay.available(sizeClass)).sum();
            metrics.put("Slots used " + weight(sizeClass),
                    result.allocation().usage().totalUsed(sizeClass) + "/" + available);
        }
        metrics.put("Date range start", first.map(CsvReportWriter::formatDate).orElse(""));
        metrics.put("Date range end", last.map(CsvReportWriter::formatDate).orElse(""));
        metrics.put("Transformation date", formatDate(LocalDate.now(clock)));

        List<List<String>> rows = new ArrayList<>();
        metrics.forEach((metric, value) -> rows.add(List.of(metric, value)));
        writeTable(file, List.of("metric", "value"), rows);
    }

    private void writeBayAnalysis(Path file, Map<String, Bay> bays) throws IOException {
        Map<String, Long> patternCounts = bays.values().stream()
                .collect(Collectors.groupingBy(Bay::compositionSignature, LinkedHashMap::new, Collectors.counting()));

        List<List<String>> rows = new ArrayList<>();
        patternCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(TOP_PATTERNS)
                .forEach(e -> rows.add(List.of(e.getKey(), String.valueOf(e.getValue()))));
        writeTable(file, List.of("composition", "bayCount"), rows);
    }

    private void writeFindings(Path file, List<Finding> findings) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        for (Finding finding : findings) {
            rows.add(List.of(
                    finding.scope(),
                    finding.severity().name(),
                    finding.category(),
                    finding.description(),
                    String.valueOf(finding.count()),
                    String.join(", ", finding.samples())));
        }
        writeTable(file, List.of("scope", "severity", "category", "description", "count", "samples"), rows);
    }

    private static void writeTable(Path file, List<String> header, List<List<String>> rows) throws IOException {
        try (CSVPrinter printer = new CSVPrinter(Files.newBufferedWriter(file, StandardCharsets.UTF_8),
                REPORT_FORMAT)) {
            printer.printRecord(header);
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }

    /**
     * Layout as weights joined by '-': "0,25-0,25-0,50". Invalid elements render empty.
     */
    static String renderLayout(List<SizeClass> layout) {
        return layout.stream().map(CsvReportWriter::weight).collect(Collectors.joining("-"));
    }

    private static String weight(SizeClass sizeClass) {
        return sizeClass == null ? "" : Decimals.formatWeight(sizeClass.getWeight());
    }

    private static String formatDate(LocalDate date) {
        return date.getDayOfMonth() + "-" + date.getMonthValue() + "-" + date.getYear();
    }

    private static List<LocalDate> parseableDates(List<DemandEvent> events) {
        return events.stream()
                .map(event -> PickDates.parse(event.dateSource()).orElse(null))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }
}
