package com.largomodo.bayalloc.service;

import com.largomodo.bayalloc.core.domain.ArticleRecord;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.InputDataset;
import com.largomodo.bayalloc.core.domain.LocationMasterRecord;
import com.largomodo.bayalloc.util.Decimals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the location master, article master and pick history from delimited exports.
 * <p>
 * Malformed rows are skipped with a warning naming the file and line; they never abort the run.
 * Rows outside the requested pick area are filtered silently and only counted.
 */
public class CsvInputReader implements InputReader {

    private static final Logger log = LoggerFactory.getLogger(CsvInputReader.class);

    static final String LOCATION = "Location";
    static final String AISLE = "Aisle";
    static final String BAY = "Bay";
    static final String AREA = "Area";
    static final String SLOT_TYPE = "Slot Type";
    static final String SLOT_TYPE_DESCRIPTION = "Slot Type Description";
    static final String LOCATION_CLASS = "Location Class";
    static final String WAREHOUSE = "Warehouse";

    static final String ARTICLE_NUMBER = "Artikelnummer";
    static final String ARTICLE_DESCRIPTION = "Artikeloms Verkoop";
    static final String LENGTH = "Lengte St Eenheid";
    static final String WIDTH = "Breedte St Eenheid";
    static final String HEIGHT = "Hoogte St Eenheid";
    static final String PICK_LOCATION = "Picklocatie";

    static final String LOCATION_CODE = "Locatiecode";
    static final String QUANTITY = "Aantal basiseenheden";
    static final String PICK_DATE_TIME = "Pick datumtijd";
    static final String DELIVERY_DATE = "Leverdatum";
    static final String ORDER_NUMBER = "Pickorder nummer";
    static final String ORDER_TYPE = "Ordertype";
    static final String ORDER_TYPE_ALT = "Order_type";

    private final CsvTableReader tableReader;

    public CsvInputReader() {
        this(new CsvTableReader());
    }

    public CsvInputReader(CsvTableReader tableReader) {
        if (tableReader == null) {
            throw new IllegalArgumentException("Table reader cannot be null");
        }
        this.tableReader = tableReader;
    }

    @Override
    public InputDataset read(InputSources sources) throws IOException {
        if (sources == null) {
            throw new IllegalArgumentException("Sources cannot be null");
        }
        List<LocationMasterRecord> locations = readLocations(sources);
        List<ArticleRecord> articles = readArticles(sources);
        List<DemandEvent> events = readDemand(sources);
        return new InputDataset(locations, articles, events);
    }

    List<LocationMasterRecord> readLocations(InputSources sources) throws IOException {
        CsvTable table = tableReader.read(sources.locations());
        table.requireColumns(LOCATION);

        List<LocationMasterRecord> records = new ArrayList<>();
        int skipped = 0;
        int filtered = 0;
        for (CsvTable.Row row : table.rows()) {
            String code = row.get(LOCATION);
            if (code.isEmpty()) {
                skipped++;
                warnSkip(table, row, "blank " + LOCATION);
                continue;
            }
            if (row.get(AISLE).isEmpty() && row.get(BAY).isEmpty()) {
                skipped++;
                warnSkip(table, row, "blank " + AISLE + " and " + BAY);
                continue;
            }
            String area = row.get(AREA);
            if (sources.hasAreaFilter() && !sources.area().equals(area)) {
                filtered++;
                continue;
            }
            records.add(new LocationMasterRecord(code, row.get(AISLE), row.get(BAY), area, row.get(SLOT_TYPE),
                    row.get(SLOT_TYPE_DESCRIPTION), row.get(LOCATION_CLASS), row.get(WAREHOUSE)));
        }
        logSummary(table, records.size(), skipped, filtered);
        return records;
    }

    List<ArticleRecord> readArticles(InputSources sources) throws IOException {
        CsvTable table = tableReader.read(sources.articles());
        table.requireColumns(ARTICLE_NUMBER);

        List<ArticleRecord> records = new ArrayList<>();
        int skipped = 0;
        for (CsvTable.Row row : table.rows()) {
            Long article = parseArticle(row.get(ARTICLE_NUMBER));
            if (article == null) {
                skipped++;
                warnSkip(table, row, "unparsable " + ARTICLE_NUMBER + " '" + row.get(ARTICLE_NUMBER) + "'");
                continue;
            }
            records.add(new ArticleRecord(article, row.get(ARTICLE_DESCRIPTION),
                    Decimals.parseEuropean(row.get(LENGTH)), Decimals.parseEuropean(row.get(WIDTH)),
                    Decimals.parseEuropean(row.get(HEIGHT)), row.get(PICK_LOCATION)));
        }
        logSummary(table, records.size(), skipped, 0);
        return records;
    }

    List<DemandEvent> readDemand(InputSources sources) throws IOException {
        CsvTable table = tableReader.read(sources.picks());
        table.requireColumns(ARTICLE_NUMBER, LOCATION_CODE);

        List<DemandEvent> events = new ArrayList<>();
        int skipped = 0;
        int filtered = 0;
        for (CsvTable.Row row : table.rows()) {
            Long article = parseArticle(row.get(ARTICLE_NUMBER));
            if (article == null) {
                skipped++;
                warnSkip(table, row, "unparsable " + ARTICLE_NUMBER + " '" + row.get(ARTICLE_NUMBER) + "'");
                continue;
            }
            String locationCode = row.get(LOCATION_CODE);
            if (locationCode.isEmpty()) {
                skipped++;
                warnSkip(table, row, "blank " + LOCATION_CODE);
                continue;
            }
            Integer quantity = parseQuantity(row.get(QUANTITY));
            if (quantity == null) {
                skipped++;
                warnSkip(table, row, "unparsable " + QUANTITY + " '" + row.get(QUANTITY) + "'");
                continue;
            }
            if (sources.hasAreaFilter() && !locationCode.startsWith(sources.area())) {
                filtered++;
                continue;
            }
            events.add(new DemandEvent(events.size(), article, locationCode, row.get(PICK_DATE_TIME),
                    row.get(DELIVERY_DATE), quantity, row.get(ORDER_NUMBER),
                    row.first(ORDER_TYPE, ORDER_TYPE_ALT)));
        }
        logSummary(table, events.size(), skipped, filtered);
        return events;
    }

    private static Long parseArticle(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Blank means one base unit; decimals like "2,0" are accepted when whole.
     */
    private static Integer parseQuantity(String value) {
        if (value.isEmpty()) {
            return 1;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            double parsed = Decimals.parseEuropean(value);
            if (parsed > 0 && parsed == Math.rint(parsed) && parsed <= Integer.MAX_VALUE) {
                return (int) parsed;
            }
            return null;
        }
    }

    private static void warnSkip(CsvTable table, CsvTable.Row row, String reason) {
        log.warn("Skipping {} line {}: {}", table.source().getFileName(), row.lineNumber(), reason);
    }

    private static void logSummary(CsvTable table, int kept, int skipped, int filtered) {
        log.info("Read {} rows from {} ({} skipped, {} outside area)", kept, table.source().getFileName(),
                skipped, filtered);
    }
}
