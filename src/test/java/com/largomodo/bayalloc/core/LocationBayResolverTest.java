package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.ArticleRecord;
import com.largomodo.bayalloc.core.domain.Finding;
import com.largomodo.bayalloc.core.domain.Location;
import com.largomodo.bayalloc.core.domain.LocationAudit;
import com.largomodo.bayalloc.core.domain.LocationMapping;
import com.largomodo.bayalloc.core.domain.LocationMasterRecord;
import com.largomodo.bayalloc.core.domain.Provenance;
import com.largomodo.bayalloc.core.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.largomodo.bayalloc.core.Fixtures.event;
import static com.largomodo.bayalloc.core.Fixtures.master;
import static org.junit.jupiter.api.Assertions.*;

class LocationBayResolverTest {

    private LocationBayResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new LocationBayResolver();
    }

    @Test
    void testSeedsFromMaster() {
        List<LocationMasterRecord> masters = List.of(
                master("D11-021-11", "11", "021", "PP3"),
                master("D11-021-12", "11", "021", "BLL"));

        LocationMapping mapping = resolver.resolve(masters, List.of(), List.of());

        assertEquals(2, mapping.size());
        Location first = mapping.resolve("D11-021-11").orElseThrow();
        assertEquals("11-021", first.bayCode());
        assertEquals(SizeClass.SMALL, first.sizeClass());
        assertEquals(Provenance.FROM_MASTER, first.provenance());
        assertEquals(SizeClass.MEDIUM, mapping.resolve("D11-021-12").orElseThrow().sizeClass());
        assertTrue(mapping.findings().isEmpty());
    }

    @Test
    void testSynthesizesMissingDemandLocation() {
        LocationMapping mapping = resolver.resolve(List.of(), List.of(),
                List.of(event(0, 100, "Z99-14-02", "01-07-2025 08:00")));

        Location synthesized = mapping.resolve("Z99-14-02").orElseThrow();
        assertEquals("Z99-14", synthesized.bayCode());
        assertEquals(SizeClass.LARGE, synthesized.sizeClass());
        assertTrue(synthesized.isSynthesized());
        assertEquals(1, mapping.synthesizedCount());
    }

    @Test
    void testSynthesisIsIdempotent() {
        LocationMapping mapping = resolver.resolve(List.of(), List.of(), List.of(
                event(0, 100, "Z99-14-02", ""),
                event(1, 101, "Z99-14-02", ""),
                event(2, 102, "Z99-14-02", "")));

        assertEquals(1, mapping.size(), "Same missing code must synthesize exactly one location");
        LocationAudit audit = mapping.audit().get(0);
        assertEquals(3, audit.pickCount());
        assertTrue(audit.inPicks());
        assertFalse(audit.inLocations());
    }

    @Test
    void testCodeWithoutSeparatorIsUnresolvable() {
        LocationMapping mapping = resolver.resolve(List.of(), List.of(), List.of(
                event(0, 100, "BULKAREA", ""),
                event(1, 101, "BULKAREA", "")));

        assertEquals(0, mapping.size());
        assertTrue(mapping.resolve("BULKAREA").isEmpty());
        assertEquals(List.of("BULKAREA"), mapping.unresolvableCodes());
    }

    @Test
    void testArticleCrossCheckReportsButDoesNotCreate() {
        List<LocationMasterRecord> masters = List.of(master("D11-021-11", "11", "021", "PP3"));
        List<ArticleRecord> articles = List.of(
                new ArticleRecord(500, "Known", 1, 1, 1, "D11-021-11"),
                new ArticleRecord(501, "Unknown", 1, 1, 1, "D77-001-01"),
                new ArticleRecord(502, "No location", 1, 1, 1, ""));

        LocationMapping mapping = resolver.resolve(masters, articles, List.of());

        assertEquals(1, mapping.size(), "Article references never create entries");
        assertTrue(mapping.audit().get(0).inArticles());

        assertEquals(1, mapping.findings().size());
        Finding finding = mapping.findings().get(0);
        assertEquals("Article", finding.scope());
        assertEquals(Severity.WARNING, finding.severity());
        assertEquals("Unknown Article Pick Location", finding.category());
        assertEquals(1, finding.count());
        assertEquals(List.of("501→D77-001-01"), finding.samples());
    }

    @Test
    void testDuplicateMasterCodesKeepFirstRow() {
        List<LocationMasterRecord> masters = List.of(
                master("D11-021-11", "11", "021", "PP3"),
                master(" D11-021-11 ", "11", "021", "BLH"));

        LocationMapping mapping = resolver.resolve(masters, List.of(), List.of());

        assertEquals(1, mapping.size());
        assertEquals(SizeClass.SMALL, mapping.resolve("D11-021-11").orElseThrow().sizeClass());
        Finding finding = mapping.findings().get(0);
        assertEquals("Duplicate Master Location", finding.category());
        assertEquals(Severity.WARNING, finding.severity());
        assertEquals(List.of("D11-021-11"), finding.samples());
    }

    @Test
    void testMasterOrderPrecedesSynthesisOrder() {
        List<LocationMasterRecord> masters = List.of(master("D11-021-11", "11", "021", "PP3"));

        LocationMapping mapping = resolver.resolve(masters, List.of(), List.of(
                event(0, 1, "Z99-14-02", ""),
                event(1, 2, "D11-021-11", ""),
                event(2, 3, "Z98-01-01", "")));

        assertEquals(List.of("D11-021-11", "Z99-14-02", "Z98-01-01"),
                List.copyOf(mapping.locations().keySet()));
        LocationAudit masterAudit = mapping.audit().get(0);
        assertTrue(masterAudit.inLocations());
        assertTrue(masterAudit.inPicks());
        assertEquals(1, masterAudit.pickCount());
    }

    @Test
    void testNullArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(null, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(List.of(), null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(List.of(), List.of(), null));
    }
}
