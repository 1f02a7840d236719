package com.suitemender.core.coverage;

import com.suitemender.core.source.SourceUnit;
import com.suitemender.core.source.Symbol;
import com.suitemender.core.source.SymbolIndex;
import com.suitemender.core.source.SymbolKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class CoverageGapMapperTest {

    private final CoverageReportParser parser = new CoverageReportParser();
    private final CoverageGapMapper    mapper = new CoverageGapMapper();

    @Test
    void testIntersectsSymbolRangesWithUncoveredLines() throws Exception {
        Symbol placeOrder = new Symbol("place_order", "app/orders.py", SymbolKind.FUNCTION, 10, 20, 2, false, null, 0);
        Symbol cancel     = new Symbol("cancel",      "app/orders.py", SymbolKind.FUNCTION, 22, 25, 1, false, null, 0);
        SymbolIndex index = indexOf(List.of(placeOrder, cancel));

        List<GapRecord> gaps = mapper.mapGaps(index, parser.parse(CoverageReportParserTest.REPORT));

        assertEquals(1, gaps.size(), "a symbol without uncovered lines has no gap");
        assertEquals("place_order", gaps.get(0).getSymbol().getName());
        assertEquals(List.of(14, 15, 16), List.copyOf(gaps.get(0).getUncoveredLines()));
        assertEquals("14-16", gaps.get(0).describeLines());
    }

    @Test
    void testNestedSymbolsAreEvaluatedIndependently() throws Exception {
        Symbol service = new Symbol("OrderService", "app/orders.py", SymbolKind.CLASS, 9, 20, 0, false, null, 0);
        Symbol method  = new Symbol("submit", "app/orders.py", SymbolKind.METHOD, 13, 16, 1, false, "OrderService", 1);

        List<GapRecord> gaps = mapper.mapGaps(indexOf(List.of(service, method)), parser.parse(CoverageReportParserTest.REPORT));

        assertEquals(2, gaps.size());
        assertEquals(gaps.get(0).getUncoveredLines(), gaps.get(1).getUncoveredLines());
    }

    @Test
    void testFilesMissingFromReportHaveNoGaps() throws Exception {
        Symbol other = new Symbol("pay", "app/payments.py", SymbolKind.FUNCTION, 1, 40, 0, false, null, 0);

        assertTrue(mapper.mapGaps(indexOf(List.of(other)), parser.parse(CoverageReportParserTest.REPORT)).isEmpty());
    }

    @Test
    void testDescribeLinesRendersRuns() {
        Symbol symbol = new Symbol("f", "a.py", SymbolKind.FUNCTION, 1, 30, 0, false, null, 0);

        GapRecord gap = new GapRecord(symbol, new TreeSet<>(List.of(14, 15, 16, 20, 22, 23)));

        assertEquals("14-16, 20, 22-23", gap.describeLines());
    }

    @Test
    void testGapRecordRequiresLines() {
        Symbol symbol = new Symbol("f", "a.py", SymbolKind.FUNCTION, 1, 30, 0, false, null, 0);

        assertThrows(IllegalArgumentException.class, () -> new GapRecord(symbol, new TreeSet<>()));
    }

    private static SymbolIndex indexOf(List<Symbol> symbols) {
        SourceUnit unit = new SourceUnit(symbols.get(0).getFile(), "", symbols);
        return new SymbolIndex(List.of(unit), List.of(), Map.of());
    }
}
