package com.ruian.validation;

import com.ruian.entity.EmployeeWorklog;
import com.ruian.entity.ProductionInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.ruian.validation.ValidationFixtures.UPLOADED;
import static com.ruian.validation.ValidationFixtures.production;
import static com.ruian.validation.ValidationFixtures.worklog;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProductionOrderLookup Unit Tests")
class ProductionOrderLookupTest {

    @Test
    @DisplayName("match should find the single row for an order and job type")
    void testMatch_SingleCandidate() {
        ProductionInfo row = production("2516572", "钝化", 500);
        ProductionOrderLookup lookup = ProductionOrderLookup.of(List.of(row, production("2516572", "烧结", 300)));

        Optional<ProductionInfo> match = lookup.match(worklog("2516572", "024", 50));

        assertTrue(match.isPresent());
        assertSame(row, match.get());
    }

    @Test
    @DisplayName("match should return empty for an unknown order or job type")
    void testMatch_NoCandidate() {
        ProductionOrderLookup lookup = ProductionOrderLookup.of(List.of(production("2516572", "钝化", 500)));

        assertTrue(lookup.match(worklog("9999999", "024", 50)).isEmpty());
        assertTrue(lookup.match(worklog("2516572", "024", "烧结", 50, "1.20", UPLOADED)).isEmpty());
    }

    @Test
    @DisplayName("keys should be compared after trimming")
    void testMatch_Trimmed() {
        ProductionOrderLookup lookup = ProductionOrderLookup.of(List.of(production(" 2516572 ", "钝化 ", 500)));

        assertTrue(lookup.match(worklog("2516572", "024", 50)).isPresent());
    }

    @Test
    @DisplayName("re-uploads of the same sheet line should collapse to the latest upload")
    void testOf_CollapsesReUploads() {
        ProductionInfo older = production("2516572", "W/mG000-AMP", "B1", 100, "钝化", UPLOADED);
        ProductionInfo newer = production("2516572", "W/mG000-AMP", "B1", 120, "钝化", UPLOADED.plusDays(3));

        ProductionOrderLookup lookup = ProductionOrderLookup.of(List.of(newer, older));

        assertEquals(List.of(newer), lookup.candidates("2516572", "钝化"));
        assertSame(newer, lookup.match(worklog("2516572", "024", 10)).orElseThrow());
        assertEquals(120, lookup.quota("2516572", "钝化"));
    }

    @Test
    @DisplayName("several model/brand variants should be narrowed by the worklog's model and brand")
    void testMatch_Variants() {
        ProductionInfo first = production("2516572", "M-1", "B1", 100, "钝化", UPLOADED);
        ProductionInfo second = production("2516572", "M-2", "B2", 200, "钝化", UPLOADED);
        ProductionOrderLookup lookup = ProductionOrderLookup.of(List.of(first, second));

        EmployeeWorklog withoutModel = worklog("2516572", "024", 10);
        EmployeeWorklog withModel = worklog("2516572", "024", 10);
        withModel.setModel("M-2");
        EmployeeWorklog withBrand = worklog("2516572", "024", 10);
        withBrand.setBrandNo("B1");

        assertTrue(lookup.match(withoutModel).isEmpty(), "ambiguous match must not pick a row");
        assertSame(second, lookup.match(withModel).orElseThrow());
        assertSame(first, lookup.match(withBrand).orElseThrow());
        assertEquals(300, lookup.quota("2516572", "钝化"));
    }

    @Test
    @DisplayName("quota should be zero and candidates empty for unknown pairs")
    void testQuota_Unknown() {
        ProductionOrderLookup lookup = ProductionOrderLookup.of(List.of());

        assertEquals(0, lookup.quota("2516572", "钝化"));
        assertTrue(lookup.candidates("2516572", "钝化").isEmpty());
    }
}
