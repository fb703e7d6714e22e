package io.twsecodes.codes.schema;

import io.twsecodes.codes.error.UnrecognizedCategoryException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategoryFilterTest {
    @Test
    void parsesAllAndCategoryNamesCaseInsensitively() {
        assertInstanceOf(CategoryFilter.All.class, CategoryFilter.parse("ALL"));
        assertInstanceOf(CategoryFilter.All.class, CategoryFilter.parse("all"));
        assertEquals(CategoryFilter.of(CodesCategory.ETF), CategoryFilter.parse("etf"));
        assertEquals(CategoryFilter.of(CodesCategory.SPECIAL_STOCK), CategoryFilter.parse(" SPECIAL_STOCK "));
    }

    @Test
    void unknownCategoryIsAUsageError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CategoryFilter.parse("BOND"));
        assertTrue(e.getMessage().contains("BOND"));
        assertThrows(IllegalArgumentException.class, () -> CategoryFilter.parse(""));
        assertThrows(IllegalArgumentException.class, () -> CategoryFilter.parse(null));
    }

    @Test
    void keysNameCacheFiles() {
        assertEquals("all", CategoryFilter.all().key());
        assertEquals("special_stock", CategoryFilter.of(CodesCategory.SPECIAL_STOCK).key());
        assertEquals("otc_warrant", CategoryFilter.of(CodesCategory.OTC_WARRANT).key());
    }

    @Test
    void categoryLabelsResolveBothWays() throws Exception {
        assertEquals(CodesCategory.STOCK, CodesCategory.fromLabel("股票"));
        assertEquals(CodesCategory.TDR, CodesCategory.fromLabel(" 臺灣存託憑證(TDR) "));
        assertEquals("受益證券-不動產投資信託", CodesCategory.REIT.label());
        UnrecognizedCategoryException e = assertThrows(UnrecognizedCategoryException.class, () -> CodesCategory.fromLabel("債券"));
        assertEquals("債券", e.label());
    }

    @Test
    void columnsKeepTheirFixedOrder() {
        assertEquals(List.of("sc", "cn", "ca", "ic", "dl", "ma", "si", "cc", "no"), DataColumn.shortNames());
        assertEquals(DataColumn.CFI_CODE, DataColumn.fromShortName("cc").orElseThrow());
        assertEquals(DataColumn.DATE_OF_LISTING, DataColumn.fromLabel("上市日").orElseThrow());
        assertTrue(DataColumn.fromShortName("zz").isEmpty());
        assertEquals("代號", DataColumn.labels().get(0));
    }
}
