package com.tightzone.screener;

import com.tightzone.core.FailureKind;
import com.tightzone.core.ScreenerException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketSlugsTest {

    @Test
    void normalizeShouldMapUsAliasesToAmerica() {
        assertEquals("america", MarketSlugs.normalize("US"));
        assertEquals("america", MarketSlugs.normalize(" usa "));
        assertEquals("america", MarketSlugs.normalize("United States"));
        assertEquals("america", MarketSlugs.normalize("America"));
    }

    @Test
    void normalizeShouldPassThroughUnknownMarkets() {
        assertEquals("japan", MarketSlugs.normalize("Japan"));
        assertEquals("crypto", MarketSlugs.normalize("CRYPTO"));
    }

    @Test
    void normalizeShouldRejectBlankMarket() {
        ScreenerException e = assertThrows(ScreenerException.class, () -> MarketSlugs.normalize("   "));
        assertEquals(FailureKind.INVALID_INPUT, e.kind());
        assertThrows(ScreenerException.class, () -> MarketSlugs.normalize(null));
    }

    @Test
    void defaultSymbolTypesShouldFollowMarket() {
        assertEquals(List.of("stock"), MarketSlugs.defaultSymbolTypes("america"));
        assertEquals(List.of("bond"), MarketSlugs.defaultSymbolTypes("bonds"));
        assertEquals(List.of("crypto"), MarketSlugs.defaultSymbolTypes("crypto"));
        assertTrue(MarketSlugs.defaultSymbolTypes("japan").isEmpty());
    }

    @Test
    void resolveSymbolTypesShouldDistinguishAbsentFromEmptyOverride() {
        assertEquals(List.of("stock"), MarketSlugs.resolveSymbolTypes("america", Optional.empty()));
        assertEquals(List.of(), MarketSlugs.resolveSymbolTypes("america", Optional.of(List.of())));
        assertEquals(List.of("stock", "etf"), MarketSlugs.resolveSymbolTypes("america", Optional.of(List.of("stock", "etf"))));
        assertEquals(List.of("stock"), MarketSlugs.resolveSymbolTypes("america", Optional.of(List.of("stock", "", "  "))));
    }
}
