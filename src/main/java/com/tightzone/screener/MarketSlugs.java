package com.tightzone.screener;

import com.tightzone.core.ScreenerException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class MarketSlugs {
    private static final Map<String, String> ALIASES = Map.of(
            "us", "america",
            "usa", "america",
            "unitedstates", "america"
    );
    private static final Map<String, List<String>> DEFAULT_TYPES = Map.of(
            "america", List.of("stock"),
            "crypto", List.of("crypto"),
            "forex", List.of("forex"),
            "cfd", List.of("cfd"),
            "futures", List.of("futures"),
            "bonds", List.of("bond")
    );

    private MarketSlugs() {
    }

    public static String normalize(String market) {
        String slug = market == null ? "" : market.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        if (slug.isEmpty()) {
            throw ScreenerException.invalidInput("market must not be empty");
        }
        return ALIASES.getOrDefault(slug, slug);
    }

    public static List<String> defaultSymbolTypes(String slug) {
        if (slug == null) {
            return List.of();
        }
        return DEFAULT_TYPES.getOrDefault(slug, List.of());
    }

    /**
     * An absent override means the market defaults; a present one replaces them,
     * blank entries dropped, so an explicit empty list stays empty.
     */
    public static List<String> resolveSymbolTypes(String slug, Optional<List<String>> override) {
        if (override == null || override.isEmpty()) {
            return defaultSymbolTypes(slug);
        }
        List<String> out = new ArrayList<>();
        for (String type : override.get()) {
            if (type != null && !type.trim().isEmpty()) {
                out.add(type.trim());
            }
        }
        return List.copyOf(out);
    }
}
