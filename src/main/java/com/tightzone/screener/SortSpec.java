package com.tightzone.screener;

import com.tightzone.core.ScreenerException;
import org.json.JSONObject;

import java.util.Locale;

public final class SortSpec {
    public enum Order {
        ASC, DESC
    }

    public final String sortBy;
    public final Order order;

    public SortSpec(String sortBy, Order order) {
        if (sortBy == null || sortBy.trim().isEmpty()) {
            throw ScreenerException.invalidInput("sort column must not be empty");
        }
        this.sortBy = sortBy.trim();
        this.order = order == null ? Order.DESC : order;
    }

    public static SortSpec desc(String sortBy) {
        return new SortSpec(sortBy, Order.DESC);
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("sortBy", sortBy)
                .put("sortOrder", order.name().toLowerCase(Locale.ROOT));
    }
}
