package com.tightzone.news;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class NewsItem {
    public final String title;
    public final String url;
    public final String publisher;
    public final String summary;
    public final Instant publishedAt;

    public NewsItem(String title, String url, String publisher, String summary, Instant publishedAt) {
        this.title = title;
        this.url = url;
        this.publisher = publisher == null || publisher.isBlank() ? NewsFetcher.UNKNOWN_PUBLISHER : publisher;
        this.summary = summary == null ? "" : summary;
        this.publishedAt = publishedAt;
    }

    /**
     * Ordered map form, as stored on a screener row.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("title", title);
        out.put("url", url);
        out.put("publisher", publisher);
        out.put("summary", summary);
        out.put("publishedAt", publishedAt == null ? "" : publishedAt.toString());
        return out;
    }
}
