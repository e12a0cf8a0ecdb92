package com.tightzone.screener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the screener core: builds the request from a query, runs the
 * paginated scan and applies the VCP post-filter when the query asks for it.
 */
public class Screener {
    private static final Logger log = LogManager.getLogger(Screener.class);

    public static final int DEFAULT_PAGE_SIZE = 150;

    private final FilterBuilder filterBuilder;
    private final PaginatedScanner scanner;
    private final VcpQualifier qualifier;
    private final int pageSize;

    public Screener(ScannerTransport transport) {
        this(transport, DEFAULT_PAGE_SIZE);
    }

    public Screener(ScannerTransport transport, int pageSize) {
        this(new FilterBuilder(), new PaginatedScanner(transport), new VcpQualifier(), pageSize);
    }

    public Screener(FilterBuilder filterBuilder, PaginatedScanner scanner, VcpQualifier qualifier, int pageSize) {
        this.filterBuilder = filterBuilder;
        this.scanner = scanner;
        this.qualifier = qualifier;
        this.pageSize = pageSize;
    }

    public int pageSize() {
        return pageSize;
    }

    public ScreenerRequest request(ScreenerQuery query, int start, int end) {
        return filterBuilder.build(query, start, end);
    }

    /**
     * Request body for the given range, without any network access.
     */
    public JSONObject payload(ScreenerQuery query, int start, int end) {
        return request(query, start, end).toPayload();
    }

    public List<ScreenerRow> scan(ScreenerQuery query) {
        return scan(query, null);
    }

    public List<ScreenerRow> scan(ScreenerQuery query, ScanCancellation cancellation) {
        ScreenerRequest template = filterBuilder.build(query, 0, pageSize - 1);
        List<ScreenerRow> rows = scanner.scan(template, pageSize, cancellation);
        if (!query.isApplyVcpFilter()) {
            return rows;
        }
        List<ScreenerRow> out = new ArrayList<>();
        for (ScreenerRow row : rows) {
            VcpDecision decision = qualifier.evaluate(row);
            if (decision.passed) {
                out.add(row);
            } else {
                log.debug("{} dropped by VCP rule {}", row.symbol(), decision.failedRule);
            }
        }
        log.info("VCP filter kept {} of {} rows", out.size(), rows.size());
        return out;
    }
}
