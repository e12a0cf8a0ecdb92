package com.tightzone.screener;

import com.tightzone.core.ScreenerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：PaginatedScanner（class）。
 * 主要职责：按页请求扫描结果并累积行，直到某页返回的行数少于页大小。
 * 使用建议：实例无共享可变状态，可被多个线程并发调用；任一页失败时整次扫描失败，已累积的行被丢弃。
 */
public final class PaginatedScanner {
    private static final Logger log = LogManager.getLogger(PaginatedScanner.class);

    private final ScannerTransport transport;
    private final ScreenerResponseParser parser;

    public PaginatedScanner(ScannerTransport transport) {
        this(transport, new ScreenerResponseParser());
    }

    public PaginatedScanner(ScannerTransport transport, ScreenerResponseParser parser) {
        this.transport = transport;
        this.parser = parser == null ? new ScreenerResponseParser() : parser;
    }

    public List<ScreenerRow> scan(ScreenerRequest template, int pageSize) {
        return scan(template, pageSize, null);
    }

/**
 * 方法说明：scan，负责执行完整的分页扫描。
 * 处理流程：每页请求前检查取消标记与线程中断；每页用响应自带的列名装配行；短页即结束。
 */
    public List<ScreenerRow> scan(ScreenerRequest template, int pageSize, ScanCancellation cancellation) {
        if (pageSize < 1) {
            throw ScreenerException.invalidInput("page size must be at least 1, got " + pageSize);
        }
        if (template == null) {
            throw ScreenerException.invalidInput("missing scan request");
        }
        List<ScreenerRow> rows = new ArrayList<>();
        int offset = 0;
        int pages = 0;
        while (true) {
            if ((cancellation != null && cancellation.isCancelled()) || Thread.currentThread().isInterrupted()) {
                log.info("scan of {} cancelled after {} page(s)", template.market, pages);
                throw ScreenerException.cancelled("scan cancelled after " + pages + " page(s)");
            }
            ScreenerRequest page = template.withRange(offset, offset + pageSize - 1);
            JSONObject response = transport.submit(page);
            List<ScreenerRow> pageRows = parser.parse(response, page.columns);
            pages++;
            rows.addAll(pageRows);
            log.debug("page {} of {}: range={} rows={}", pages, template.market, page.range, pageRows.size());
            if (pageRows.size() < pageSize) {
                break;
            }
            offset += pageSize;
        }
        log.info("scan of {} done: pages={} rows={}", template.market, pages, rows.size());
        return rows;
    }
}
