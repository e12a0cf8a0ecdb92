package com.tightzone.screener;

import com.tightzone.core.ScreenerException;
import com.tightzone.data.http.HttpClientEx;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * 模块说明：TradingViewScannerTransport（class）。
 * 主要职责：把扫描请求体 POST 到 {market}/scan 端点，并把响应正文解析为 JSON 对象。
 * 使用建议：端点模板中的 %s 由市场标识替换；测试中可直接用 lambda 替代本类。
 */
public final class TradingViewScannerTransport implements ScannerTransport {
    public static final String DEFAULT_ENDPOINT = "https://scanner.tradingview.com/%s/scan";

    private final HttpClientEx http;
    private final String endpointTemplate;
    private final int timeoutSec;

    public TradingViewScannerTransport(HttpClientEx http, String endpointTemplate, int timeoutSec) {
        this.http = http;
        this.endpointTemplate = endpointTemplate == null || endpointTemplate.isBlank()
                ? DEFAULT_ENDPOINT
                : endpointTemplate.trim();
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    public String endpointFor(String market) {
        return endpointTemplate.contains("%s") ? String.format(endpointTemplate, market) : endpointTemplate;
    }

    @Override
    public JSONObject submit(ScreenerRequest request) {
        String body = http.postJson(endpointFor(request.market), request.toPayload().toString(), timeoutSec);
        if (body == null || body.isBlank()) {
            throw ScreenerException.decode("empty scanner response");
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw ScreenerException.decode("scanner response is not a JSON object: " + e.getMessage(), e);
        }
    }
}
