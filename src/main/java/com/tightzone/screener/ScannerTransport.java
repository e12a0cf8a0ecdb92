package com.tightzone.screener;

import org.json.JSONObject;

/**
 * One request/response exchange with the scanner provider.
 * Implementations throw {@link com.tightzone.core.ScreenerException} on
 * network or body-format problems.
 */
@FunctionalInterface
public interface ScannerTransport {
    JSONObject submit(ScreenerRequest request);
}
