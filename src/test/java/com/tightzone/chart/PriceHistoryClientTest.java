package com.tightzone.chart;

import com.tightzone.core.FailureKind;
import com.tightzone.core.ScreenerException;
import com.tightzone.data.http.HttpClientEx;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PriceHistoryClientTest {

    private static final String BODY = "{\"chart\":{\"result\":[{"
            + "\"timestamp\":[1700000000,1700086400,1700172800,1700259200],"
            + "\"indicators\":{\"quote\":[{"
            + "\"close\":[10.5,null,11.25,12.0],"
            + "\"volume\":[1000,2000,null]}]}}]}}";

    @Test
    void fetchShouldStripExchangePrefixAndParseBars() {
        RecordingHttp http = new RecordingHttp(BODY);
        PriceHistoryClient client = new PriceHistoryClient(http);

        List<PriceBar> bars = client.fetch("NASDAQ:BRK/B", "6mo", "1d");

        assertEquals("https://query1.finance.yahoo.com/v8/finance/chart/BRK%2FB?interval=1d&range=6mo", http.lastUrl);
        assertEquals(2, bars.size());
        assertEquals(Instant.ofEpochSecond(1700000000L), bars.get(0).timestamp);
        assertEquals(10.5, bars.get(0).close, 1e-9);
        assertEquals(1000.0, bars.get(0).volume, 1e-9);
        assertEquals(11.25, bars.get(1).close, 1e-9);
        assertEquals(0.0, bars.get(1).volume, 1e-9);
    }

    @Test
    void parseShouldDefaultVolumesWhenArrayMissing() {
        JSONObject root = new JSONObject("{\"chart\":{\"result\":[{\"timestamp\":[1,2],"
                + "\"indicators\":{\"quote\":[{\"close\":[1.0,2.0]}]}}]}}");

        List<PriceBar> bars = PriceHistoryClient.parse(root);

        assertEquals(2, bars.size());
        assertEquals(0.0, bars.get(1).volume, 1e-9);
    }

    @Test
    void parseShouldFailOnMissingStructure() {
        String[] broken = {
                "{}",
                "{\"chart\":{}}",
                "{\"chart\":{\"result\":[]}}",
                "{\"chart\":{\"result\":[1]}}",
                "{\"chart\":{\"result\":[{\"timestamp\":[1]}]}}",
                "{\"chart\":{\"result\":[{\"timestamp\":[1],\"indicators\":{\"quote\":[]}}]}}",
                "{\"chart\":{\"result\":[{\"timestamp\":[1],\"indicators\":{\"quote\":[{}]}}]}}"
        };
        for (String body : broken) {
            ScreenerException e = assertThrows(ScreenerException.class, () -> PriceHistoryClient.parse(new JSONObject(body)), body);
            assertEquals(FailureKind.DECODE, e.kind(), body);
        }
    }

    @Test
    void fetchShouldFailOnInvalidJson() {
        PriceHistoryClient client = new PriceHistoryClient(new RecordingHttp("<html>"));
        ScreenerException e = assertThrows(ScreenerException.class, () -> client.fetch("AAPL", "6mo", "1d"));
        assertEquals(FailureKind.DECODE, e.kind());
    }

    @Test
    void normalizeSymbolShouldKeepPlainTicker() {
        assertEquals("AAPL", PriceHistoryClient.normalizeSymbol("AAPL"));
        assertEquals("AAPL", PriceHistoryClient.normalizeSymbol("NASDAQ:AAPL"));
        assertEquals("", PriceHistoryClient.normalizeSymbol(null));
    }

    static final class RecordingHttp extends HttpClientEx {
        private final String body;
        String lastUrl;

        RecordingHttp(String body) {
            this.body = body;
        }

        @Override
        public String getText(String url, int timeoutSeconds) {
            lastUrl = url;
            return body;
        }
    }
}
