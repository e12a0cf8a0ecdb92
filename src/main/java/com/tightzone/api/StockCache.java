package com.tightzone.api;

import com.tightzone.core.ScreenerException;
import com.tightzone.screener.ScreenerRow;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON file holding the last served list of qualifying rows. All reads and
 * writes go through one lock.
 */
public class StockCache {
    private final Path file;
    private final Object lock = new Object();

    public StockCache(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        synchronized (lock) {
            return Files.isRegularFile(file);
        }
    }

    public List<ScreenerRow> read() throws IOException {
        synchronized (lock) {
            String body = Files.readString(file, StandardCharsets.UTF_8);
            JSONArray arr;
            try {
                arr = new JSONArray(body);
            } catch (JSONException e) {
                throw ScreenerException.decode("cache file " + file + " is not a JSON array", e);
            }
            List<ScreenerRow> rows = new ArrayList<>(arr.length());
            for (int i = 0; i < arr.length(); i++) {
                JSONObject obj = arr.optJSONObject(i);
                if (obj == null) {
                    throw ScreenerException.decode("cache entry " + i + " is not an object");
                }
                rows.add(ScreenerRow.fromJson(obj));
            }
            return rows;
        }
    }

    public void write(List<ScreenerRow> rows) throws IOException {
        JSONArray arr = new JSONArray();
        for (ScreenerRow row : rows) {
            arr.put(row.toJson());
        }
        synchronized (lock) {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, arr.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
