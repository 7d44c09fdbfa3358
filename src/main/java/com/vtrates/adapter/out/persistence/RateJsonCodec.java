package com.vtrates.adapter.out.persistence;

import com.vtrates.domain.model.CurrencyPair;
import com.vtrates.domain.model.HistoryEntry;
import com.vtrates.domain.model.RateOrigin;
import com.vtrates.domain.model.RateRecord;
import com.vtrates.domain.model.RateTable;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON layout of the snapshot and history files.
 *
 * <pre>
 * snapshot: {"pairs": {"FROM_TO": {"rate", "updated_at", "source", "origin"}}, "last_refresh", "source"}
 * history:  [{"id", "from_currency", "to_currency", "rate", "timestamp", "source", "meta"}]
 * </pre>
 */
public final class RateJsonCodec {

    private RateJsonCodec() {
    }

    public static JsonObject encodeTable(RateTable table) {
        JsonObject pairs = new JsonObject();
        table.records().forEach((pair, record) -> pairs.put(pair.key(), new JsonObject()
                .put("rate", record.rate())
                .put("updated_at", record.updatedAt().toString())
                .put("source", record.source())
                .put("origin", record.origin().getValue())));

        return new JsonObject()
                .put("pairs", pairs)
                .put("last_refresh", table.lastRefresh().map(Instant::toString).orElse(null))
                .put("source", table.source());
    }

    public static RateTable decodeTable(JsonObject json) {
        JsonObject pairs = json.getJsonObject("pairs", new JsonObject());
        Map<CurrencyPair, RateRecord> records = new LinkedHashMap<>();

        for (String key : pairs.fieldNames()) {
            JsonObject entry = pairs.getJsonObject(key);
            CurrencyPair pair = CurrencyPair.parse(key);
            String origin = entry.getString("origin");
            records.put(pair, new RateRecord(
                    pair,
                    entry.getDouble("rate"),
                    parseInstant(entry.getString("updated_at")),
                    entry.getString("source"),
                    origin == null ? RateOrigin.DIRECT : RateOrigin.fromValue(origin)));
        }

        String lastRefresh = json.getString("last_refresh");
        return new RateTable(records,
                lastRefresh == null ? null : parseInstant(lastRefresh),
                json.getString("source", RateTable.DEFAULT_SOURCE));
    }

    public static JsonObject encodeHistoryEntry(HistoryEntry entry) {
        return new JsonObject()
                .put("id", entry.id())
                .put("from_currency", entry.pair().from())
                .put("to_currency", entry.pair().to())
                .put("rate", entry.rate())
                .put("timestamp", entry.timestamp().toString())
                .put("source", entry.source())
                .put("meta", new JsonObject(new LinkedHashMap<>(entry.meta())));
    }

    public static HistoryEntry decodeHistoryEntry(JsonObject json) {
        JsonObject meta = json.getJsonObject("meta", new JsonObject());
        return new HistoryEntry(
                json.getString("id"),
                CurrencyPair.of(json.getString("from_currency"), json.getString("to_currency")),
                json.getDouble("rate"),
                parseInstant(json.getString("timestamp")),
                json.getString("source"),
                meta.getMap());
    }

    public static JsonArray encodeHistory(List<HistoryEntry> entries) {
        JsonArray array = new JsonArray();
        entries.forEach(entry -> array.add(encodeHistoryEntry(entry)));
        return array;
    }

    /**
     * Accepts a bare array or the older {"history": [...]} wrapper
     */
    public static List<HistoryEntry> decodeHistory(Object json) {
        JsonArray array;
        if (json instanceof JsonArray jsonArray) {
            array = jsonArray;
        } else if (json instanceof JsonObject jsonObject) {
            array = jsonObject.getJsonArray("history", new JsonArray());
        } else {
            throw new IllegalArgumentException("History must be a JSON array");
        }

        List<HistoryEntry> entries = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            entries.add(decodeHistoryEntry(array.getJsonObject(i)));
        }
        return entries;
    }

    /**
     * ISO-8601 instant; timestamps without an offset are read as UTC
     */
    static Instant parseInstant(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Timestamp is required");
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }
}
