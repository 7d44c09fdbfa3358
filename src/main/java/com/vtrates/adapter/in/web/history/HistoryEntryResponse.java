package com.vtrates.adapter.in.web.history;

import com.vtrates.domain.model.HistoryEntry;

import java.util.Map;

public record HistoryEntryResponse(
        String id,
        String from,
        String to,
        double rate,
        String timestamp,
        String source,
        Map<String, Object> meta
) {
    public static HistoryEntryResponse from(HistoryEntry entry) {
        return new HistoryEntryResponse(
                entry.id(),
                entry.pair().from(),
                entry.pair().to(),
                entry.rate(),
                entry.timestamp().toString(),
                entry.source(),
                entry.meta());
    }
}
