package com.vtrates.adapter.in.web.history;

import java.util.List;

public record HistoryResponse(int count, List<HistoryEntryResponse> entries) {
}
