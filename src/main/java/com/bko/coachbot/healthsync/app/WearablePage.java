package com.bko.coachbot.healthsync.app;

import java.util.List;

public record WearablePage(List<WearableRecord> records, String nextToken) {
    public WearablePage {
        records = List.copyOf(records);
    }

    public boolean hasMore() {
        return nextToken != null && !nextToken.isBlank();
    }
}
