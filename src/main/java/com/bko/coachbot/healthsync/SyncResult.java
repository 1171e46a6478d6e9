package com.bko.coachbot.healthsync;

public record SyncResult(int recordsIngested, boolean cursorAdvanced) {
    public static SyncResult nothingNew() {
        return new SyncResult(0, false);
    }
}
