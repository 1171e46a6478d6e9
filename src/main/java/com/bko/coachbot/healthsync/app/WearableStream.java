package com.bko.coachbot.healthsync.app;

/**
 * Record collections pulled from the wearable, each paged independently.
 */
public enum WearableStream {
    SLEEP("activity/sleep"),
    RECOVERY("recovery"),
    WORKOUT("activity/workout");

    private final String path;

    WearableStream(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }
}
