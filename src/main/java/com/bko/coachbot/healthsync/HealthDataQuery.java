package com.bko.coachbot.healthsync;

public interface HealthDataQuery {
    HealthSnapshot latestSnapshot(String userId);
}
