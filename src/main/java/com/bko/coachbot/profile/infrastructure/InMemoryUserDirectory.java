package com.bko.coachbot.profile.infrastructure;

import com.bko.coachbot.profile.UserDirectory;
import com.bko.coachbot.profile.UserProfile;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryUserDirectory implements UserDirectory {
    private final ConcurrentMap<String, UserProfile> users = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryUserDirectory(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<UserProfile> find(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public List<UserProfile> findAll() {
        return users.values().stream()
                .sorted(Comparator.comparing(UserProfile::userId))
                .toList();
    }

    @Override
    public UserProfile register(String userId, String name) {
        return users.computeIfAbsent(userId, id -> new UserProfile(id, name, clock.instant()));
    }
}
