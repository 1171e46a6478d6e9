package com.bko.coachbot.profile;

import java.util.List;
import java.util.Optional;

public interface UserDirectory {
    Optional<UserProfile> find(String userId);

    List<UserProfile> findAll();

    /**
     * Creates the profile when it does not exist yet; an existing profile is returned untouched.
     */
    UserProfile register(String userId, String name);
}
