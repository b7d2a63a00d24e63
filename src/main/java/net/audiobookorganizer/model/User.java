package net.audiobookorganizer.model;

import java.time.Instant;
import java.util.List;

/**
 * Account record. Username and email are unique, compared case-insensitively.
 */
public record User(
    String id,
    String username,
    String email,
    String passwordHashAlgo,
    String passwordHash,
    List<String> roles,
    String status,
    Instant createdAt,
    Instant updatedAt,
    int version
) {
    public User {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public User withUpdatedAt(Instant instant) {
        return new User(id, username, email, passwordHashAlgo, passwordHash, roles, status, createdAt, instant, version);
    }
}
