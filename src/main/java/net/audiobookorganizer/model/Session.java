package net.audiobookorganizer.model;

import java.time.Instant;

public record Session(
    String id,
    String userId,
    Instant createdAt,
    Instant expiresAt,
    String ip,
    String userAgent,
    boolean revoked,
    int version
) {

    public boolean isExpiredOrRevoked(Instant now) {
        return revoked || !expiresAt.isAfter(now);
    }

    public Session revoke() {
        return new Session(id, userId, createdAt, expiresAt, ip, userAgent, true, version);
    }
}
