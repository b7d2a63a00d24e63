package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Application setting. When {@code secret} is true the stored {@code value} is ciphertext
 * produced by {@link net.audiobookorganizer.security.SecretCodec}.
 */
public record Setting(String key, String value, String type, boolean secret, @Nullable Instant updatedAt) {

    public Setting withValue(String newValue) {
        return new Setting(key, newValue, type, secret, updatedAt);
    }

    public Setting withUpdatedAt(Instant instant) {
        return new Setting(key, value, type, secret, instant);
    }
}
