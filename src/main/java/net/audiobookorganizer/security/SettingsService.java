package net.audiobookorganizer.security;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.exception.SecretCryptoException;
import net.audiobookorganizer.model.Setting;
import net.audiobookorganizer.store.AudiobookStore;

/**
 * Settings access with transparent encryption of secret values. The store only ever sees
 * ciphertext for settings flagged secret.
 */
@Slf4j
public class SettingsService {

    private final AudiobookStore store;
    private final SecretCodec secretCodec;

    public SettingsService(AudiobookStore store, SecretCodec secretCodec) {
        this.store = store;
        this.secretCodec = secretCodec;
    }

    /** Encrypts {@code value} first when {@code secret} is set; empty secrets are stored as-is. */
    public void saveSetting(String key, String value, String type, boolean secret) {
        String stored = value;
        if (secret && value != null && !value.isEmpty()) {
            stored = secretCodec.encrypt(value);
        }
        store.setSetting(new Setting(key, stored, type, secret, null));
    }

    /**
     * The setting with its plaintext value.
     *
     * @throws SecretCryptoException when a secret value cannot be decrypted
     */
    public Optional<Setting> getDecryptedSetting(String key) {
        return store.getSetting(key).map(this::decrypt);
    }

    /** Every setting, secrets decrypted and then masked. Undecryptable secrets show as {@value SecretCodec#MASK}. */
    public List<Setting> getAllSettingsMasked() {
        List<Setting> masked = new ArrayList<>();
        for (Setting setting : store.getAllSettings()) {
            if (!setting.secret() || setting.value() == null || setting.value().isEmpty()) {
                masked.add(setting);
                continue;
            }
            try {
                masked.add(setting.withValue(SecretCodec.mask(secretCodec.decrypt(setting.value()))));
            } catch (SecretCryptoException ex) {
                log.warn("Failed to decrypt secret setting {}: {}", setting.key(), ex.getMessage());
                masked.add(setting.withValue(SecretCodec.MASK));
            }
        }
        return masked;
    }

    public void deleteSetting(String key) {
        store.deleteSetting(key);
    }

    private Setting decrypt(Setting setting) {
        if (!setting.secret() || setting.value() == null || setting.value().isEmpty()) {
            return setting;
        }
        return setting.withValue(secretCodec.decrypt(setting.value()));
    }
}
