package net.audiobookorganizer.config;

import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.migration.MigrationRunner;
import net.audiobookorganizer.security.MasterKeyProvider;
import net.audiobookorganizer.security.SecretCodec;
import net.audiobookorganizer.security.SettingsService;
import net.audiobookorganizer.service.VersionGroupService;
import net.audiobookorganizer.store.AudiobookStore;
import net.audiobookorganizer.store.kv.RocksDbAudiobookStore;
import net.audiobookorganizer.store.sqlite.SqliteAudiobookStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Opens exactly one storage engine, selected by {@code audiobook.store.type}, and the services
 * built on top of it.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class StoreConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "audiobook.store", name = "type", havingValue = StoreProperties.TYPE_ROCKSDB,
        matchIfMissing = true)
    public AudiobookStore rocksDbAudiobookStore(StoreProperties properties) {
        RocksDbAudiobookStore store = new RocksDbAudiobookStore(properties.resolveRocksDbDirectory());
        log.info("[STORE] Opened {} engine at {}", RocksDbAudiobookStore.ENGINE,
            properties.resolveRocksDbDirectory().toAbsolutePath());
        return store;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "audiobook.store", name = "type", havingValue = StoreProperties.TYPE_SQLITE)
    public AudiobookStore sqliteAudiobookStore(StoreProperties properties) {
        if (!properties.isSqliteEnabled()) {
            log.error("[STORE] audiobook.store.type=sqlite requires audiobook.store.sqlite-enabled=true");
            throw new IllegalStateException("The SQLite engine is disabled. "
                + "Set audiobook.store.sqlite-enabled=true to use it, or switch audiobook.store.type to rocksdb.");
        }
        SqliteAudiobookStore store = new SqliteAudiobookStore(properties.resolveSqliteFile(),
            properties.getBusyTimeout());
        log.info("[STORE] Opened {} engine at {}", SqliteAudiobookStore.ENGINE,
            properties.resolveSqliteFile().toAbsolutePath());
        return store;
    }

    @Bean
    public MasterKeyProvider masterKeyProvider(StoreProperties properties) {
        return new MasterKeyProvider(properties.getDataDir());
    }

    @Bean
    public SecretCodec secretCodec(MasterKeyProvider masterKeyProvider) {
        return SecretCodec.fromProvider(masterKeyProvider);
    }

    @Bean
    public SettingsService settingsService(AudiobookStore audiobookStore, SecretCodec secretCodec) {
        return new SettingsService(audiobookStore, secretCodec);
    }

    @Bean
    public MigrationRunner migrationRunner() {
        return new MigrationRunner();
    }

    @Bean
    public VersionGroupService versionGroupService(AudiobookStore audiobookStore) {
        return new VersionGroupService(audiobookStore);
    }
}
