package net.audiobookorganizer.config;

import java.nio.file.Path;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly typed configuration for the persistence layer.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "audiobook.store")
public class StoreProperties {

    public static final String TYPE_ROCKSDB = "rocksdb";
    public static final String TYPE_SQLITE = "sqlite";

    /**
     * Storage engine, {@code rocksdb} or {@code sqlite}.
     */
    private String type = TYPE_ROCKSDB;

    /**
     * Directory holding the database files and the encryption key.
     */
    private Path dataDir = Path.of("./data");

    /**
     * The SQLite engine must be opted into explicitly.
     */
    private boolean sqliteEnabled = false;

    private String sqliteFile = "audiobooks.db";

    private String rocksdbDir = "rocksdb";

    /**
     * How long a SQLite connection waits on a locked database before failing.
     */
    private Duration busyTimeout = Duration.ofSeconds(5);

    private boolean runMigrationsOnStartup = true;

    public Path resolveSqliteFile() {
        return dataDir.resolve(sqliteFile);
    }

    public Path resolveRocksDbDirectory() {
        return dataDir.resolve(rocksdbDir);
    }
}
