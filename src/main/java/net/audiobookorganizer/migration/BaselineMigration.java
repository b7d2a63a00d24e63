package net.audiobookorganizer.migration;

import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.store.AudiobookStore;

/**
 * Placeholder for the early schema steps. Both engines create their base schema on open, so
 * these versions only need to be recorded.
 */
@Slf4j
public class BaselineMigration implements StoreMigration {

    private final int version;
    private final String description;

    public BaselineMigration(int version, String description) {
        this.version = version;
        this.description = description;
    }

    @Override
    public int getVersion() {
        return version;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public void execute(AudiobookStore store) {
        log.debug("Baseline migration {} has nothing to change on {}", version, store.engineName());
    }
}
