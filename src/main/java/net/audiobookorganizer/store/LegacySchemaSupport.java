package net.audiobookorganizer.store;

/**
 * Engine hook for the one-time move from the legacy "library folder" storage to import paths.
 * Implementations must be safe to run any number of times.
 */
public interface LegacySchemaSupport {

    /**
     * Moves legacy library folder records to the import path family.
     *
     * @return number of legacy records moved by this call; zero once nothing legacy remains
     */
    int migrateLegacyImportPaths();
}
