package net.audiobookorganizer.security;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.exception.SecretCryptoException;

/**
 * Loads the AES-256 master key from {@code <dataDir>/.encryption_key}, generating it on first
 * use. The file holds exactly {@value #KEY_LENGTH} raw bytes and is written owner read/write
 * only where the file system supports POSIX permissions.
 */
@Slf4j
public class MasterKeyProvider {

    public static final String KEY_FILE_NAME = ".encryption_key";
    public static final int KEY_LENGTH = 32;

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path keyFile;
    private final SecureRandom secureRandom;

    public MasterKeyProvider(Path dataDirectory) {
        this(dataDirectory, new SecureRandom());
    }

    MasterKeyProvider(Path dataDirectory, SecureRandom secureRandom) {
        this.keyFile = dataDirectory.resolve(KEY_FILE_NAME);
        this.secureRandom = secureRandom;
    }

    public Path getKeyFile() {
        return keyFile;
    }

    /**
     * @throws SecretCryptoException when the file cannot be read or written, or holds a key of
     *     the wrong length
     */
    public synchronized byte[] loadOrCreateKey() {
        try {
            if (Files.exists(keyFile)) {
                byte[] key = Files.readAllBytes(keyFile);
                if (key.length != KEY_LENGTH) {
                    throw new SecretCryptoException("Encryption key " + keyFile + " must be " + KEY_LENGTH
                        + " bytes but has " + key.length);
                }
                return key;
            }
            return createKey();
        } catch (IOException ex) {
            throw new SecretCryptoException("Failed to access encryption key " + keyFile, ex);
        }
    }

    private byte[] createKey() throws IOException {
        byte[] key = new byte[KEY_LENGTH];
        secureRandom.nextBytes(key);
        Path parent = keyFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        createOwnerOnlyFile(keyFile);
        Files.write(keyFile, key, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        log.info("Generated new encryption key at {}", keyFile);
        return key;
    }

    /** Creates an empty file that is owner read/write from the start where POSIX permissions exist. */
    static void createOwnerOnlyFile(Path file) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.createFile(file, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
            return;
        }
        log.warn("File system does not support POSIX permissions; {} is not restricted to its owner", file);
        Files.createFile(file);
    }
}
