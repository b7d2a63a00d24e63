package net.audiobookorganizer.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assumptions.assumeThat;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import net.audiobookorganizer.exception.SecretCryptoException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MasterKeyProviderTest {

    @TempDir
    Path dataDir;

    @Test
    void should_GenerateKeyFile_When_NoneExists() throws Exception {
        MasterKeyProvider provider = new MasterKeyProvider(dataDir.resolve("nested"));

        byte[] key = provider.loadOrCreateKey();

        assertThat(key).hasSize(MasterKeyProvider.KEY_LENGTH);
        assertThat(provider.getKeyFile()).isEqualTo(dataDir.resolve("nested").resolve(".encryption_key"));
        assertThat(Files.readAllBytes(provider.getKeyFile())).isEqualTo(key);
    }

    @Test
    void should_RestrictPermissionsToOwner_When_PosixSupported() throws Exception {
        assumeThat(FileSystems.getDefault().supportedFileAttributeViews()).contains("posix");
        MasterKeyProvider provider = new MasterKeyProvider(dataDir);

        provider.loadOrCreateKey();

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(provider.getKeyFile())))
            .isEqualTo("rw-------");
    }

    @Test
    void should_CreateEmptyFileOwnerOnly_When_PreparingKeyFile() throws Exception {
        assumeThat(FileSystems.getDefault().supportedFileAttributeViews()).contains("posix");
        Path keyFile = dataDir.resolve(MasterKeyProvider.KEY_FILE_NAME);

        MasterKeyProvider.createOwnerOnlyFile(keyFile);

        assertThat(keyFile).isEmptyFile();
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(keyFile))).isEqualTo("rw-------");
    }

    @Test
    void should_ReturnSameKey_When_LoadedAgain() {
        byte[] first = new MasterKeyProvider(dataDir, new SecureRandom()).loadOrCreateKey();
        byte[] second = new MasterKeyProvider(dataDir).loadOrCreateKey();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void should_Fail_When_KeyFileHasWrongLength() throws Exception {
        Files.write(dataDir.resolve(MasterKeyProvider.KEY_FILE_NAME), new byte[16]);

        assertThatThrownBy(() -> new MasterKeyProvider(dataDir).loadOrCreateKey())
            .isInstanceOf(SecretCryptoException.class)
            .hasMessageContaining("32 bytes");
    }

    @Test
    void should_DecryptAcrossRestarts_When_CodecBuiltFromSameKeyFile() {
        String sealed = SecretCodec.fromProvider(new MasterKeyProvider(dataDir)).encrypt("token");

        assertThat(SecretCodec.fromProvider(new MasterKeyProvider(dataDir)).decrypt(sealed)).isEqualTo("token");
    }
}
