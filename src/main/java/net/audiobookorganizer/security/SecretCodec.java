package net.audiobookorganizer.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import net.audiobookorganizer.exception.SecretCryptoException;

/**
 * AES-256-GCM codec for secret settings.
 *
 * <p>Stored form is {@code base64(nonce || ciphertext || tag)} with a fresh 12-byte nonce per
 * encryption and a 128-bit tag. Decryption fails closed: any malformed or tampered input raises
 * {@link SecretCryptoException}.
 */
public class SecretCodec {

    public static final String MASK = "****";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_BITS = 128;
    private static final int MASK_MIN_LENGTH = 8;

    private final SecretKeySpec key;
    private final SecureRandom secureRandom;

    public SecretCodec(byte[] key) {
        this(key, new SecureRandom());
    }

    public SecretCodec(byte[] key, SecureRandom secureRandom) {
        if (key == null || key.length != MasterKeyProvider.KEY_LENGTH) {
            throw new SecretCryptoException("AES-256 requires a " + MasterKeyProvider.KEY_LENGTH + "-byte key");
        }
        this.key = new SecretKeySpec(Arrays.copyOf(key, key.length), "AES");
        this.secureRandom = secureRandom;
    }

    public static SecretCodec fromProvider(MasterKeyProvider provider) {
        return new SecretCodec(provider.loadOrCreateKey());
    }

    public String encrypt(String plaintext) {
        byte[] nonce = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] out = new byte[NONCE_LENGTH + sealed.length];
            System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH);
            System.arraycopy(sealed, 0, out, NONCE_LENGTH, sealed.length);
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException ex) {
            throw new SecretCryptoException("Failed to encrypt secret", ex);
        }
    }

    public String decrypt(String encoded) {
        byte[] data;
        try {
            data = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException ex) {
            throw new SecretCryptoException("Secret is not valid base64", ex);
        }
        if (data.length < NONCE_LENGTH) {
            throw new SecretCryptoException("Secret is shorter than its nonce");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, data, 0, NONCE_LENGTH));
            byte[] plain = cipher.doFinal(data, NONCE_LENGTH, data.length - NONCE_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException ex) {
            throw new SecretCryptoException("Failed to decrypt secret", ex);
        }
    }

    /** First 3 and last 4 characters around {@value #MASK}; values under 8 characters are fully masked. */
    public static String mask(String value) {
        if (value == null || value.length() < MASK_MIN_LENGTH) {
            return MASK;
        }
        return value.substring(0, 3) + MASK + value.substring(value.length() - 4);
    }
}
