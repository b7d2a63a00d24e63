package net.audiobookorganizer.util;

import java.security.SecureRandom;

/**
 * Minimal ID utilities
 * - ULID generator (26-char Crockford base32, lexicographically sortable)
 * - Monotonic within a millisecond: the random component is incremented instead of redrawn
 */
public final class IdGenerator {
    // Crockford base32: no I, L, O, U
    private static final char[] CROCKFORD_ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    public static final int ULID_LENGTH = 26;
    private static final long MAX_TIMESTAMP = (1L << 48) - 1;
    private static final long RANDOM_HI_MASK = 0xFFFFL; // 16 bits

    // Single SecureRandom instance; thread-safe for concurrent use
    private static final SecureRandom RANDOM = new SecureRandom();

    private static final Object LOCK = new Object();
    private static long lastTimestamp = -1L;
    private static long lastRandomHi; // upper 16 bits of the 80-bit random component
    private static long lastRandomLo; // lower 64 bits

    private IdGenerator() {}

    /** Monotonic ULID for the current wall-clock millisecond */
    public static String ulid() {
        return ulid(System.currentTimeMillis());
    }

    /**
     * Monotonic ULID for the given timestamp. When called repeatedly within the same millisecond
     * (or with a clock that moved backwards) the previous random component is incremented, so
     * successive ids always sort strictly after earlier ones.
     */
    public static String ulid(long epochMillis) {
        if (epochMillis < 0 || epochMillis > MAX_TIMESTAMP) {
            throw new IllegalArgumentException("timestamp out of ULID range: " + epochMillis);
        }
        long timestamp;
        long randomHi;
        long randomLo;
        synchronized (LOCK) {
            if (epochMillis <= lastTimestamp) {
                timestamp = lastTimestamp;
                randomLo = lastRandomLo + 1;
                randomHi = lastRandomHi;
                if (randomLo == 0) {
                    randomHi = (randomHi + 1) & RANDOM_HI_MASK;
                    if (randomHi == 0) {
                        // random space exhausted for this millisecond; borrow the next one
                        timestamp = lastTimestamp + 1;
                        randomHi = RANDOM.nextInt(1 << 16) & RANDOM_HI_MASK;
                        randomLo = RANDOM.nextLong();
                    }
                }
            } else {
                timestamp = epochMillis;
                randomHi = RANDOM.nextInt(1 << 16) & RANDOM_HI_MASK;
                randomLo = RANDOM.nextLong();
            }
            lastTimestamp = timestamp;
            lastRandomHi = randomHi;
            lastRandomLo = randomLo;
        }
        return encode(timestamp, randomHi, randomLo);
    }

    /** True when the value has the shape of a ULID produced by {@link #ulid()} */
    public static boolean isUlid(String value) {
        if (value == null || value.length() != ULID_LENGTH) {
            return false;
        }
        if (value.charAt(0) > '7') {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (decodeChar(value.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    /** Millisecond timestamp embedded in a ULID */
    public static long timestampOf(String ulid) {
        if (!isUlid(ulid)) {
            throw new IllegalArgumentException("not a ULID: " + ulid);
        }
        long ts = 0;
        for (int i = 0; i < 10; i++) {
            ts = (ts << 5) | decodeChar(ulid.charAt(i));
        }
        return ts;
    }

    private static String encode(long timestamp, long randomHi, long randomLo) {
        char[] out = new char[ULID_LENGTH];
        // 48-bit timestamp -> 10 chars (top char carries 3 bits)
        long ts = timestamp;
        for (int i = 9; i >= 0; i--) {
            out[i] = CROCKFORD_ALPHABET[(int) (ts & 0x1F)];
            ts >>>= 5;
        }
        // 80-bit random -> 16 chars, consumed 5 bits at a time from the low end
        long lo = randomLo;
        long hi = randomHi;
        for (int i = ULID_LENGTH - 1; i >= 10; i--) {
            out[i] = CROCKFORD_ALPHABET[(int) (lo & 0x1F)];
            lo = (lo >>> 5) | ((hi & 0x1F) << 59);
            hi >>>= 5;
        }
        return new String(out);
    }

    private static int decodeChar(char c) {
        for (int i = 0; i < CROCKFORD_ALPHABET.length; i++) {
            if (CROCKFORD_ALPHABET[i] == c) {
                return i;
            }
        }
        return -1;
    }
}
