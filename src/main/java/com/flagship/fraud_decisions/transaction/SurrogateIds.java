package com.flagship.fraud_decisions.transaction;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * Time-ordered surrogate ids (UUID version 7, RFC 9562).
 *
 * The top 48 bits carry the Unix epoch milliseconds, so ids sort by creation time and index
 * inserts stay append-mostly. The remaining 74 bits are random.
 */
public final class SurrogateIds {

    private static final SecureRandom RANDOM = new SecureRandom();

    private SurrogateIds() {
    }

    public static UUID newId() {
        return newId(System.currentTimeMillis());
    }

    static UUID newId(long epochMillis) {
        byte[] random = new byte[10];
        RANDOM.nextBytes(random);

        long mostSignificant = (epochMillis & 0xFFFF_FFFF_FFFFL) << 16;
        mostSignificant |= 0x7000L;
        mostSignificant |= ((random[0] & 0x0FL) << 8) | (random[1] & 0xFFL);

        long leastSignificant = 0;
        for (int i = 2; i < random.length; i++) {
            leastSignificant = (leastSignificant << 8) | (random[i] & 0xFFL);
        }
        leastSignificant = (leastSignificant & 0x3FFF_FFFF_FFFF_FFFFL) | 0x8000_0000_0000_0000L;

        return new UUID(mostSignificant, leastSignificant);
    }

    public static long epochMillisOf(UUID id) {
        if (id.version() != 7) {
            throw new IllegalArgumentException("Not a version 7 UUID: " + id);
        }
        return id.getMostSignificantBits() >>> 16;
    }
}
