package com.bingo.cards.card;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * SHA-256 digest of a card's canonical form (row-major cells, four big-endian
 * bytes each, 0 for empty). Two cards are the same card iff their fingerprints are equal.
 */
public final class Fingerprint {
    private static final String ALGORITHM = "SHA-256";

    private final byte[] digest;
    private final int hash;

    private Fingerprint(byte[] digest) {
        this.digest = digest;
        this.hash = Arrays.hashCode(digest);
    }

    public static Fingerprint of(Card card) {
        int[] cells = card.canonicalForm();
        ByteBuffer buffer = ByteBuffer.allocate(cells.length * Integer.BYTES);
        for (int cell : cells) {
            buffer.putInt(cell);
        }
        return new Fingerprint(newDigest().digest(buffer.array()));
    }

    // MessageDigest is not thread-safe, so each fingerprint gets its own instance
    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

    public String hex() {
        return HexFormat.of().formatHex(digest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint other)) return false;
        return Arrays.equals(digest, other.digest);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return hex();
    }
}
