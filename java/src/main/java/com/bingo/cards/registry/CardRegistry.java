package com.bingo.cards.registry;

import com.bingo.cards.card.Fingerprint;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fingerprints of every card accepted in the current session.
 * Safe for concurrent use; {@link #register} is an atomic insert-if-absent.
 */
public class CardRegistry {
    private final Set<Fingerprint> fingerprints = ConcurrentHashMap.newKeySet();

    /**
     * Add a fingerprint if it is not present yet.
     * @return true if the fingerprint was added, false if it was already registered
     */
    public boolean register(Fingerprint fingerprint) {
        return fingerprints.add(fingerprint);
    }

    public boolean contains(Fingerprint fingerprint) {
        return fingerprints.contains(fingerprint);
    }

    /**
     * Remove a fingerprint whose card was dropped after registration.
     */
    public void release(Fingerprint fingerprint) {
        fingerprints.remove(fingerprint);
    }

    public int size() {
        return fingerprints.size();
    }

    public boolean isEmpty() {
        return fingerprints.isEmpty();
    }

    public void clear() {
        fingerprints.clear();
    }
}
