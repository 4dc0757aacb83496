package com.trustbridge.rotation;

import com.trustbridge.crypto.SecretCipher;
import com.trustbridge.utils.CloseableReentrantLock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Previous secret values of completed rotations, encrypted, keyed by rotation event ID, available until the
 * rollback window of the rotation closes.
 */
public class RollbackStore {

    private record Entry(String encryptedValue, Instant expiresAt) {
    }

    private final CloseableReentrantLock lock = new CloseableReentrantLock();
    private final Map<String, Entry> entries = new HashMap<>();
    private final SecretCipher cipher;

    public RollbackStore(SecretCipher cipher) {
        this.cipher = cipher;
    }

    public void put(String eventId, String previousValue, Instant expiresAt) {
        String encrypted = cipher.encrypt(previousValue);
        try (var ignored = lock.lockAsResource()) {
            entries.put(eventId, new Entry(encrypted, expiresAt));
        }
    }

    /**
     * @return the previous value while the window is open
     */
    public Optional<String> get(String eventId, Instant now) {
        Entry entry;
        try (var ignored = lock.lockAsResource()) {
            entry = entries.get(eventId);
        }
        if (entry == null || !now.isBefore(entry.expiresAt())) {
            return Optional.empty();
        }
        return Optional.of(cipher.decrypt(entry.encryptedValue()));
    }

    public void remove(String eventId) {
        try (var ignored = lock.lockAsResource()) {
            entries.remove(eventId);
        }
    }

    /**
     * @return IDs of the events whose window closed
     */
    public List<String> purgeExpired(Instant now) {
        List<String> expired = new ArrayList<>();
        try (var ignored = lock.lockAsResource()) {
            Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, Entry> next = iterator.next();
                if (!now.isBefore(next.getValue().expiresAt())) {
                    expired.add(next.getKey());
                    iterator.remove();
                }
            }
        }
        return expired;
    }

    public int size() {
        try (var ignored = lock.lockAsResource()) {
            return entries.size();
        }
    }
}
