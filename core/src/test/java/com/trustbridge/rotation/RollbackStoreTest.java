package com.trustbridge.rotation;

import com.trustbridge.crypto.SecretCipher;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RollbackStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final RollbackStore store = new RollbackStore(new SecretCipher(SecretCipher.generateKey()));

    @Test
    void shouldReturnValueOnlyWhileWindowIsOpen() {
        store.put("e1", "previous-secret", NOW.plusSeconds(60));

        assertThat(store.get("e1", NOW)).contains("previous-secret");
        assertThat(store.get("e1", NOW.plusSeconds(59))).contains("previous-secret");
        assertThat(store.get("e1", NOW.plusSeconds(60))).isEmpty();
        assertThat(store.get("unknown", NOW)).isEmpty();
    }

    @Test
    void shouldKeepValuesEncrypted() {
        store.put("e1", "previous-secret", NOW.plusSeconds(60));

        Map<?, ?> entries = (Map<?, ?>) ReflectionTestUtils.getField(store, "entries");

        assertThat(String.valueOf(entries.get("e1"))).doesNotContain("previous-secret");
    }

    @Test
    void shouldPurgeExpiredEntries() {
        store.put("old", "a", NOW.minusSeconds(1));
        store.put("fresh", "b", NOW.plusSeconds(60));

        assertThat(store.purgeExpired(NOW)).containsExactly("old");
        assertEquals(1, store.size());

        store.remove("fresh");
        assertEquals(0, store.size());
    }
}
