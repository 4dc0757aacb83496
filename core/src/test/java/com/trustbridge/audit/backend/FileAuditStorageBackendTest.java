package com.trustbridge.audit.backend;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustbridge.MutableClock;
import com.trustbridge.crypto.SecretCipher;
import com.trustbridge.models.audit.AuditContext;
import com.trustbridge.models.audit.AuditEvent;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileAuditStorageBackendTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final JsonMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final MutableClock clock = new MutableClock(NOW);

    @TempDir
    Path tempDir;

    @Test
    void shouldWritePlainJsonLinesAndReadThemBack() throws IOException {
        // Given
        FileAuditStorageBackend backend = new FileAuditStorageBackend(tempDir.resolve("audit.log"), objectMapper, null, false, 1024, clock);

        // When
        backend.store(List.of(event("a", NOW), event("b", NOW.plusSeconds(1))));

        // Then
        List<String> lines = Files.readAllLines(backend.getFilePath());
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).startsWith("{").contains("\"resource\":\"a\"");
        List<AuditEvent> read = backend.readEvents(null, null);
        assertThat(read).extracting(AuditEvent::getResource).containsExactly("a", "b");
        assertThat(read).allMatch(AuditEvent::verifyIntegrity);
    }

    @Test
    void shouldEncryptEveryLine() throws IOException {
        // Given
        SecretCipher cipher = new SecretCipher(SecretCipher.generateKey());
        FileAuditStorageBackend backend = new FileAuditStorageBackend(tempDir.resolve("audit.log"), objectMapper, cipher, false, 1024, clock);

        // When
        backend.store(List.of(event("openai_api_key", NOW)));

        // Then
        String content = Files.readString(backend.getFilePath(), StandardCharsets.UTF_8);
        assertThat(content).startsWith(FileAuditStorageBackend.ENCRYPTED_PREFIX).doesNotContain("openai_api_key");
        assertThat(backend.readEvents(null, null)).extracting(AuditEvent::getResource).containsExactly("openai_api_key");
    }

    @Test
    void shouldFailToReadEncryptedLinesWithoutCipher() throws IOException {
        Path file = tempDir.resolve("audit.log");
        new FileAuditStorageBackend(file, objectMapper, new SecretCipher(SecretCipher.generateKey()), false, 1024, clock)
                .store(List.of(event("a", NOW)));

        FileAuditStorageBackend plain = new FileAuditStorageBackend(file, objectMapper, null, false, 1024, clock);

        assertThatThrownBy(() -> plain.readEvents(null, null)).isInstanceOf(IOException.class);
    }

    @Test
    void shouldWriteCompressedBatchAsSingleLine() throws IOException {
        // Given
        SecretCipher cipher = new SecretCipher(SecretCipher.generateKey());
        FileAuditStorageBackend backend = new FileAuditStorageBackend(tempDir.resolve("audit.log"), objectMapper, cipher, true, 1024, clock);

        // When
        backend.store(List.of(event("a", NOW), event("b", NOW), event("c", NOW)));
        backend.store(List.of(event("d", NOW)));

        // Then
        List<String> lines = Files.readAllLines(backend.getFilePath());
        assertThat(lines).hasSize(2).allMatch(line -> line.startsWith(FileAuditStorageBackend.COMPRESSED_PREFIX));
        assertThat(backend.readEvents(null, null)).extracting(AuditEvent::getResource).containsExactly("a", "b", "c", "d");
    }

    @Test
    void shouldRotateOversizedFileIntoGzipArchive() throws IOException {
        // Given
        FileAuditStorageBackend backend = new FileAuditStorageBackend(tempDir.resolve("audit.log"), objectMapper, null, false, 100, clock);
        backend.store(List.of(event("before-rotation", NOW)));

        // When
        backend.rotate();
        backend.store(List.of(event("after-rotation", NOW.plusSeconds(5))));

        // Then
        assertThat(backend.rotatedFiles()).hasSize(1);
        assertThat(backend.rotatedFiles().get(0).getFileName().toString()).isEqualTo("audit.log.20260301T100000.gz");
        assertThat(tempDir.resolve("audit.log.20260301T100000")).doesNotExist();
        assertThat(Files.readAllLines(backend.getFilePath())).hasSize(1);
        assertThat(backend.readEvents(null, null)).extracting(AuditEvent::getResource)
                .containsExactly("before-rotation", "after-rotation");
    }

    @Test
    void shouldNotRotateSmallFile() throws IOException {
        FileAuditStorageBackend backend = new FileAuditStorageBackend(tempDir.resolve("audit.log"), objectMapper, null, false, 1_000_000, clock);
        backend.store(List.of(event("a", NOW)));

        backend.rotate();

        assertThat(backend.rotatedFiles()).isEmpty();
        assertThat(backend.getFilePath()).exists();
    }

    @Test
    void shouldFilterReadEventsByWindow() throws IOException {
        FileAuditStorageBackend backend = new FileAuditStorageBackend(tempDir.resolve("nested/dir/audit.log"), objectMapper, null, false, 1024, clock);
        backend.store(List.of(event("early", NOW), event("inside", NOW.plus(Duration.ofHours(1))), event("late", NOW.plus(Duration.ofDays(1)))));

        List<AuditEvent> read = backend.readEvents(NOW.plusSeconds(1), NOW.plus(Duration.ofHours(2)));

        assertThat(read).extracting(AuditEvent::getResource).containsExactly("inside");
    }

    @Test
    void shouldRejectDirectoryAsAuditFile() {
        assertThatThrownBy(() -> new FileAuditStorageBackend(tempDir, objectMapper, null, false, 1024, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AuditEvent event(String resource, Instant timestamp) {
        return AuditEvent.builder()
                .timestamp(timestamp)
                .level(AuditLevel.INFO)
                .action(AuditAction.SECRET_ACCESS)
                .resource(resource)
                .message("Secret accessed")
                .context(AuditContext.system("trustbridge", "dev"))
                .data(Map.of("environment", "dev", "attempt", 2L))
                .durationMs(7L)
                .build()
                .seal();
    }
}
