package com.trustbridge.audit.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustbridge.crypto.SecretCipher;
import com.trustbridge.models.audit.AuditEvent;
import com.trustbridge.spi.AuditStorageBackend;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Appends audit events to a line oriented file.
 * <p>
 * Each line is one JSON encoded event, optionally encrypted ({@value #ENCRYPTED_PREFIX} prefix). When compression is
 * enabled a whole batch is gzipped and written as a single base64 line with the {@value #COMPRESSED_PREFIX} prefix.
 * Files larger than the configured size are renamed to {@code <name>.<yyyyMMdd'T'HHmmss>} and gzipped on rotation.
 */
@Slf4j
public class FileAuditStorageBackend implements AuditStorageBackend {

    public static final String TYPE = "file";
    static final String ENCRYPTED_PREFIX = "enc:";
    static final String COMPRESSED_PREFIX = "gz:";
    private static final DateTimeFormatter ROTATION_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final Path filePath;
    private final ObjectMapper objectMapper;
    private final SecretCipher cipher;
    private final boolean compress;
    private final long maxFileSizeBytes;
    private final Clock clock;

    /**
     * @param cipher encrypts each line when not null
     */
    public FileAuditStorageBackend(Path filePath, ObjectMapper objectMapper, SecretCipher cipher, boolean compress,
                                   long maxFileSizeBytes, Clock clock) throws IOException {
        this.filePath = filePath.toAbsolutePath();
        this.objectMapper = objectMapper;
        this.cipher = cipher;
        this.compress = compress;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.clock = clock;
        Path parent = this.filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (Files.isDirectory(this.filePath)) {
            throw new IllegalArgumentException("Invalid audit file: " + filePath);
        }
    }

    @Override
    public String type() {
        return TYPE;
    }

    public Path getFilePath() {
        return filePath;
    }

    @Override
    public synchronized void store(List<AuditEvent> events) throws IOException {
        if (events.isEmpty()) {
            return;
        }
        StringBuilder lines = new StringBuilder();
        for (AuditEvent event : events) {
            lines.append(encodeLine(event)).append('\n');
        }
        String payload = compress ? COMPRESSED_PREFIX + gzipBase64(lines.toString()) + "\n" : lines.toString();
        FileUtils.writeStringToFile(filePath.toFile(), payload, StandardCharsets.UTF_8, true);
    }

    private String encodeLine(AuditEvent event) throws JsonProcessingException {
        String json = objectMapper.writeValueAsString(event);
        return cipher == null ? json : ENCRYPTED_PREFIX + cipher.encrypt(json);
    }

    private static String gzipBase64(String text) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream gzip = new GZIPOutputStream(bytes)) {
            gzip.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    /**
     * Renames and compresses the current file when it exceeds the maximum size.
     */
    @Override
    public synchronized void rotate() throws IOException {
        if (!Files.exists(filePath) || Files.size(filePath) <= maxFileSizeBytes) {
            return;
        }
        Path rotated = filePath.resolveSibling(filePath.getFileName() + "." + ROTATION_SUFFIX.format(clock.instant()));
        Files.move(filePath, rotated);
        Path compressed = rotated.resolveSibling(rotated.getFileName() + ".gz");
        try (InputStream in = Files.newInputStream(rotated);
             OutputStream out = new GZIPOutputStream(Files.newOutputStream(compressed))) {
            IOUtils.copy(in, out);
        }
        Files.delete(rotated);
        log.info("rotated audit file {} to {}", filePath, compressed);
    }

    /**
     * Reads the events of the rotated archives and of the current file, in that order.
     */
    @Override
    public synchronized List<AuditEvent> readEvents(Instant from, Instant to) throws IOException {
        List<AuditEvent> events = new ArrayList<>();
        for (Path archive : rotatedFiles()) {
            try (InputStream in = new GZIPInputStream(Files.newInputStream(archive))) {
                readLines(in, events);
            }
        }
        if (Files.exists(filePath)) {
            try (InputStream in = Files.newInputStream(filePath)) {
                readLines(in, events);
            }
        }
        return events.stream()
                .filter(e -> from == null || !e.getTimestamp().isBefore(from))
                .filter(e -> to == null || !e.getTimestamp().isAfter(to))
                .toList();
    }

    public List<Path> rotatedFiles() throws IOException {
        String prefix = filePath.getFileName() + ".";
        try (var files = Files.list(filePath.getParent())) {
            return files
                    .filter(path -> path.getFileName().toString().startsWith(prefix))
                    .filter(path -> path.getFileName().toString().endsWith(".gz"))
                    .sorted()
                    .toList();
        }
    }

    private void readLines(InputStream in, List<AuditEvent> events) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith(COMPRESSED_PREFIX)) {
                byte[] gzipped = Base64.getDecoder().decode(line.substring(COMPRESSED_PREFIX.length()));
                readLines(new GZIPInputStream(new ByteArrayInputStream(gzipped)), events);
            } else {
                events.add(decodeLine(line));
            }
        }
    }

    private AuditEvent decodeLine(String line) throws IOException {
        String json = line;
        if (line.startsWith(ENCRYPTED_PREFIX)) {
            if (cipher == null) {
                throw new IOException("audit file contains encrypted lines but no cipher is configured");
            }
            json = cipher.decrypt(line.substring(ENCRYPTED_PREFIX.length()));
        }
        return objectMapper.readValue(json, AuditEvent.class);
    }
}
