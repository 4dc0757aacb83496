package com.trustbridge.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigFileWatcherTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReportModifiedAndCreatedWatchedFiles() throws Exception {
        // Given
        Path envFile = tempDir.resolve(".env");
        Path definition = tempDir.resolve("prod.yaml");
        Path unrelated = tempDir.resolve("notes.txt");
        Files.writeString(envFile, "A=1\n");
        List<Path> changed = new ArrayList<>();
        ConfigFileWatcher watcher = new ConfigFileWatcher(List.of(envFile, definition), Duration.ofSeconds(1), changed::add);
        watcher.initialize();

        // When
        Files.writeString(envFile, "A=1\nB=2\n");
        Files.setLastModifiedTime(envFile, FileTime.from(Instant.now().plusSeconds(10)));
        Files.writeString(definition, "values: {}\n");
        Files.writeString(unrelated, "ignored");
        watcher.checkNow();

        // Then
        assertThat(changed).containsExactlyInAnyOrder(envFile.toAbsolutePath(), definition.toAbsolutePath());
    }

    @Test
    void shouldKeepDispatchingWhenHandlerFails() throws Exception {
        // Given
        Path first = tempDir.resolve("a.env");
        Path second = tempDir.resolve("b.env");
        List<Path> handled = new ArrayList<>();
        ConfigFileWatcher watcher = new ConfigFileWatcher(List.of(first, second), Duration.ofSeconds(1), path -> {
            handled.add(path);
            throw new IllegalStateException("reload failed");
        });
        watcher.initialize();

        // When
        Files.writeString(first, "A=1\n");
        Files.writeString(second, "B=1\n");
        watcher.checkNow();

        // Then
        assertThat(handled).hasSize(2);
    }

    @Test
    void shouldStartAndStopPolling() {
        ConfigFileWatcher watcher = new ConfigFileWatcher(List.of(tempDir.resolve(".env")), Duration.ofMillis(50), path -> {
        });

        watcher.start();
        watcher.stop();
        watcher.stop();

        assertThat(watcher.getFiles()).containsExactly(tempDir.resolve(".env").toAbsolutePath());
    }
}
