package com.trustbridge.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.monitor.FileAlterationListenerAdaptor;
import org.apache.commons.io.monitor.FileAlterationMonitor;
import org.apache.commons.io.monitor.FileAlterationObserver;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Polls the parent directories of configuration files and reports changed or re-created files.
 * A failing change handler is logged and does not affect the other files.
 */
@Slf4j
public class ConfigFileWatcher {

    private final FileAlterationMonitor monitor;
    private final List<FileAlterationObserver> observers = new ArrayList<>();
    private final List<Path> files;

    public ConfigFileWatcher(Collection<Path> files, Duration interval, Consumer<Path> onChange) {
        this.files = files.stream().map(Path::toAbsolutePath).toList();
        this.monitor = new FileAlterationMonitor(interval.toMillis());
        this.monitor.setThreadFactory(ConfigFileWatcher::newWatcherThread);

        Map<Path, Set<String>> namesByDirectory = new LinkedHashMap<>();
        for (Path file : this.files) {
            namesByDirectory.computeIfAbsent(file.getParent(), d -> new LinkedHashSet<>()).add(file.getFileName().toString());
        }
        namesByDirectory.forEach((directory, names) -> {
            FileAlterationObserver observer = new FileAlterationObserver(directory.toFile(),
                    file -> file.isFile() && names.contains(file.getName()));
            observer.addListener(new FileAlterationListenerAdaptor() {
                @Override
                public void onFileChange(File file) {
                    dispatch(file, onChange);
                }

                @Override
                public void onFileCreate(File file) {
                    dispatch(file, onChange);
                }
            });
            observers.add(observer);
            monitor.addObserver(observer);
        });
    }

    private static Thread newWatcherThread(final Runnable runnable) {
        Thread thread = new Thread(runnable, "Config-File-Watcher");
        thread.setDaemon(true);
        return thread;
    }

    private static void dispatch(File file, Consumer<Path> onChange) {
        try {
            log.info("configuration file changed: {}", file);
            onChange.accept(file.toPath().toAbsolutePath());
        } catch (Exception e) {
            log.error("Failed to reload configuration file {}: {}", file, e.getMessage(), e);
        }
    }

    public List<Path> getFiles() {
        return files;
    }

    public void start() {
        try {
            monitor.start();
        } catch (Exception e) {
            throw new IllegalStateException("Unable to watch configuration files " + files, e);
        }
    }

    public void stop() {
        try {
            monitor.stop(0);
        } catch (IllegalStateException e) {
            log.debug("configuration file watcher was not running");
        } catch (Exception e) {
            log.warn("Failed to stop configuration file watcher: {}", e.getMessage(), e);
        }
    }

    /**
     * Records the current state of the files without reporting changes. {@link #start()} does this itself.
     */
    void initialize() throws Exception {
        for (FileAlterationObserver observer : observers) {
            observer.initialize();
        }
    }

    /**
     * Runs one poll on the calling thread.
     */
    void checkNow() {
        observers.forEach(FileAlterationObserver::checkAndNotify);
    }
}
