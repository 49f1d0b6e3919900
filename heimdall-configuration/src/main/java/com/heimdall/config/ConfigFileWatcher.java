package com.heimdall.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reloads a {@link ConfigurationManager} when one of its file layers is modified on disk.
 * One daemon thread per watcher; {@link #close()} stops it.
 */
public final class ConfigFileWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigFileWatcher.class);

    private final ConfigurationManager manager;
    private final WatchService watchService;
    private final Map<Path, Set<Path>> filesByDirectory = new HashMap<>();
    private final Thread thread;
    private volatile boolean closed;

    private ConfigFileWatcher(ConfigurationManager manager, WatchService watchService) {
        this.manager = manager;
        this.watchService = watchService;
        this.thread = new Thread(this::run, "heimdall-config-watcher");
        this.thread.setDaemon(true);
    }

    /**
     * Starts watching the manager's current file layers. Files whose directory does not exist are skipped.
     */
    public static ConfigFileWatcher start(ConfigurationManager manager) throws IOException {
        ConfigFileWatcher watcher = new ConfigFileWatcher(manager, FileSystems.getDefault().newWatchService());
        watcher.register(manager.watchedFiles());
        watcher.thread.start();
        return watcher;
    }

    private void register(List<Path> files) throws IOException {
        for (Path file : files) {
            Path absolute = file.toAbsolutePath().normalize();
            Path dir = absolute.getParent();
            if (dir == null || !dir.toFile().isDirectory()) {
                log.debug("Not watching configuration file without directory | path={}", file);
                continue;
            }
            if (!filesByDirectory.containsKey(dir)) {
                dir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
            }
            filesByDirectory.computeIfAbsent(dir, d -> new HashSet<>()).add(absolute.getFileName());
        }
        log.info("Watching configuration files | directories={}", filesByDirectory.keySet());
    }

    private void run() {
        while (!closed) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = (Path) key.watchable();
            Set<Path> names = filesByDirectory.getOrDefault(dir, Set.of());
            boolean relevant = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.context() instanceof Path name && names.contains(name)) {
                    relevant = true;
                }
            }
            key.reset();
            if (relevant) {
                try {
                    manager.reload();
                } catch (ConfigException e) {
                    log.warn("Configuration reload after file change rejected | error={}", e.getMessage());
                }
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        try {
            watchService.close();
        } catch (IOException e) {
            log.debug("Closing watch service failed | error={}", e.getMessage());
        }
        thread.interrupt();
    }
}
