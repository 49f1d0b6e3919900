package com.heimdall.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Plugin JARs in configured directories ({@code plugins.paths}). Only {@code *.jar} files directly inside
 * each directory are loaded, each with its own class loader whose parent is a
 * {@link RestrictedPluginClassLoader}. Unreadable directories and broken JARs are logged and skipped.
 */
public final class DirectoryPluginSource implements PluginSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DirectoryPluginSource.class);

    private final List<Path> directories;
    // keep references so class loaders stay reachable while their plugins run
    private final List<URLClassLoader> loaders = new ArrayList<>();

    public DirectoryPluginSource(List<Path> directories) {
        this.directories = List.copyOf(directories);
    }

    @Override
    public String name() {
        return "directories" + directories;
    }

    @Override
    public List<PluginCandidate> discover() {
        List<PluginCandidate> out = new ArrayList<>();
        for (Path dir : directories) {
            if (!Files.exists(dir)) {
                log.debug("Plugin directory does not exist: {}", dir);
                continue;
            }
            if (!Files.isDirectory(dir)) {
                log.warn("Plugin path is not a directory: {}", dir);
                continue;
            }
            List<Path> jars = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.jar")) {
                stream.forEach(jars::add);
            } catch (IOException e) {
                log.warn("Failed to list plugin directory {}: {}", dir, e.getMessage());
                continue;
            }
            jars.sort(null);
            for (Path jar : jars) {
                out.addAll(loadJar(jar));
            }
        }
        return out;
    }

    private List<PluginCandidate> loadJar(Path jar) {
        try {
            URLClassLoader loader = new URLClassLoader(new URL[]{jar.toUri().toURL()}, new RestrictedPluginClassLoader());
            loaders.add(loader);
            List<PluginCandidate> found = new ServiceLoaderPluginSource("jar:" + jar.getFileName(), loader).discover();
            if (!found.isEmpty()) {
                log.info("Found {} plugin(s) in {}", found.size(), jar.getFileName());
            }
            return found;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load plugin JAR {} (skipping): {}", jar, e.getMessage(), e);
            return List.of();
        }
    }

    @Override
    public void close() {
        for (URLClassLoader loader : loaders) {
            try {
                loader.close();
            } catch (IOException e) {
                log.debug("Closing plugin class loader failed: {}", e.getMessage());
            }
        }
        loaders.clear();
    }
}
