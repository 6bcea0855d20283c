package com.rigdef.resource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves resources by file name inside a set of directories, searched recursively.
 *
 * File names are compared case-insensitively. The resource group is not used to narrow the
 * search: all configured directories form a single group.
 */
public class DirectoryResourceLocator implements ResourceLocator {
    private static final Logger log = LoggerFactory.getLogger(DirectoryResourceLocator.class);

    private final Set<String> knownNames = new HashSet<>();

    public DirectoryResourceLocator(List<Path> directories) {
        for (Path dir : directories) {
            index(dir);
        }
        log.debug("Indexed {} resource files from {}", knownNames.size(), directories);
    }

    private void index(Path dir) {
        if (!Files.isDirectory(dir)) {
            log.warn("Resource directory does not exist: {}", dir);
            return;
        }
        try (Stream<Path> files = Files.walk(dir)) {
            files.filter(Files::isRegularFile)
                    .forEach(p -> knownNames.add(p.getFileName().toString().toLowerCase(Locale.ROOT)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to index resource directory " + dir, e);
        }
    }

    @Override
    public boolean exists(String group, String name) {
        return name != null && knownNames.contains(name.toLowerCase(Locale.ROOT));
    }
}
