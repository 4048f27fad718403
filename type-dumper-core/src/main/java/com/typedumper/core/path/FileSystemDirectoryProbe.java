package com.typedumper.core.path;

import com.typedumper.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link DirectoryProbe} backed by the default filesystem.
 */
public class FileSystemDirectoryProbe implements DirectoryProbe {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDirectoryProbe.class);

    @Override
    public List<String> listDirectories(String directory) {
        Optional<Path> dir = FileUtils.toPath(directory);
        if (dir.isEmpty() || !Files.isDirectory(dir.get())) {
            log.debug("Not a directory, nothing to list: {}", directory);
            return List.of();
        }

        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(dir.get(), Files::isDirectory)) {
            for (Path child : children) {
                names.add(child.getFileName().toString());
            }
        } catch (IOException e) {
            // an unreadable directory counts as having no matches
            log.warn("Failed to list directory {}: {}", directory, e.getMessage());
            return List.of();
        }
        return names;
    }
}
