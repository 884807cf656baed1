package com.largomodo.zipsplit.core;

import com.largomodo.zipsplit.core.domain.SourceFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Recursively enumerates the regular files under an input directory.
 * <p>
 * Results are in ascending path order so that repeated runs over the same tree
 * produce the same parts. The order is never based on file size.
 */
public class SourceFileScanner {

    /**
     * @param inputRoot directory to scan
     * @return all regular files below inputRoot, in path order
     * @throws IOException if the tree or any file's size cannot be read
     */
    public List<SourceFile> scan(Path inputRoot) throws IOException {
        if (!Files.isDirectory(inputRoot)) {
            throw new IOException("Input path is not a directory: " + inputRoot);
        }

        List<Path> paths;
        try (Stream<Path> stream = Files.walk(inputRoot)) {
            paths = stream.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            // Subdirectory became unreadable mid-traversal
            throw e.getCause();
        }

        List<SourceFile> files = new ArrayList<>(paths.size());
        for (Path path : paths) {
            files.add(SourceFile.of(path, Files.size(path)));
        }
        return files;
    }
}
