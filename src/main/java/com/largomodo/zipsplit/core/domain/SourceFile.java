package com.largomodo.zipsplit.core.domain;

import java.nio.file.Path;

/**
 * Immutable metadata for a single input file found under the input directory.
 * <p>
 * The entry name is relative to the file's own parent directory, so files from
 * different subdirectories are flattened into the archive root. Two files with the
 * same name in different subdirectories therefore produce duplicate entry names.
 * </p>
 *
 * @param absolutePath The filesystem path to the input file
 * @param relativeName The archive entry name (the bare file name)
 * @param sizeBytes    The file size in bytes (zero is allowed)
 */
public record SourceFile(Path absolutePath, String relativeName, long sizeBytes) {
    /**
     * Compact constructor that validates path, name and size.
     *
     * @throws IllegalArgumentException if any component is invalid
     */
    public SourceFile {
        if (absolutePath == null) {
            throw new IllegalArgumentException("absolutePath must not be null");
        }
        if (relativeName == null || relativeName.isBlank()) {
            throw new IllegalArgumentException("relativeName must not be null or blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException(
                "sizeBytes must not be negative, got: " + sizeBytes
            );
        }
    }

    /**
     * Creates metadata for a file, naming the entry relative to the file's own parent.
     *
     * @param file      path of the input file
     * @param sizeBytes size of the file in bytes
     * @return the source file metadata
     */
    public static SourceFile of(Path file, long sizeBytes) {
        Path absolute = file.toAbsolutePath();
        Path parent = absolute.getParent();
        String entryName = parent == null
                ? absolute.getFileName().toString()
                : parent.relativize(absolute).toString();
        return new SourceFile(absolute, entryName, sizeBytes);
    }
}
