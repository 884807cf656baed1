package com.largomodo.zipsplit.core.domain;

import java.nio.file.Path;

/**
 * The final archive file written for one part.
 *
 * @param partIndex zero-based part number encoded in the file name
 * @param path      location of the archive in the output directory
 * @param sizeBytes size of the written archive in bytes
 */
public record OutputArtifact(int partIndex, Path path, long sizeBytes) {

    private static final String FILE_NAME_PATTERN = "archive_part%03d.zip";

    /**
     * Returns the archive file name for a part, zero-padded to three digits
     * (archive_part000.zip, archive_part001.zip, ...).
     *
     * @param partIndex zero-based part number
     * @return file name of the part archive
     */
    public static String fileNameFor(int partIndex) {
        if (partIndex < 0) {
            throw new IllegalArgumentException("partIndex must not be negative, got: " + partIndex);
        }
        return String.format(FILE_NAME_PATTERN, partIndex);
    }
}
