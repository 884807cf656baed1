package com.largomodo.zipsplit.core.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileTest {

    @TempDir
    Path tempDir;

    @Test
    void testEntryNameIsRelativeToOwnParentNotInputRoot() {
        // Deliberate flattening: nested files are named by file name only
        Path nested = tempDir.resolve("photos").resolve("2024").resolve("img.jpg");

        SourceFile file = SourceFile.of(nested, 42);

        assertEquals("img.jpg", file.relativeName());
        assertEquals(nested.toAbsolutePath(), file.absolutePath());
        assertEquals(42, file.sizeBytes());
    }

    @Test
    void testSameNameInDifferentDirectoriesCollides() {
        SourceFile a = SourceFile.of(tempDir.resolve("a").resolve("readme.txt"), 1);
        SourceFile b = SourceFile.of(tempDir.resolve("b").resolve("readme.txt"), 1);

        assertEquals(a.relativeName(), b.relativeName());
        assertNotEquals(a.absolutePath(), b.absolutePath());
    }

    @Test
    void testZeroSizeIsAllowed() {
        assertDoesNotThrow(() -> new SourceFile(tempDir.resolve("empty"), "empty", 0));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SourceFile(null, "x", 1));
        assertThrows(IllegalArgumentException.class, () -> new SourceFile(tempDir, " ", 1));
        assertThrows(IllegalArgumentException.class, () -> new SourceFile(tempDir, "x", -1));
    }

    @Test
    void testOutputFileNamesAreZeroPadded() {
        assertEquals("archive_part000.zip", OutputArtifact.fileNameFor(0));
        assertEquals("archive_part001.zip", OutputArtifact.fileNameFor(1));
        assertEquals("archive_part042.zip", OutputArtifact.fileNameFor(42));
        assertEquals("archive_part1000.zip", OutputArtifact.fileNameFor(1000));
        assertThrows(IllegalArgumentException.class, () -> OutputArtifact.fileNameFor(-1));
    }
}
