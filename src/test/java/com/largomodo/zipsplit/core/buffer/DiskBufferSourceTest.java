package com.largomodo.zipsplit.core.buffer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DiskBufferSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreatesUniqueTempFileInGivenDirectory() throws IOException {
        try (DiskBufferSource first = new DiskBufferSource(tempDir);
             DiskBufferSource second = new DiskBufferSource(tempDir)) {
            assertTrue(Files.exists(first.getTempFile()));
            assertEquals(tempDir, first.getTempFile().getParent());
            assertNotEquals(first.getTempFile(), second.getTempFile(), "Temp files must be unique");
            assertTrue(first.getTempFile().getFileName().toString().startsWith(DiskBufferSource.TEMP_FILE_PREFIX));
        }
    }

    @Test
    void testNullDirectoryUsesPlatformTempDirectory() throws IOException {
        DiskBufferSource buffer = new DiskBufferSource(null);
        try {
            assertEquals(Path.of(System.getProperty("java.io.tmpdir")).toAbsolutePath().normalize(),
                    buffer.getTempFile().getParent().toAbsolutePath().normalize());
        } finally {
            buffer.dispose();
        }
        assertFalse(Files.exists(buffer.getTempFile()));
    }

    @Test
    void testIncrementalWritesAreAppended() throws IOException {
        try (DiskBufferSource buffer = new DiskBufferSource(tempDir)) {
            buffer.write("hello ".getBytes(StandardCharsets.UTF_8));
            buffer.write("world!!".getBytes(StandardCharsets.UTF_8), 0, 5);

            assertEquals(11, buffer.size());
            assertEquals("hello world", new String(buffer.readAll(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void testReadAllRewindsEveryTime() throws IOException {
        try (DiskBufferSource buffer = new DiskBufferSource(tempDir)) {
            buffer.write(new byte[]{1, 2, 3});

            assertArrayEquals(new byte[]{1, 2, 3}, buffer.readAll());
            assertArrayEquals(new byte[]{1, 2, 3}, buffer.readAll());
        }
    }

    @Test
    void testTransferToStreamsFullContents() throws IOException {
        byte[] data = new byte[300_000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (i * 31);
        }

        try (DiskBufferSource buffer = new DiskBufferSource(tempDir)) {
            buffer.write(data);
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            assertEquals(data.length, buffer.transferTo(out));
            assertArrayEquals(data, out.toByteArray());
        }
    }

    @Test
    void testDisposeDeletesTempFile() throws IOException {
        DiskBufferSource buffer = new DiskBufferSource(tempDir);
        buffer.write(new byte[]{42});

        buffer.dispose();

        assertFalse(Files.exists(buffer.getTempFile()), "Temp file should be deleted on dispose");
        try (Stream<Path> remaining = Files.list(tempDir)) {
            assertEquals(0, remaining.count());
        }
    }

    @Test
    void testDisposeToleratesAlreadyDeletedFile() throws IOException {
        DiskBufferSource buffer = new DiskBufferSource(tempDir);
        Files.delete(buffer.getTempFile());

        assertDoesNotThrow(buffer::dispose);
    }

    @Test
    void testDisposeIsIdempotent() throws IOException {
        DiskBufferSource buffer = new DiskBufferSource(tempDir);

        buffer.dispose();
        assertDoesNotThrow(buffer::dispose);
    }

    @Test
    void testWriteAfterDisposeFails() throws IOException {
        DiskBufferSource buffer = new DiskBufferSource(tempDir);
        buffer.dispose();

        assertThrows(IllegalStateException.class, () -> buffer.write(new byte[]{1}));
        assertThrows(IllegalStateException.class, buffer::readAll);
    }

    @Test
    void testMissingTempDirectoryFailsWithIOException() {
        Path missing = tempDir.resolve("does-not-exist");

        assertThrows(IOException.class, () -> new DiskBufferSource(missing));
    }

    @Test
    void testReportsDiskBacked() throws IOException {
        try (DiskBufferSource buffer = new DiskBufferSource(tempDir)) {
            assertTrue(buffer.isDiskBacked());
        }
    }
}
