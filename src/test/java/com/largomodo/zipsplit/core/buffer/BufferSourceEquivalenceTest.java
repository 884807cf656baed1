package com.largomodo.zipsplit.core.buffer;

import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Memory and disk buffers must read back identical bytes for identical writes.
 */
class BufferSourceEquivalenceTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 1024, 65_537, 200_003})
    void testBothVariantsReadBackSameBytes(int totalBytes) throws IOException {
        byte[] data = new byte[totalBytes];
        new Random(totalBytes).nextBytes(data);

        try (BufferSource memory = new MemoryBufferSource();
             BufferSource disk = new DiskBufferSource(tempDir)) {
            // Uneven chunking mimics one write per compressed block
            int offset = 0;
            int chunk = 1;
            while (offset < totalBytes) {
                int len = Math.min(chunk, totalBytes - offset);
                memory.write(data, offset, len);
                disk.write(data, offset, len);
                offset += len;
                chunk = chunk * 3 + 1;
            }

            assertEquals(memory.size(), disk.size());
            assertArrayEquals(memory.readAll(), disk.readAll());
            assertArrayEquals(data, disk.readAll());
        }
    }
}
