package com.largomodo.zipsplit.core;

import com.largomodo.zipsplit.core.buffer.BufferSelector;
import com.largomodo.zipsplit.core.buffer.BufferSource;
import com.largomodo.zipsplit.core.domain.OutputArtifact;
import com.largomodo.zipsplit.core.domain.PartLayout;
import com.largomodo.zipsplit.core.domain.PartPacker;
import com.largomodo.zipsplit.core.domain.SourceFile;
import com.largomodo.zipsplit.service.ArchiveBuilder;
import com.largomodo.zipsplit.service.PartWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Split-archive pipeline orchestrator.
 * <p>
 * Coordinates the run:
 * 1. Plan every part up front (PartPacker)
 * 2. For each part, in order: select a buffer, compress the part's files into it,
 *    flush it to archive_partNNN.zip, dispose the buffer
 * <p>
 * Parts are built strictly one at a time, so at most one buffer is alive. The first
 * failure aborts the run; the failing part's buffer is disposed before the exception
 * propagates, and parts already written are left in place.
 */
public class ArchiveProcessor {

    private static final Logger log = LoggerFactory.getLogger(ArchiveProcessor.class);
    private static final String MDC_PART = "part";

    private final PartPacker packer;
    private final BufferSelector bufferSelector;
    private final ArchiveBuilder archiveBuilder;
    private final PartWriter partWriter;
    private final PartObserver observer;

    public ArchiveProcessor(PartPacker packer, BufferSelector bufferSelector,
                            ArchiveBuilder archiveBuilder, PartWriter partWriter) {
        this(packer, bufferSelector, archiveBuilder, partWriter, new PartObserver() {});
    }

    public ArchiveProcessor(PartPacker packer, BufferSelector bufferSelector,
                            ArchiveBuilder archiveBuilder, PartWriter partWriter,
                            PartObserver observer) {
        this.packer = packer;
        this.bufferSelector = bufferSelector;
        this.archiveBuilder = archiveBuilder;
        this.partWriter = partWriter;
        this.observer = observer;
    }

    /**
     * Archives the files into size-bounded parts inside outputDir.
     *
     * @param files     input files in enumeration order
     * @param outputDir existing destination directory
     * @param budget    part size and memory threshold for the run
     * @return written artifacts in part order, empty if files is empty
     * @throws IOException if any part cannot be built or written
     */
    public List<OutputArtifact> process(List<SourceFile> files, Path outputDir, PartBudget budget)
            throws IOException {
        List<PartLayout> layouts = packer.pack(files, budget.maxPartSizeBytes());
        observer.onPlanned(layouts);
        log.debug("Planned {} part(s) for {} file(s)", layouts.size(), files.size());

        List<OutputArtifact> artifacts = new ArrayList<>(layouts.size());
        for (PartLayout layout : layouts) {
            MDC.put(MDC_PART, OutputArtifact.fileNameFor(layout.partIndex()));
            try {
                artifacts.add(processPart(layout, outputDir, budget));
            } catch (IOException | RuntimeException e) {
                observer.onFailure(layout, e);
                throw e;
            } finally {
                MDC.remove(MDC_PART);
            }
        }
        return artifacts;
    }

    private OutputArtifact processPart(PartLayout layout, Path outputDir, PartBudget budget) throws IOException {
        // try-with-resources covers failures before PartWriter takes over; a cleanup
        // failure during an earlier error is attached to it as suppressed
        try (BufferSource buffer = bufferSelector.select(budget.memoryThresholdBytes(), layout.totalBytes())) {
            observer.onPartStart(layout, buffer.isDiskBacked());
            log.debug("Compressing {} file(s), {} bytes, into {} buffer",
                    layout.contents().size(), layout.totalBytes(), buffer.isDiskBacked() ? "disk" : "memory");

            archiveBuilder.build(layout.contents(), buffer);

            // PartWriter disposes the buffer; the second dispose on close is a no-op
            OutputArtifact artifact = partWriter.writePart(layout.partIndex(), buffer, outputDir);
            log.info("Created {}", artifact.path());
            observer.onPartWritten(layout, artifact);
            return artifact;
        }
    }
}
