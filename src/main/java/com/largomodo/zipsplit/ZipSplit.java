package com.largomodo.zipsplit;

import com.largomodo.zipsplit.core.ArchiveProcessor;
import com.largomodo.zipsplit.core.MediaPreset;
import com.largomodo.zipsplit.core.PartBudget;
import com.largomodo.zipsplit.core.PartObserver;
import com.largomodo.zipsplit.core.SourceFileScanner;
import com.largomodo.zipsplit.core.buffer.BufferSelector;
import com.largomodo.zipsplit.core.buffer.MemoryProbe;
import com.largomodo.zipsplit.core.buffer.SystemMemoryProbe;
import com.largomodo.zipsplit.core.domain.GreedyPartPacker;
import com.largomodo.zipsplit.core.domain.OutputArtifact;
import com.largomodo.zipsplit.core.domain.PartLayout;
import com.largomodo.zipsplit.core.domain.SourceFile;
import com.largomodo.zipsplit.service.PartWriter;
import com.largomodo.zipsplit.service.ZipArchiveBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for splitting a directory tree into size-bounded ZIP parts.
 * <p>
 * Sizing options are applied strictly left to right through setter methods, so a
 * media preset clamps whatever part size was given before it, and an explicit
 * {@code --partsize} or {@code --threshold} after a preset overrides the preset:
 * - {@code --partsize 1000 --cd} results in 700 MB parts
 * - {@code --cd --partsize 1000} results in 1000 MB parts
 */
@Command(
        name = "zipsplit",
        mixinStandardHelpOptions = true,
        resourceBundle = "zipsplit.zipsplit",
        version = "${bundle:application.version}",
        header = "Splits a directory tree into size-bounded ZIP archive parts.",
        description = {
                "Compresses every file below the input directory into a numbered sequence of ZIP archives" +
                        " (archive_part000.zip, archive_part001.zip, ...) whose uncompressed input stays within" +
                        " the part size, so each part fits on one CD, DVD or Blu-ray disc.",
                "",
                "Each part is staged in memory when enough free memory is available, otherwise in a" +
                        " temporary file, before it is written to the output directory."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, unreadable input, etc.)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class ZipSplit implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ZipSplit.class);

    @Option(names = "--input", required = true, paramLabel = "DIR",
            description = "The directory to compress. All files below it are included.")
    File inputDir;

    @Option(names = "--output", required = true, paramLabel = "DIR",
            description = "The output directory for ZIP parts. Created if missing.")
    File outputDir;

    @Option(names = "--temp-dir", paramLabel = "DIR",
            description = "Directory for temporary part buffers (default: the system temp directory).")
    File tempDir;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    long partSizeMb = PartBudget.DEFAULT_PART_SIZE_MB;
    long thresholdMb = PartBudget.DEFAULT_THRESHOLD_MB;

    private MemoryProbe memoryProbe = new SystemMemoryProbe();

    public static void main(String[] args) {
        int exitCode = createCommandLine(new ZipSplit()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Builds the configured command line used by {@link #main(String[])}.
     * Execution failures are logged as a single error line and mapped to exit code 1.
     */
    static CommandLine createCommandLine(ZipSplit command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.error("FAILED: {}", ex.getMessage());
            log.debug("Failure details", ex);
            return commandLine.getCommandSpec().exitCodeOnExecutionException();
        });
        return cmd;
    }

    @Option(names = "--partsize", paramLabel = "MB",
            description = "Maximum uncompressed input per part in MB (default: " + PartBudget.DEFAULT_PART_SIZE_MB + ").")
    void setPartSizeMb(long partSizeMb) {
        this.partSizeMb = partSizeMb;
    }

    @Option(names = "--threshold", paramLabel = "MB",
            description = "Free memory in MB above which a part is staged in memory (default: "
                    + PartBudget.DEFAULT_THRESHOLD_MB + ").")
    void setThresholdMb(long thresholdMb) {
        this.thresholdMb = thresholdMb;
    }

    @Option(names = "--cd", description = "CD preset: threshold 700 MB, part size at most 700 MB.")
    void setCd(boolean enabled) {
        if (enabled) {
            applyPreset(MediaPreset.CD);
        }
    }

    @Option(names = "--dvd", description = "DVD preset: threshold 4700 MB, part size at most 4700 MB.")
    void setDvd(boolean enabled) {
        if (enabled) {
            applyPreset(MediaPreset.DVD);
        }
    }

    @Option(names = "--bluray",
            description = "Blu-ray preset: threshold 25000 MB, part size at most 25000 MB.")
    void setBluray(boolean enabled) {
        if (enabled) {
            applyPreset(MediaPreset.BLURAY);
        }
    }

    void setMemoryProbe(MemoryProbe memoryProbe) {
        this.memoryProbe = memoryProbe;
    }

    private void applyPreset(MediaPreset preset) {
        thresholdMb = preset.getCapacityMb();
        partSizeMb = preset.clampPartSizeMb(partSizeMb);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (partSizeMb <= 0) {
            throw new ParameterException(spec.commandLine(), "Part size must be positive: " + partSizeMb + " MB");
        }
        if (thresholdMb <= 0) {
            throw new ParameterException(spec.commandLine(),
                    "Memory threshold must be positive: " + thresholdMb + " MB");
        }

        if (!inputDir.exists()) {
            throw new ParameterException(spec.commandLine(),
                    "The input directory '" + inputDir.getAbsolutePath() + "' does not exist.");
        }
        if (!inputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path must be a directory, not a file: " + inputDir.getAbsolutePath());
        }

        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }
        if (tempDir != null && !tempDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Temp directory does not exist: " + tempDir.getAbsolutePath());
        }

        if (!outputDir.exists()) {
            log.info("Creating output directory '{}'.", outputDir.getAbsolutePath());
        }
        Files.createDirectories(outputDir.toPath());

        PartBudget budget;
        try {
            budget = PartBudget.ofMegabytes(partSizeMb, thresholdMb);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }

        List<SourceFile> files = new SourceFileScanner().scan(inputDir.toPath());
        log.info("Found {} file(s) in {}", files.size(), inputDir.getAbsolutePath());

        ArchiveProcessor processor = createProcessor(tempDir == null ? null : tempDir.toPath());
        List<OutputArtifact> artifacts = processor.process(files, outputDir.toPath(), budget);

        log.info("Zipping complete: {} part(s) written to {}", artifacts.size(), outputDir.getAbsolutePath());
        return 0;
    }

    private ArchiveProcessor createProcessor(Path bufferDir) {
        // Dependency injection: instantiate service implementations
        BufferSelector selector = new BufferSelector(memoryProbe, bufferDir);

        PartObserver observer = new PartObserver() {
            @Override
            public void onPlanned(List<PartLayout> layouts) {
                log.info("Planned {} part(s) of at most {} MB", layouts.size(), partSizeMb);
            }

            @Override
            public void onPartStart(PartLayout layout, boolean diskBacked) {
                log.info("Building part {}: {} file(s), {} bytes, staged in {}", layout.partIndex(),
                        layout.contents().size(), layout.totalBytes(), diskBacked ? "temp file" : "memory");
            }

            @Override
            public void onFailure(PartLayout layout, Exception e) {
                // The execution exception handler reports the failure itself
                log.debug("Part {} failed", layout.partIndex(), e);
            }
        };

        return new ArchiveProcessor(new GreedyPartPacker(), selector,
                new ZipArchiveBuilder(), new PartWriter(), observer);
    }
}
