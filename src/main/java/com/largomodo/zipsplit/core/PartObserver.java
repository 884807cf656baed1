package com.largomodo.zipsplit.core;

import com.largomodo.zipsplit.core.domain.OutputArtifact;
import com.largomodo.zipsplit.core.domain.PartLayout;

import java.util.List;

/**
 * Observer interface for archive part lifecycle events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override
 * only the events they care about. Callbacks run on the thread driving
 * {@link ArchiveProcessor}, one part at a time.
 * </p>
 *
 * @see ArchiveProcessor
 */
public interface PartObserver {

    /**
     * Called once, after all parts have been planned and before any is built.
     *
     * @param layouts the full part plan
     */
    default void onPlanned(List<PartLayout> layouts) {}

    /**
     * Called when a part's buffer has been selected and compression begins.
     *
     * @param layout     the part being built
     * @param diskBacked whether the part is staged in a temporary file
     */
    default void onPartStart(PartLayout layout, boolean diskBacked) {}

    /**
     * Called after a part's archive has been written and its buffer disposed.
     *
     * @param layout   the part that was built
     * @param artifact the written archive
     */
    default void onPartWritten(PartLayout layout, OutputArtifact artifact) {}

    /**
     * Called when a part fails. The run stops after this callback.
     *
     * @param layout the part that failed
     * @param e      the exception that caused the failure
     */
    default void onFailure(PartLayout layout, Exception e) {}
}
