package com.largomodo.debpartial.service.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stages index files next to their final location and promotes them once fully written.
 * <p>
 * A staged file is a hidden {@code .part} file in the target directory, so promotion is a
 * same-directory rename and a reader never observes a half-written index. Staged files that
 * were never promoted (emission aborted midway) are removed on {@link #close()}.
 */
public class EmissionWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EmissionWorkspace.class);

    private final Path root;
    private final List<Path> trackedFiles = new ArrayList<>();

    /**
     * @param root destination root all staged files live under
     */
    public EmissionWorkspace(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Creates the target's directory and an empty staged file beside the target.
     *
     * @param target final location of the file
     * @return staged file to write to, tracked for cleanup
     * @throws IOException if the directory or file cannot be created
     */
    public Path stage(Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path staged = Files.createTempFile(dir, "." + target.getFileName(), ".part");
        track(staged);
        return staged;
    }

    /**
     * Track a file for deletion on close().
     */
    public void track(Path artifact) {
        trackedFiles.add(artifact);
    }

    /**
     * Keep a file on close().
     */
    public void markAsOutput(Path finalFile) {
        trackedFiles.remove(finalFile);
    }

    /**
     * Moves a staged file onto its target, replacing an existing one.
     * <p>
     * Falls back to copy and delete when the file system cannot move atomically.
     *
     * @param staged file returned by {@link #stage(Path)}
     * @param target final location
     * @throws IOException if the move or the fallback fails
     */
    public void promoteToFinal(Path staged, Path target) throws IOException {
        if (Files.exists(target)) {
            log.debug("Replacing existing file: {}", target);
        }

        try {
            Files.move(staged, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.copy(staged, target, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.delete(staged);
            } catch (IOException deleteEx) {
                IOException compositeEx = new IOException(
                        "Atomic move unsupported and cleanup failed for: " + staged, e);
                compositeEx.addSuppressed(deleteEx);
                throw compositeEx;
            }
        }

        markAsOutput(staged);
    }

    /**
     * Deletes staged files that were never promoted.
     *
     * @throws CleanupException if any of them cannot be deleted
     */
    @Override
    public void close() throws CleanupException {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Thread interrupted, skipping cleanup under: {}", root);
            return;
        }

        Collections.reverse(trackedFiles);
        List<IOException> failures = new ArrayList<>();

        for (Path artifact : trackedFiles) {
            try {
                Files.deleteIfExists(artifact);
            } catch (IOException e) {
                failures.add(e);
                log.warn("Cleanup failed for staged file: {}", artifact, e);
            }
        }
        trackedFiles.clear();

        if (!failures.isEmpty()) {
            throw new CleanupException(
                    "Cleanup encountered " + failures.size() + " failure(s) under: " + root,
                    failures);
        }
    }
}
