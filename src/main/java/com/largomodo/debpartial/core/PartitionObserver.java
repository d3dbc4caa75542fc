package com.largomodo.debpartial.core;

/**
 * Observer interface for recoverable conditions met while selecting and partitioning packages.
 * <p>
 * None of these events stop the run. All methods have default no-op implementations,
 * allowing consumers to override only the events they care about.
 * </p>
 * <p>
 * Example usage:
 * </p>
 * <pre>{@code
 * PartitionObserver observer = new PartitionObserver() {
 *     @Override
 *     public void onMissingSource(String binary) {
 *         missing.add(binary);
 *     }
 * };
 * }</pre>
 *
 * @see LoggingPartitionObserver
 */
public interface PartitionObserver {

    /**
     * Called the first time a source catalog is asked for the source of a binary it has
     * never seen. Never called twice for the same binary on the same catalog.
     *
     * @param binary binary package name
     */
    default void onMissingSource(String binary) {}

    /**
     * Called when an oversized package is skipped under the ignore-oversized policy.
     *
     * @param packageName the skipped package
     * @param cause       details of the item (package or its source) that did not fit
     */
    default void onOversizedSkipped(String packageName, PartitionTooSmallException cause) {}

    /**
     * Called when an explicitly included package is not in the package catalog.
     *
     * @param packageName the unknown name
     */
    default void onUnknownPackage(String packageName) {}
}
