package com.largomodo.debpartial.service.workspace;

import java.io.IOException;
import java.util.List;

/**
 * Thrown when staged index files left behind by an emission cannot be removed.
 * Every individual failure is attached as a suppressed exception.
 */
public class CleanupException extends RuntimeException {

    public CleanupException(String message, List<IOException> failures) {
        super(message);
        for (IOException failure : failures) {
            addSuppressed(failure);
        }
    }
}
