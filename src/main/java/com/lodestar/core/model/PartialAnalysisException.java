package com.lodestar.core.model;

/**
 * Thrown when the analysis of a single file (scoring or import resolution) fails.
 * Callers catch it, record the failure, and continue with the remaining files.
 */
public class PartialAnalysisException extends RuntimeException {

    private final String path;

    public PartialAnalysisException(String path, String message) {
        super(message);
        this.path = path;
    }

    public PartialAnalysisException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** Path of the file whose analysis failed. */
    public String getPath() {
        return path;
    }
}
