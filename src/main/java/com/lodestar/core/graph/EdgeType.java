package com.lodestar.core.graph;

/**
 * Kind of relationship between two project files.
 */
public enum EdgeType {
    /** The source file imports or references the target file. */
    IMPORT,
    /** The source file is a test exercising the target file. */
    TEST_OF
}
