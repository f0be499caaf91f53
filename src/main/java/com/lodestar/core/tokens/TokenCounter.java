package com.lodestar.core.tokens;

/**
 * Estimates how many model tokens a piece of text consumes.
 * <p>
 * Implementations must be pure: the same text always yields the same count, so results can
 * be cached by content hash and asserted in tests.
 */
public interface TokenCounter {

    /**
     * @param text the text to measure, may be null or empty
     * @return estimated token count, never negative
     */
    int count(String text);

    /**
     * Estimates tokens with a language-specific adjustment. Defaults to {@link #count(String)}.
     */
    default int count(String text, String language) {
        return count(text);
    }
}
