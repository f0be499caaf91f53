package com.lodestar.core.scoring;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pulls keywords out of a free-text task description.
 * Words are lower-cased, stripped of surrounding punctuation, and kept when longer than two
 * characters and not a stop word. Order of first appearance is preserved; duplicates are dropped.
 */
public class KeywordExtractor {

    private static final String TRIM_CHARS = ".,!?;:\"'()[]{}`";

    private final Set<String> stopWords;

    public KeywordExtractor(Set<String> stopWords) {
        this.stopWords = Set.copyOf(stopWords);
    }

    public List<String> extract(String description) {
        if (description == null || description.isBlank()) {
            return List.of();
        }
        var keywords = new LinkedHashSet<String>();
        for (String raw : description.toLowerCase(Locale.ROOT).split("\\s+")) {
            String word = trim(raw);
            if (word.length() > 2 && !stopWords.contains(word)) {
                keywords.add(word);
            }
        }
        return List.copyOf(keywords);
    }

    private static String trim(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && TRIM_CHARS.indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TRIM_CHARS.indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        return word.substring(start, end);
    }
}
