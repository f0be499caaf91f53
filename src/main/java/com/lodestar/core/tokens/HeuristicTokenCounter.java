package com.lodestar.core.tokens;

import java.util.Locale;
import java.util.Map;

/**
 * Word/punctuation heuristic: {@code (words + punctuation + symbols) * 1.2}, truncated.
 * <p>
 * Punctuation that is also a programming symbol (brackets, {@code #}, {@code %}) is counted
 * under both, approximating how subword tokenizers split dense code.
 */
public class HeuristicTokenCounter implements TokenCounter {

    static final double SUBWORD_MULTIPLIER = 1.2;

    private static final String SYMBOL_CHARS = "{}[]()+-*/=<>!&|^~%#@$";

    private static final Map<String, Double> LANGUAGE_MULTIPLIERS = Map.of(
            "go", 1.3,
            "javascript", 1.2,
            "python", 1.1,
            "java", 1.4,
            "c++", 1.3,
            "rust", 1.2,
            "markdown", 0.8,
            "yaml", 0.9,
            "json", 1.0
    );

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int base = countWords(text) + countPunctuation(text) + countSymbols(text);
        return (int) (base * SUBWORD_MULTIPLIER);
    }

    @Override
    public int count(String text, String language) {
        return (int) (count(text) * multiplierFor(language));
    }

    /**
     * Per-language verbosity multiplier, 1.0 for unknown languages.
     */
    public double multiplierFor(String language) {
        if (language == null) {
            return 1.0;
        }
        return LANGUAGE_MULTIPLIERS.getOrDefault(language.toLowerCase(Locale.ROOT), 1.0);
    }

    public TokenStatistics statistics(String text) {
        String content = text != null ? text : "";
        int words = countWords(content);
        int punctuation = countPunctuation(content);
        int symbols = countSymbols(content);
        int lines = (int) content.chars().filter(c -> c == '\n').count() + 1;
        int characters = content.length();
        int tokens = count(content);
        return new TokenStatistics(
                tokens, words, punctuation, symbols, lines, characters,
                (double) tokens / lines,
                words > 0 ? (double) tokens / words : 0.0,
                tokens > 0 ? (double) characters / tokens : 0.0);
    }

    static int countWords(String text) {
        int words = 0;
        boolean inWord = false;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            if (Character.isLetterOrDigit(cp)) {
                if (!inWord) {
                    words++;
                    inWord = true;
                }
            } else {
                inWord = false;
            }
            i += Character.charCount(cp);
        }
        return words;
    }

    static int countPunctuation(String text) {
        return (int) text.codePoints().filter(HeuristicTokenCounter::isPunctuation).count();
    }

    static int countSymbols(String text) {
        return (int) text.chars().filter(c -> SYMBOL_CHARS.indexOf(c) >= 0).count();
    }

    private static boolean isPunctuation(int codePoint) {
        return switch (Character.getType(codePoint)) {
            case Character.CONNECTOR_PUNCTUATION,
                 Character.DASH_PUNCTUATION,
                 Character.START_PUNCTUATION,
                 Character.END_PUNCTUATION,
                 Character.INITIAL_QUOTE_PUNCTUATION,
                 Character.FINAL_QUOTE_PUNCTUATION,
                 Character.OTHER_PUNCTUATION -> true;
            default -> false;
        };
    }
}
