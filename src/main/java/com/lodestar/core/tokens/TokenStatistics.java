package com.lodestar.core.tokens;

/**
 * Breakdown of a token estimate.
 *
 * @param totalTokens        estimated tokens
 * @param words              runs of letters and digits
 * @param punctuation        Unicode punctuation characters
 * @param symbols            programming symbols and operators
 * @param lines              number of lines
 * @param characters         number of UTF-16 characters
 * @param tokensPerLine      tokens divided by lines
 * @param tokensPerWord      tokens divided by words, 0 without words
 * @param charactersPerToken characters divided by tokens, 0 without tokens
 */
public record TokenStatistics(
    int totalTokens,
    int words,
    int punctuation,
    int symbols,
    int lines,
    int characters,
    double tokensPerLine,
    double tokensPerWord,
    double charactersPerToken
) {}
