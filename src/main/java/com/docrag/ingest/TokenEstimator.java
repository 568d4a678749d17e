package com.docrag.ingest;

/**
 * Word-count token heuristic shared by chunking, context budgeting and provider pre-flight checks.
 * Estimates are {@code floor(words / wordsPerToken)}.
 */
public class TokenEstimator {
    public static final double DEFAULT_WORDS_PER_TOKEN = 0.75;

    private final double wordsPerToken;

    public TokenEstimator() {
        this(DEFAULT_WORDS_PER_TOKEN);
    }

    public TokenEstimator(double wordsPerToken) {
        if (wordsPerToken <= 0) {
            throw new IllegalArgumentException("wordsPerToken must be positive: " + wordsPerToken);
        }
        this.wordsPerToken = wordsPerToken;
    }

    public int estimate(String text) {
        return tokensForWords(wordCount(text));
    }

    public int tokensForWords(int words) {
        return (int) (words / wordsPerToken);
    }

    public int wordsForTokens(int tokens) {
        return (int) (tokens * wordsPerToken);
    }

    public double wordsPerToken() {
        return wordsPerToken;
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.strip().split("\\s+").length;
    }
}
