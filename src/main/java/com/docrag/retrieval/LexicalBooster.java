package com.docrag.retrieval;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Sparse keyword signal layered on top of vector scores. A candidate containing a fraction
 * {@code f} of the query keywords has its score multiplied by {@code 1 + 0.5 * f}.
 */
public class LexicalBooster {
    static final double MAX_BOOST = 0.5;
    static final int MIN_TOKEN_LENGTH = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "had", "her", "was", "one",
            "our", "out", "has", "him", "his", "how", "its", "who", "did", "yes", "she", "may", "use", "with",
            "this", "that", "from", "they", "will", "would", "there", "their", "what", "about", "which",
            "when", "make", "like", "into", "than", "then", "them", "these", "some", "could", "does", "have",
            "been", "were", "your", "also", "only", "over", "such", "where", "while", "should", "because");

    private final List<String> keywords;

    public LexicalBooster(String queryText) {
        this.keywords = List.copyOf(keywords(queryText));
    }

    public boolean hasKeywords() {
        return !keywords.isEmpty();
    }

    public List<String> keywords() {
        return keywords;
    }

    public double matchFraction(String candidateText) {
        if (keywords.isEmpty() || candidateText == null) {
            return 0.0;
        }
        Set<String> candidateTokens = new HashSet<>(Arrays.asList(tokenize(candidateText)));
        long matched = keywords.stream().filter(candidateTokens::contains).count();
        return (double) matched / keywords.size();
    }

    public double boost(double score, String candidateText) {
        return score * (1.0 + MAX_BOOST * matchFraction(candidateText));
    }

    static Set<String> keywords(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null) {
            return out;
        }
        for (String token : tokenize(text)) {
            if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    private static String[] tokenize(String text) {
        return text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_]+");
    }
}
