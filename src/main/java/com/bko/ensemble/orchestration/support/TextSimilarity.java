package com.bko.ensemble.orchestration.support;

import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Token-set agreement between free-text responses. Tokens are lower-cased words longer than two characters.
 */
public final class TextSimilarity {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextSimilarity() {
    }

    public static Set<String> tokenize(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String cleaned = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return Arrays.stream(WHITESPACE.split(cleaned))
                .filter(token -> token.length() > 2)
                .collect(Collectors.toCollection(HashSet::new));
    }

    public static double jaccard(String left, String right) {
        Set<String> a = tokenize(left);
        Set<String> b = tokenize(right);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 1.0;
        }
        long shared = a.stream().filter(b::contains).count();
        return (double) shared / union.size();
    }

    /**
     * Mean pairwise similarity of one round. Fewer than two responses trivially agree.
     */
    public static double roundScore(List<String> responses) {
        if (responses.size() < 2) {
            return 1.0;
        }
        double total = 0;
        int pairs = 0;
        for (int i = 0; i < responses.size(); i++) {
            for (int j = i + 1; j < responses.size(); j++) {
                total += jaccard(responses.get(i), responses.get(j));
                pairs++;
            }
        }
        return total / pairs;
    }

    /**
     * Index of the response with the highest average similarity to the others; ties keep the earlier index.
     */
    public static int representativeIndex(List<String> responses) {
        if (responses.size() < 2) {
            return responses.isEmpty() ? -1 : 0;
        }
        int best = 0;
        double bestScore = -1;
        for (int i = 0; i < responses.size(); i++) {
            double sum = 0;
            for (int j = 0; j < responses.size(); j++) {
                if (i != j) {
                    sum += jaccard(responses.get(i), responses.get(j));
                }
            }
            double average = sum / (responses.size() - 1);
            if (average > bestScore) {
                bestScore = average;
                best = i;
            }
        }
        return best;
    }
}
