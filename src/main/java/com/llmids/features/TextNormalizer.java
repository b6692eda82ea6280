package com.llmids.features;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lowercasing, punctuation folding and token-set similarity shared by every detector.
 */
public final class TextNormalizer {
    private static final Pattern TOKEN = Pattern.compile("[a-z0-9']+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
                .replace('\u2019', '\'')
                .replace('\u2018', '\'')
                .replace('\u201c', '"')
                .replace('\u201d', '"')
                .replace('\u2014', '-')
                .replace('\u2013', '-');
    }

    public static Set<String> tokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        Matcher matcher = TOKEN.matcher(normalize(text));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * Token-set Jaccard similarity; 0 when either side has no tokens.
     */
    public static double jaccard(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new LinkedHashSet<>(left);
        union.addAll(right);
        long intersection = left.stream().filter(right::contains).count();
        return (double) intersection / union.size();
    }

    public static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
