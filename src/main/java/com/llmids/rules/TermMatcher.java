package com.llmids.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.llmids.features.TextNormalizer;

final class TermMatcher {
    private TermMatcher() {
    }

    static List<String> matchedPatterns(List<Pattern> patterns, String text) {
        String normalized = TextNormalizer.normalize(text);
        List<String> matched = new ArrayList<>();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(normalized).find()) {
                matched.add(pattern.pattern());
            }
        }
        return matched;
    }

    static List<String> matchedTerms(Pattern alternation, String text) {
        Matcher matcher = alternation.matcher(TextNormalizer.normalize(text));
        List<String> terms = new ArrayList<>();
        while (matcher.find()) {
            String term = matcher.group().trim().replaceAll("\\s+", " ");
            if (!terms.contains(term)) {
                terms.add(term);
            }
        }
        return terms;
    }

    static Pattern words(String... alternatives) {
        return Pattern.compile("\\b(?:" + String.join("|", alternatives) + ")\\b");
    }
}
