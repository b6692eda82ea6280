package com.llmids.routing;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.llmids.features.SessionFeatures;
import com.llmids.features.TextNormalizer;

/**
 * Fixed high-confidence dangerous-request patterns. Not configurable and not weighted: a match
 * always blocks.
 */
public final class HardSafetyGuard {
    public static final String REASON = "DANGEROUS_REQUEST";

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("\\bpipe\\s*bomb\\b"),
            Pattern.compile("\\bhow\\s+(?:to|do\\s+i|can\\s+i)\\s+(?:make|build)\\s+(?:a\\s+)?bomb\\b"),
            Pattern.compile("\\bexplosive\\s+device\\b"),
            Pattern.compile("\\bghost[\\s-]*gun\\b"),
            Pattern.compile("\\b3d[\\s-]*print(?:ed|ing)?[\\s-]+(?:a\\s+)?gun\\b"),
            Pattern.compile("\\bignore\\s+(?:all|any|previous|all\\s+previous)\\s+(?:of\\s+)?(?:your\\s+)?instructions\\b"));

    private HardSafetyGuard() {
    }

    /**
     * Returns the first matching pattern in the last or aggregate user text.
     */
    public static Optional<String> detect(SessionFeatures features) {
        String lastUser = TextNormalizer.normalize(features.lastUserContent()).strip();
        String allUser = TextNormalizer.normalize(features.allUserContent()).strip();
        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(lastUser).find() || pattern.matcher(allUser).find()) {
                return Optional.of(pattern.pattern());
            }
        }
        return Optional.empty();
    }
}
