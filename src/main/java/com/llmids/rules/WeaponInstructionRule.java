package com.llmids.rules;

import java.util.List;
import java.util.regex.Pattern;

import com.llmids.features.SessionFeatures;

public class WeaponInstructionRule implements DetectionRule {
    public static final String LABEL = "WEAPON_INSTRUCTION";

    static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\bhow\\s+(?:do\\s+i|do\\s+you|to|can\\s+i|could\\s+i|would\\s+i)\\s+"
                    + "(?:make|build|assemble|construct|wire|detonate)\\s+(?:a\\s+|an\\s+)?(?:homemade\\s+)?"
                    + "(?:bomb|pipe\\s*bomb|explosives?|ied|grenade|detonator|molotov)"),
            Pattern.compile("\\b(?:build|make|assemble|construct)\\s+(?:a\\s+|an\\s+)?(?:homemade\\s+)?"
                    + "(?:pipe\\s*bomb|explosive\\s+device|ied|car\\s+bomb)\\b"),
            Pattern.compile("\\b(?:instructions|steps|guide|recipe)\\s+(?:for|to)\\s+(?:making|building|make|build)\\s+"
                    + "(?:a\\s+|an\\s+)?(?:bomb|explosives?|grenade|detonator)"),
            Pattern.compile("\\b(?:3d[\\s-]*print(?:ed|ing)?|ghost)[\\s-]+(?:a\\s+)?(?:gun|firearm|pistol|rifle|receiver)\\b"),
            Pattern.compile("\\bhow\\s+(?:do\\s+i|to|can\\s+i)\\s+(?:convert|modify)\\s+.{0,40}?\\b(?:to|into)\\s+"
                    + "(?:full[\\s-]*auto|automatic)\\b"),
            Pattern.compile("\\b(?:make|build)\\s+(?:a\\s+|an\\s+)?(?:untraceable|homemade)\\s+"
                    + "(?:gun|firearm|silencer|suppressor)\\b"));

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public String reason() {
        return LABEL;
    }

    @Override
    public int defaultWeight() {
        return 90;
    }

    @Override
    public RuleOutcome evaluate(SessionFeatures features) {
        List<String> lastHits = TermMatcher.matchedPatterns(PATTERNS, features.lastUserContent());
        if (!lastHits.isEmpty()) {
            return RuleOutcome.hit(new Evidence(Scope.LAST_USER, lastHits));
        }
        List<String> allHits = TermMatcher.matchedPatterns(PATTERNS, features.allUserContent());
        return new RuleOutcome(!allHits.isEmpty(), new Evidence(Scope.ALL_USER, allHits));
    }

    public record Evidence(Scope scope, List<String> matchedPatterns) implements RuleEvidence {
        @Override
        public String reason() {
            return LABEL;
        }
    }
}
