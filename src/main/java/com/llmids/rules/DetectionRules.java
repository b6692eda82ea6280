package com.llmids.rules;

import java.util.List;

public final class DetectionRules {
    private DetectionRules() {
    }

    /**
     * The canonical rule set. Order decides label order and therefore the top reason.
     */
    public static List<DetectionRule> standard(RuleThresholds thresholds) {
        return List.of(
                new RefusalRephraseRule(thresholds.refusalMinRephrases()),
                new WeaponInstructionRule(),
                new DrugSynthesisRule(),
                new DirectPromptAttackRule(thresholds.directAttackMinKeywords()),
                new IntentEscalationRule(thresholds.escalationMinTurns()),
                new IntentTrajectoryRule(thresholds.trajectoryMinPhases()),
                new RiskVelocityRule(thresholds.velocityMinKeywordDelta(), thresholds.velocityMinSpikes()),
                new CrescendoRule(thresholds.crescendoMinKeywordDelta()));
    }
}
