package com.llmids.features;

import java.util.List;

/**
 * Deterministic per-session aggregates derived from the event history. Recomputed on every
 * scoring call and never persisted.
 */
public record SessionFeatures(
        int turnCount,
        int userTurnCount,
        int assistantTurnCount,
        int userMessageCount,
        int assistantMessageCount,
        int refusalCount,
        List<Integer> refusalTurnIds,
        int rephraseCount,
        List<RephraseHit> rephraseHits,
        int sensitiveKeywordTotal,
        List<KeywordCount> userKeywordProgression,
        List<KeywordDelta> keywordDeltas,
        int maxUserKeywordDelta,
        List<Integer> increaseTurns,
        String lastUserContent,
        String allUserContent,
        List<TurnText> userTurnTexts) {

    public SessionFeatures {
        refusalTurnIds = List.copyOf(refusalTurnIds);
        rephraseHits = List.copyOf(rephraseHits);
        userKeywordProgression = List.copyOf(userKeywordProgression);
        keywordDeltas = List.copyOf(keywordDeltas);
        increaseTurns = List.copyOf(increaseTurns);
        userTurnTexts = List.copyOf(userTurnTexts);
        lastUserContent = lastUserContent == null ? "" : lastUserContent;
        allUserContent = allUserContent == null ? "" : allUserContent;
    }

    public static SessionFeatures empty() {
        return new SessionFeatures(0, 0, 0, 0, 0, 0, List.of(), 0, List.of(), 0,
                List.of(), List.of(), 0, List.of(), "", "", List.of());
    }

    public int maxUserKeywordCount() {
        return userKeywordProgression.stream().mapToInt(KeywordCount::count).max().orElse(0);
    }
}
