package com.llmids.features;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

import com.llmids.event.Event;

/**
 * Turns a session's raw event list into {@link SessionFeatures}. Pure and deterministic: events
 * are grouped by turn id, and within a turn the last message of a role is the one that counts.
 */
public class SessionFeatureExtractor {
    private static final List<Pattern> REFUSAL_PATTERNS = List.of(
            Pattern.compile("\\bi can'?t\\b"),
            Pattern.compile("\\bi cannot\\b"),
            Pattern.compile("\\bi'?m sorry\\b"),
            Pattern.compile("\\bi won'?t\\b"),
            Pattern.compile("\\bcan'?t help\\b"),
            Pattern.compile("\\bnot able to\\b"),
            Pattern.compile("\\bcan'?t do that\\b"));

    private final FeatureConfig config;
    private final List<String> keywords;

    public SessionFeatureExtractor() {
        this(FeatureConfig.defaults());
    }

    public SessionFeatureExtractor(FeatureConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.keywords = config.sensitiveKeywords().stream()
                .map(TextNormalizer::normalize)
                .map(String::trim)
                .filter(keyword -> !keyword.isEmpty())
                .distinct()
                .toList();
    }

    public SessionFeatures extract(List<Event> events) {
        if (events == null || events.isEmpty()) {
            return SessionFeatures.empty();
        }
        NavigableMap<Integer, List<Event>> byTurn = groupByTurn(events);

        int userTurns = 0;
        int assistantTurns = 0;
        int userMessages = 0;
        int assistantMessages = 0;
        int keywordTotal = 0;
        List<Integer> refusalTurnIds = new ArrayList<>();
        List<String> allUserMessages = new ArrayList<>();

        for (Map.Entry<Integer, List<Event>> turn : byTurn.entrySet()) {
            boolean hasUser = false;
            boolean hasAssistant = false;
            boolean refusal = false;
            for (Event event : turn.getValue()) {
                if (event.isUser()) {
                    userMessages++;
                    hasUser = true;
                    allUserMessages.add(event.content());
                } else if (event.isAssistant()) {
                    assistantMessages++;
                    hasAssistant = true;
                    refusal = refusal || isRefusal(event.content());
                }
                keywordTotal += keywordCount(event.content());
            }
            userTurns += hasUser ? 1 : 0;
            assistantTurns += hasAssistant ? 1 : 0;
            if (refusal) {
                refusalTurnIds.add(turn.getKey());
            }
        }

        List<RephraseHit> rephraseHits = findRephrases(byTurn, refusalTurnIds);

        List<TurnText> userTurnTexts = new ArrayList<>();
        List<KeywordCount> progression = new ArrayList<>();
        for (Map.Entry<Integer, List<Event>> turn : byTurn.entrySet()) {
            lastUserMessage(turn.getValue()).ifPresent(text -> {
                userTurnTexts.add(new TurnText(turn.getKey(), text));
                progression.add(new KeywordCount(turn.getKey(), keywordCount(text)));
            });
        }

        List<KeywordDelta> deltas = new ArrayList<>();
        List<Integer> increaseTurns = new ArrayList<>();
        int maxDelta = 0;
        for (int i = 1; i < progression.size(); i++) {
            KeywordCount current = progression.get(i);
            int delta = current.count() - progression.get(i - 1).count();
            deltas.add(new KeywordDelta(current.turnId(), delta));
            if (delta > 0) {
                increaseTurns.add(current.turnId());
            }
            maxDelta = Math.max(maxDelta, delta);
        }

        String lastUserContent = userTurnTexts.isEmpty() ? "" : userTurnTexts.get(userTurnTexts.size() - 1).text();

        return new SessionFeatures(
                byTurn.size(),
                userTurns,
                assistantTurns,
                userMessages,
                assistantMessages,
                refusalTurnIds.size(),
                refusalTurnIds,
                rephraseHits.size(),
                rephraseHits,
                keywordTotal,
                progression,
                deltas,
                maxDelta,
                increaseTurns,
                lastUserContent,
                String.join("\n", allUserMessages),
                userTurnTexts);
    }

    public List<TurnFeatures> extractTurns(List<Event> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        List<TurnFeatures> turns = new ArrayList<>();
        for (Map.Entry<Integer, List<Event>> turn : groupByTurn(events).entrySet()) {
            List<Event> turnEvents = turn.getValue();
            Optional<String> lastUser = lastUserMessage(turnEvents);
            turns.add(new TurnFeatures(
                    turn.getKey(),
                    lastUser.isPresent(),
                    turnEvents.stream().anyMatch(Event::isAssistant),
                    lastUser.map(this::keywordCount).orElse(0),
                    turnEvents.stream().filter(Event::isAssistant).anyMatch(event -> isRefusal(event.content())),
                    List.copyOf(turnEvents)));
        }
        return turns;
    }

    /**
     * Number of distinct sensitive keywords present in the text.
     */
    public int keywordCount(String text) {
        String normalized = TextNormalizer.normalize(text);
        int count = 0;
        for (String keyword : keywords) {
            if (normalized.contains(keyword)) {
                count++;
            }
        }
        return count;
    }

    public static boolean isRefusal(String text) {
        String normalized = TextNormalizer.normalize(text);
        return REFUSAL_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(normalized).find());
    }

    private List<RephraseHit> findRephrases(NavigableMap<Integer, List<Event>> byTurn, List<Integer> refusalTurnIds) {
        List<RephraseHit> hits = new ArrayList<>();
        for (int refusalTurn : refusalTurnIds) {
            Optional<TurnText> original = triggeringUserTurn(byTurn, refusalTurn);
            if (original.isEmpty()) {
                continue;
            }
            int checked = 0;
            for (Map.Entry<Integer, List<Event>> later : byTurn.tailMap(refusalTurn, false).entrySet()) {
                Optional<String> candidate = lastUserMessage(later.getValue());
                if (candidate.isEmpty()) {
                    continue;
                }
                checked++;
                double similarity = TextNormalizer.jaccard(original.get().text(), candidate.get());
                if (similarity >= config.rephraseSimilarityThreshold()) {
                    hits.add(new RephraseHit(
                            original.get().turnId(),
                            refusalTurn,
                            later.getKey(),
                            TextNormalizer.round3(similarity)));
                    break;
                }
                if (checked >= config.rephraseWindowTurns()) {
                    break;
                }
            }
        }
        return hits;
    }

    // The refusal's own turn counts when the user message shares the turn id with the reply.
    private static Optional<TurnText> triggeringUserTurn(NavigableMap<Integer, List<Event>> byTurn, int refusalTurn) {
        for (Map.Entry<Integer, List<Event>> turn : byTurn.headMap(refusalTurn, true).descendingMap().entrySet()) {
            Optional<String> text = lastUserMessage(turn.getValue());
            if (text.isPresent()) {
                return Optional.of(new TurnText(turn.getKey(), text.get()));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> lastUserMessage(List<Event> turnEvents) {
        String last = null;
        for (Event event : turnEvents) {
            if (event.isUser()) {
                last = event.content();
            }
        }
        return Optional.ofNullable(last);
    }

    private static NavigableMap<Integer, List<Event>> groupByTurn(List<Event> events) {
        NavigableMap<Integer, List<Event>> byTurn = new TreeMap<>();
        for (Event event : events) {
            byTurn.computeIfAbsent(event.turnId(), ignored -> new ArrayList<>()).add(event);
        }
        return byTurn;
    }
}
