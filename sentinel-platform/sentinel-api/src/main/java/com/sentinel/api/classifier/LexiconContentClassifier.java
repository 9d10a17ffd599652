package com.sentinel.api.classifier;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Default deterministic backend: keyword lexicon per category plus a few spam patterns.
 * Each hit adds the category's hit weight; the result is capped at 1.0.
 */
@Component
public class LexiconContentClassifier implements ContentClassifier {

    // --- lexicon ---
    private static final Map<RiskCategory, List<String>> LEXICON = Map.of(
            RiskCategory.TOXICITY, List.of(
                    "idiot", "stupid", "loser", "trash", "moron", "dumb", "shut up", "pathetic", "worthless"),
            RiskCategory.HARASSMENT, List.of(
                    "nobody likes you", "go away", "kill yourself", "kys", "ugly", "you suck",
                    "i know where you live", "leave the stream", "get out"),
            RiskCategory.HATE_SPEECH, List.of(
                    "subhuman", "vermin", "go back to your country", "inferior race", "degenerates",
                    "ethnic cleansing", "should be exterminated"),
            RiskCategory.SEXUAL_CONTENT, List.of(
                    "nudes", "send pics", "sexy", "explicit", "onlyfans", "hook up", "naked"),
            RiskCategory.THREAT, List.of(
                    "i will kill", "i'll kill", "hurt you", "find you", "shoot", "bomb", "you're dead",
                    "watch your back"),
            RiskCategory.SPAM, List.of(
                    "free followers", "click here", "buy now", "promo code", "giveaway", "dm me for",
                    "check my profile", "subscribe to"));

    private static final Map<RiskCategory, Double> HIT_WEIGHT = Map.of(
            RiskCategory.TOXICITY, 0.35,
            RiskCategory.HARASSMENT, 0.45,
            RiskCategory.HATE_SPEECH, 0.60,
            RiskCategory.SEXUAL_CONTENT, 0.40,
            RiskCategory.THREAT, 0.60,
            RiskCategory.SPAM, 0.30);

    // --- spam patterns ---
    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)\\S+");
    private static final Pattern REPEATED_CHAR = Pattern.compile("(.)\\1{7,}");
    private static final Pattern REPEATED_WORD = Pattern.compile("(?i)\\b(\\w+)(?:\\W+\\1\\b){4,}");

    @Override
    public Map<RiskCategory, Double> score(String text) {
        EnumMap<RiskCategory, Double> scores = new EnumMap<>(RiskCategory.class);
        for (RiskCategory category : RiskCategory.values()) {
            scores.put(category, 0.0);
        }
        if (text == null || text.isBlank()) {
            return scores;
        }
        String normalized = text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();

        for (Map.Entry<RiskCategory, List<String>> entry : LEXICON.entrySet()) {
            int hits = countHits(normalized, entry.getValue());
            scores.put(entry.getKey(), Math.min(1.0, hits * HIT_WEIGHT.get(entry.getKey())));
        }

        double spam = scores.get(RiskCategory.SPAM);
        if (URL.matcher(text).find()) spam += 0.25;
        if (REPEATED_CHAR.matcher(text).find()) spam += 0.20;
        if (REPEATED_WORD.matcher(text).find()) spam += 0.30;
        if (isShouting(text)) {
            spam += 0.15;
            scores.put(RiskCategory.TOXICITY, Math.min(1.0, scores.get(RiskCategory.TOXICITY) + 0.10));
        }
        scores.put(RiskCategory.SPAM, Math.min(1.0, spam));
        return scores;
    }

    private static int countHits(String s, List<String> keywords) {
        int hits = 0;
        for (String keyword : keywords) {
            if (s.contains(keyword)) hits++;
        }
        return hits;
    }

    private static boolean isShouting(String text) {
        long letters = text.chars().filter(Character::isLetter).count();
        if (letters < 12) {
            return false;
        }
        long upper = text.chars().filter(Character::isUpperCase).count();
        return upper * 10 >= letters * 8;
    }
}
