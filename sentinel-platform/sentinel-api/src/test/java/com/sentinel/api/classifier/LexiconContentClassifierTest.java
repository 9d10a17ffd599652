package com.sentinel.api.classifier;

import net.jqwik.api.*;
import net.jqwik.api.constraints.StringLength;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LexiconContentClassifierTest {

    private final LexiconContentClassifier classifier = new LexiconContentClassifier();

    @Property(tries = 200)
    void scoringIsDeterministicAndBounded(@ForAll @StringLength(max = 300) String text) {
        Map<RiskCategory, Double> first = classifier.score(text);
        Map<RiskCategory, Double> second = classifier.score(text);

        assertThat(first).isEqualTo(second);
        assertThat(first.values()).allSatisfy(v -> assertThat(v).isBetween(0.0, 1.0));
    }

    @Example
    void plainGreetingScoresLow() {
        ClassificationScore score = ClassificationScore.of(classifier.score("hello everyone, great stream today"),
                CategoryWeights.defaults());

        assertThat(score.overall()).isLessThan(0.30);
    }

    @Example
    void repeatedLinksRaiseSpam() {
        Map<RiskCategory, Double> scores = classifier.score(
                "buy now buy now buy now buy now buy now www.example.com/deal");

        assertThat(scores.get(RiskCategory.SPAM)).isGreaterThan(0.0);
    }
}
