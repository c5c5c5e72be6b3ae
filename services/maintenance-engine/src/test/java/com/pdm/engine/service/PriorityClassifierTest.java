package com.pdm.engine.service;

import com.pdm.common.model.Priority;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityClassifierTest {

    private final PriorityClassifier classifier = new PriorityClassifier();

    @Test
    void shouldClassifyByHealthThresholds() {
        assertThat(classifier.classify(29.9, 100, false)).isEqualTo(Priority.CRITICAL);
        assertThat(classifier.classify(30, 100, false)).isEqualTo(Priority.HIGH);
        assertThat(classifier.classify(50, 100, false)).isEqualTo(Priority.MEDIUM);
        assertThat(classifier.classify(70, 100, false)).isEqualTo(Priority.LOW);
    }

    @Test
    void shouldClassifyByRemainingLifeThresholds() {
        assertThat(classifier.classify(100, 9, false)).isEqualTo(Priority.CRITICAL);
        assertThat(classifier.classify(100, 10, false)).isEqualTo(Priority.HIGH);
        assertThat(classifier.classify(100, 25, false)).isEqualTo(Priority.MEDIUM);
        assertThat(classifier.classify(100, 50, false)).isEqualTo(Priority.LOW);
    }

    @Test
    void shouldEscalateHighProbabilityFailureToCritical() {
        assertThat(classifier.classify(95, 90, true)).isEqualTo(Priority.CRITICAL);
    }

    @Test
    void shouldTreatOnlyProbabilityAboveHalfAsHigh() {
        assertThat(classifier.isHighProbability(0.5)).isFalse();
        assertThat(classifier.isHighProbability(0.51)).isTrue();
    }

    @Test
    void shouldNeverBecomeMoreSevereAsHealthImproves() {
        Priority previous = Priority.CRITICAL;
        for (int health = 0; health <= 100; health++) {
            Priority current = classifier.classify(health, 100, false);
            assertThat(Priority.BY_SEVERITY.compare(current, previous)).isGreaterThanOrEqualTo(0);
            previous = current;
        }
    }
}
