package com.pdm.common.dto.issue;

import com.pdm.common.model.IssueStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EquipmentIssueTest {

    @Test
    void shouldMatchOnFirstWordInEitherDirection() {
        EquipmentIssue issue = issue("Dredge Pump", IssueStatus.CRITICAL);

        assertThat(issue.matches("Main Dredge Pump")).isTrue();
        assertThat(issue.matches("DREDGE")).isTrue();
        assertThat(issue.matches("Ballast Pump")).isFalse();
    }

    @Test
    void shouldNotMatchNullNames() {
        assertThat(issue("Dredge Pump", IssueStatus.WARNING).matches(null)).isFalse();
        assertThat(issue(null, IssueStatus.WARNING).matches("Dredge Pump")).isFalse();
    }

    @Test
    void shouldImplyProbabilityFromStatus() {
        assertThat(issue("Hoist Motor", IssueStatus.CRITICAL).impliedProbability()).isEqualTo(0.85);
        assertThat(issue("Hoist Motor", IssueStatus.WARNING).impliedProbability()).isEqualTo(0.65);
        assertThat(issue("Hoist Motor", IssueStatus.MONITORING).impliedProbability()).isEqualTo(0.45);
    }

    private static EquipmentIssue issue(String name, IssueStatus status) {
        return new EquipmentIssue(name, "Seal leakage", status, 40.0, null);
    }
}
