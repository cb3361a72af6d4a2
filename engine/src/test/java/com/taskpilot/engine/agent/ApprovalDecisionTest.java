package com.taskpilot.engine.agent;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ApprovalDecisionTest {

    @ParameterizedTest
    @ValueSource(strings = {"approve", "APPROVE", " approved ", "yes", "y"})
    void approvals(String reply) {
        assertThat(ApprovalDecision.parse(reply)).isEqualTo(ApprovalDecision.APPROVE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"always_allow", "always-allow", "Always Allow", "always"})
    void alwaysAllow(String reply) {
        assertThat(ApprovalDecision.parse(reply)).isEqualTo(ApprovalDecision.ALWAYS_ALLOW);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"deny", "no", "", "approve it please", "not now"})
    void everythingElseIsDenial(String reply) {
        assertThat(ApprovalDecision.parse(reply)).isEqualTo(ApprovalDecision.DENY);
    }
}
