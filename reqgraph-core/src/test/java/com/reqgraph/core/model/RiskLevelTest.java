package com.reqgraph.core.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLevelTest {

    @ParameterizedTest
    @CsvSource({
        "0, LOW",
        "2, LOW",
        "3, MEDIUM",
        "4, MEDIUM",
        "5, HIGH",
        "7, HIGH",
        "8, CRITICAL"
    })
    void fromScore_mapsThresholds(int score, RiskLevel expected) {
        assertThat(RiskLevel.fromScore(score)).isEqualTo(expected);
    }

    @Test
    void requiresMitigation_onlyForHighAndCritical() {
        assertThat(RiskLevel.LOW.requiresMitigation()).isFalse();
        assertThat(RiskLevel.MEDIUM.requiresMitigation()).isFalse();
        assertThat(RiskLevel.HIGH.requiresMitigation()).isTrue();
        assertThat(RiskLevel.CRITICAL.requiresMitigation()).isTrue();
    }

    @Test
    void impactLevel_fromDistance() {
        assertThat(ImpactLevel.fromDistance(-1)).isEqualTo(ImpactLevel.NONE);
        assertThat(ImpactLevel.fromDistance(1)).isEqualTo(ImpactLevel.HIGH);
        assertThat(ImpactLevel.fromDistance(2)).isEqualTo(ImpactLevel.MEDIUM);
        assertThat(ImpactLevel.fromDistance(4)).isEqualTo(ImpactLevel.LOW);
    }
}
