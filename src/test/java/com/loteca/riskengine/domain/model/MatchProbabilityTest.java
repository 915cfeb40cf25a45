package com.loteca.riskengine.domain.model;

import com.loteca.riskengine.domain.exception.InvalidProbabilityRowException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class MatchProbabilityTest {

    @Test
    void renormalizesDriftedRow() {
        MatchProbability p = MatchProbability.normalized("m1", 0.52, 0.31, 0.21);

        assertThat(p.pHome() + p.pDraw() + p.pAway()).isCloseTo(1.0, offset(1e-9));
        assertThat(p.pHome()).isCloseTo(0.52 / 1.04, offset(1e-12));
        assertThat(p.probability(Outcome.AWAY)).isEqualTo(p.pAway());
    }

    @Test
    void keepsRowThatAlreadySumsToOne() {
        MatchProbability p = MatchProbability.normalized("m1", 0.5, 0.3, 0.2);

        assertThat(p.pHome()).isEqualTo(0.5);
        assertThat(p.pDraw()).isEqualTo(0.3);
        assertThat(p.pAway()).isEqualTo(0.2);
    }

    @Test
    void rejectsNegativeProbabilityNamingTheMatch() {
        assertThatThrownBy(() -> MatchProbability.normalized("derby", 0.7, -0.1, 0.4))
                .isInstanceOf(InvalidProbabilityRowException.class)
                .hasMessageContaining("derby")
                .extracting(e -> ((InvalidProbabilityRowException) e).getMatchId())
                .isEqualTo("derby");
    }

    @Test
    void rejectsNonFiniteAndZeroRows() {
        assertThatThrownBy(() -> MatchProbability.normalized("m2", Double.NaN, 0.5, 0.5))
                .isInstanceOf(InvalidProbabilityRowException.class);
        assertThatThrownBy(() -> MatchProbability.normalized("m3", 0, 0, 0))
                .isInstanceOf(InvalidProbabilityRowException.class);
    }

    @Test
    void constructorRejectsUnnormalizedRow() {
        assertThatThrownBy(() -> new MatchProbability("m4", 0.6, 0.6, 0.6))
                .isInstanceOf(InvalidProbabilityRowException.class);
    }

    @Test
    void riskMeasureLabelsFollowAlpha() {
        assertThat(new RiskMeasure(0.95, 1, 2).varLabel()).isEqualTo("VaR95");
        assertThat(new RiskMeasure(0.95, 1, 2).esLabel()).isEqualTo("ES95");
        assertThat(new RiskMeasure(0.975, 1, 2).varLabel()).isEqualTo("VaR97.5");
    }
}
