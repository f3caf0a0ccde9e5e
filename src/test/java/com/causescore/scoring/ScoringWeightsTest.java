package com.causescore.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class ScoringWeightsTest {

    @Test
    void defaults_sumToOne() {
        assertThat(ScoringWeights.defaults().validate().sum()).isCloseTo(1.0, offset(1e-9));
        assertThat(new ScoringProperties().toWeights()).isEqualTo(ScoringWeights.defaults());
    }

    @Test
    void weightsNotSummingToOne_failStartup() {
        ScoringProperties properties = new ScoringProperties();
        properties.getWeights().setGivPowerRank(0.30);

        assertThatThrownBy(properties::afterPropertiesSet)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sum to 1.0");
    }

    @Test
    void sumWithinToleranceAccepted() {
        ScoringWeights w = new ScoringWeights(0.1505, 0.10, 0.10, 0.05, 0.05, 0.20, 0.20, 0.15);
        assertThat(w.validate()).isSameAs(w);
    }

    @Test
    void negativeWeightRejected() {
        assertThatThrownBy(() -> new ScoringWeights(-0.05, 0.15, 0.15, 0.05, 0.05, 0.20, 0.20, 0.25).validate())
                .isInstanceOf(IllegalStateException.class);
    }
}
