package com.z254.horizon.client.impl;

import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.SignalFamily;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientSignalSourceClientTest {

    private final WebClientSignalSourceClient client = new WebClientSignalSourceClient(new HorizonProperties());

    @Test
    @DisplayName("should serve every family of the baseline signal set")
    void fullBaseline() {
        StepVerifier.create(client.fetchSnapshot(EnumSet.allOf(SignalFamily.class)))
                .assertNext(snapshot -> {
                    assertThat(snapshot.getMarketSignals()).hasSize(3);
                    assertThat(snapshot.getTechnologyTrends()).hasSize(2);
                    assertThat(snapshot.getRegulatoryUpdates()).hasSize(1);
                    assertThat(snapshot.getCompetitiveMoves()).hasSize(1);
                    assertThat(snapshot.getTimestamp()).isNotNull();
                    snapshot.validate();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should leave families that were not requested empty")
    void requestedFamiliesOnly() {
        StepVerifier.create(client.fetchSnapshot(EnumSet.of(SignalFamily.MARKET)))
                .assertNext(snapshot -> {
                    assertThat(snapshot.getMarketSignals()).isNotEmpty();
                    assertThat(snapshot.getTechnologyTrends()).isEmpty();
                    assertThat(snapshot.getRegulatoryUpdates()).isEmpty();
                    assertThat(snapshot.getCompetitiveMoves()).isEmpty();
                })
                .verifyComplete();
    }
}
