package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An accepted proposal being implemented.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Adaptation {

    private String id;
    private AdaptationProposal proposal;
    private AdaptationStatus status;
    private Instant startedAt;
    private Instant completedAt;
    private AdaptationResults results;
    private double lastProgress;
    private boolean resourceConstrained;
    private String constraintReason;

    public static Adaptation start(AdaptationProposal proposal, Instant now) {
        return Adaptation.builder()
                .id(proposal.getId())
                .proposal(proposal)
                .status(AdaptationStatus.IN_PROGRESS)
                .startedAt(now)
                .build();
    }
}
