package com.z254.horizon.adaptation;

import com.z254.horizon.domain.model.Challenge;
import com.z254.horizon.domain.model.ModelType;
import com.z254.horizon.domain.model.ResourceRequirement;

import java.util.List;

/**
 * Strategy for turning a challenge into the parts of an adaptation proposal.
 * Implementations are pure functions of the challenge.
 */
public interface AdaptationModel {

    ModelType type();

    List<String> generateActions(Challenge challenge);

    /**
     * Expected impact in [0,1], scaled by the challenge scope.
     */
    double estimateImpact(Challenge challenge);

    ResourceRequirement estimateResources(Challenge challenge);

    /**
     * Timeline key understood by {@link TimelineResolver}.
     */
    String estimateTimeline(Challenge challenge);

    List<String> identifyRisks(Challenge challenge);
}
