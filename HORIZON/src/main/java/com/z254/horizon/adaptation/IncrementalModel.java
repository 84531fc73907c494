package com.z254.horizon.adaptation;

import com.z254.horizon.domain.model.Challenge;
import com.z254.horizon.domain.model.ChallengeType;
import com.z254.horizon.domain.model.ModelType;
import com.z254.horizon.domain.model.ResourceRequirement;
import com.z254.horizon.domain.model.SignalLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Small, low-risk improvements to existing operations.
 */
@Component
public class IncrementalModel implements AdaptationModel {

    @Override
    public ModelType type() {
        return ModelType.INCREMENTAL;
    }

    @Override
    public List<String> generateActions(Challenge challenge) {
        List<String> actions = new ArrayList<>(List.of("optimize_processes", "enhance_features"));
        if (challenge.getType() == ChallengeType.EFFICIENCY) {
            actions.add("streamline_operations");
        }
        return actions;
    }

    @Override
    public double estimateImpact(Challenge challenge) {
        return 0.2 + 0.1 * challenge.getScope().getWeight();
    }

    @Override
    public ResourceRequirement estimateResources(Challenge challenge) {
        return new ResourceRequirement("2_weeks", SignalLevel.LOW);
    }

    @Override
    public String estimateTimeline(Challenge challenge) {
        return "1_month";
    }

    @Override
    public List<String> identifyRisks(Challenge challenge) {
        return List.of("minimal_disruption");
    }
}
