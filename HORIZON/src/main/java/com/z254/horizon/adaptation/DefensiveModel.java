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
 * Protects the core under urgent threats.
 */
@Component
public class DefensiveModel implements AdaptationModel {

    @Override
    public ModelType type() {
        return ModelType.DEFENSIVE;
    }

    @Override
    public List<String> generateActions(Challenge challenge) {
        List<String> actions = new ArrayList<>(List.of("strengthen_core", "reduce_exposure"));
        if (challenge.getType() == ChallengeType.HEALTH) {
            actions.add("emergency_stabilization");
        }
        return actions;
    }

    @Override
    public double estimateImpact(Challenge challenge) {
        return 0.3 + 0.1 * challenge.getScope().getWeight();
    }

    @Override
    public ResourceRequirement estimateResources(Challenge challenge) {
        return new ResourceRequirement("1_month", SignalLevel.MEDIUM);
    }

    @Override
    public String estimateTimeline(Challenge challenge) {
        return "2_months";
    }

    @Override
    public List<String> identifyRisks(Challenge challenge) {
        return List.of("opportunity_loss", "competitive_disadvantage");
    }
}
