package com.z254.horizon.adaptation;

import com.z254.horizon.domain.model.Challenge;
import com.z254.horizon.domain.model.ModelType;
import com.z254.horizon.domain.model.ResourceRequirement;
import com.z254.horizon.domain.model.SignalLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural change for challenges that leave time to restructure.
 */
@Component
public class TransformationalModel implements AdaptationModel {

    @Override
    public ModelType type() {
        return ModelType.TRANSFORMATIONAL;
    }

    @Override
    public List<String> generateActions(Challenge challenge) {
        List<String> actions = new ArrayList<>(List.of("restructure_operations", "new_capabilities"));
        switch (challenge.getType()) {
            case MARKET_SHIFT -> actions.add("pivot_strategy");
            case TECHNOLOGY_DISRUPTION -> actions.add("adopt_new_tech");
            default -> { }
        }
        return actions;
    }

    @Override
    public double estimateImpact(Challenge challenge) {
        return 0.6 + 0.2 * challenge.getScope().getWeight();
    }

    @Override
    public ResourceRequirement estimateResources(Challenge challenge) {
        return new ResourceRequirement("3_months", SignalLevel.HIGH);
    }

    @Override
    public String estimateTimeline(Challenge challenge) {
        return "6_months";
    }

    @Override
    public List<String> identifyRisks(Challenge challenge) {
        return List.of("disruption", "resistance", "resource_strain");
    }
}
