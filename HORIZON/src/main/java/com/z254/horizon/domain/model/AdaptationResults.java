package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdaptationResults {

    private boolean success;
    private double progress;
    private double efficiencyGain;
    private double effectivenessGain;
}
