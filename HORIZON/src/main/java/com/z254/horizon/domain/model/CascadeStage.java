package com.z254.horizon.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CascadeStage {

    private int stageNumber;
    private String description;
    private double varietyLevel;
    private SystemImpact systemImpact;

    /** Null for a stage of indefinite duration */
    private Duration duration;

    @JsonIgnore
    public boolean isIndefinite() {
        return duration == null;
    }
}
