package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MitigationOption {

    private Strategy strategy;
    private double effectiveness;
    private SignalLevel cost;
    private Timeframe timeframe;

    public enum Strategy {
        INCREASE_INTERNAL_VARIETY,
        FILTER_EXTERNAL_VARIETY,
        SPAWN_META_SYSTEM
    }

    public enum Timeframe {
        IMMEDIATE,
        DELAYED
    }
}
