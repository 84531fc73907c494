package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AdaptationProposal {

    private String id;
    private Challenge challenge;
    private ModelType modelType;

    @Builder.Default
    private List<String> actions = new ArrayList<>();

    private double impact;
    private ResourceRequirement resourcesRequired;

    /** Textual timeline such as "1_month" or a number of seconds */
    private String timeline;

    @Builder.Default
    private List<String> risks = new ArrayList<>();

    private Instant createdAt;
}
