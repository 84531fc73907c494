package com.z254.horizon.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-action results of an emergency protocol run.
 * Overall success is the conjunction of the action results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProtocolResult {

    /** Null when no protocol threshold was satisfied */
    private ProtocolName protocol;

    @Builder.Default
    private List<ActionResult> actionResults = new ArrayList<>();

    private boolean success;

    public static ProtocolResult none() {
        return new ProtocolResult(null, new ArrayList<>(), true);
    }

    public static ProtocolResult of(ProtocolName protocol, List<ActionResult> results) {
        boolean success = results.stream().allMatch(ActionResult::isSuccess);
        return new ProtocolResult(protocol, new ArrayList<>(results), success);
    }

    @JsonIgnore
    public boolean isExecuted() {
        return protocol != null;
    }
}
