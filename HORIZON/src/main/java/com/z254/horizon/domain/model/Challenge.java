package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A condition that calls for an adaptation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Challenge {

    private ChallengeType type;
    private Urgency urgency;

    @Builder.Default
    private Scope scope = Scope.TACTICAL;

    public static Challenge of(ChallengeType type, Urgency urgency, Scope scope) {
        return new Challenge(type, urgency, scope);
    }
}
