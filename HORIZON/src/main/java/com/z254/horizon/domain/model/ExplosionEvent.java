package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Recorded variety explosion or emergency response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExplosionEvent {

    private Instant timestamp;
    private ExplosionEventType eventType;

    /** Risk snapshot that triggered the event */
    private RiskReport explosionData;

    private ProtocolName protocolUsed;
    private ProtocolResult responseResult;
}
