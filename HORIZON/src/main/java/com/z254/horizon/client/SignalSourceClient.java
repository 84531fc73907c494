package com.z254.horizon.client;

import com.z254.horizon.domain.model.SignalFamily;
import com.z254.horizon.domain.model.SignalSnapshot;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Upstream source of raw environmental signals.
 */
public interface SignalSourceClient {

    /**
     * Fetch current signals for the requested families.
     * Families not requested are left empty.
     */
    Mono<SignalSnapshot> fetchSnapshot(Set<SignalFamily> families);
}
