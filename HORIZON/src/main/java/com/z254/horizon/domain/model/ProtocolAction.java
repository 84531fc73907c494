package com.z254.horizon.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Steps an emergency protocol can execute, keyed by their configuration name.
 */
public enum ProtocolAction {
    SPAWN_META_SYSTEM("spawn_meta_system"),
    REDISTRIBUTE_VARIETY("redistribute_variety"),
    ISOLATE_SUBSYSTEMS("isolate_subsystems"),
    ACTIVATE_DAMPENERS("activate_dampeners"),
    ACTIVATE_FILTERS("activate_filters"),
    REDUCE_INPUTS("reduce_inputs"),
    REDUCE_FUNCTIONALITY("reduce_functionality"),
    PRESERVE_CORE("preserve_core");

    private final String key;

    ProtocolAction(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<ProtocolAction> fromKey(String key) {
        return Arrays.stream(values())
                .filter(action -> action.key.equals(key))
                .findFirst();
    }
}
