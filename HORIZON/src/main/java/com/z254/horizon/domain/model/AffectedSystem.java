package com.z254.horizon.domain.model;

/**
 * Subsystems reached by a cascade, in escalation order.
 */
public enum AffectedSystem {
    SYSTEM3_CONTROL(1.0),
    SYSTEM1_OPERATIONS(2.0),
    SYSTEM2_COORDINATION(3.0),
    SYSTEM5_POLICY(4.0),
    TOTAL_SYSTEM_FAILURE(5.0);

    private final double capacityMultiple;

    AffectedSystem(double capacityMultiple) {
        this.capacityMultiple = capacityMultiple;
    }

    /** Multiple of internal capacity the variety must exceed to reach this subsystem. */
    public double getCapacityMultiple() {
        return capacityMultiple;
    }
}
