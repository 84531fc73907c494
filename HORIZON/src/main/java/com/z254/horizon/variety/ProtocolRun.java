package com.z254.horizon.variety;

import com.z254.horizon.domain.model.ProtocolAction;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-run bookkeeping that makes protocol actions idempotent: an action
 * applied once in a run is not applied again, and at most one meta-system
 * spawn is requested.
 */
public class ProtocolRun {

    private final Set<ProtocolAction> activeMeasures;
    private final Set<ProtocolAction> applied = EnumSet.noneOf(ProtocolAction.class);
    private boolean metaSystemRequested;

    /**
     * @param activeMeasures the monitor's live set of active measures, updated in place
     */
    public ProtocolRun(Set<ProtocolAction> activeMeasures) {
        this.activeMeasures = activeMeasures;
    }

    public Set<ProtocolAction> getActiveMeasures() {
        return activeMeasures;
    }

    boolean markApplied(ProtocolAction action) {
        return applied.add(action);
    }

    boolean markMetaSystemRequested() {
        if (metaSystemRequested) {
            return false;
        }
        metaSystemRequested = true;
        return true;
    }

    public boolean isMetaSystemRequested() {
        return metaSystemRequested;
    }
}
