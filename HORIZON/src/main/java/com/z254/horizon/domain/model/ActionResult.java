package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionResult {

    public static final String UNKNOWN_ACTION = "unknown_action";

    private String action;
    private boolean success;
    private String detail;

    public static ActionResult ok(String action, String detail) {
        return new ActionResult(action, true, detail);
    }

    public static ActionResult failure(String action, String reason) {
        return new ActionResult(action, false, reason);
    }
}
