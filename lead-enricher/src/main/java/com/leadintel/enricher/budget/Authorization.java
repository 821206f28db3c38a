package com.leadintel.enricher.budget;

import java.math.BigDecimal;

/**
 * Result of a pre-call budget check. Denial is a control-flow signal, not an error.
 *
 * @param grant          the reservation, null when denied
 * @param deniedBy       window that refused, e.g. "hunter_io/MONTH"; null when granted
 * @param remainingCost  remaining cost in the refusing window, null when granted or not cost-capped
 */
public record Authorization(Grant grant, String deniedBy, BigDecimal remainingCost) {

    public static Authorization granted(Grant grant) {
        return new Authorization(grant, null, null);
    }

    public static Authorization denied(String deniedBy, BigDecimal remainingCost) {
        return new Authorization(null, deniedBy, remainingCost);
    }

    public boolean isGranted() {
        return grant != null;
    }
}
