package com.stockalert.monitor.domain.evaluation;

public enum EvaluationOutcome {
    /** Price and check time stored; no trigger (condition not met or market closed). */
    UPDATED,
    /** Condition met, alert deactivated by this evaluation and the event dispatched. */
    TRIGGERED,
    /** Condition met but another evaluation already deactivated the alert. */
    ALREADY_LATCHED
}
