package admit.java.engine;

import admit.core.model.Decision;

/**
 * Decision returned when the coordination store cannot be consulted.
 */
public enum FailureMode {
    /**
     * Admit the request. A broken store degrades to "no limit", never to an outage.
     */
    FAIL_OPEN(Decision.ALLOW),

    /**
     * Reject the request. For deployments where strict enforcement beats availability.
     */
    FAIL_CLOSED(Decision.DENY);

    private final Decision decision;

    FailureMode(Decision decision) {
        this.decision = decision;
    }

    public Decision decision() {
        return decision;
    }
}
