package admit.core.model;

/**
 * Outcome of an admission check. DENY is a normal result, not an error.
 */
public enum Decision {
    ALLOW,
    DENY;

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
