package io.github.jbellis.mdident.json;

import io.github.jbellis.mdident.identity.NodeId;

/**
 * Thrown when decoding under {@link io.github.jbellis.mdident.config.DriftPolicy#FAIL} meets a
 * persisted id that no longer matches its node's content.
 */
public class IdentityDriftException extends DocumentFormatException {
    private final IdentityDrift drift;

    public IdentityDriftException(IdentityDrift drift) {
        super("Identity drift for " + drift);
        this.drift = drift;
    }

    public IdentityDrift drift() {
        return drift;
    }

    public NodeId persisted() {
        return drift.persisted();
    }

    public NodeId recomputed() {
        return drift.recomputed();
    }
}
