package com.brandsentinel.core.pipeline;

import com.brandsentinel.core.model.DetectionResult;

/**
 * Acts on a threat.
 *
 * <p>
 * Implementations must honour {@code dryRun}: when it is {@code true} they log
 * or simulate instead of performing an irreversible external action.
 * </p>
 */
public interface Enforcer {

    String name();

    /**
     * @param signal shared cancellation signal
     * @param result a detection result flagged as a threat
     * @param dryRun whether to simulate instead of acting
     * @throws StageException if the action fails
     */
    void enforce(ShutdownSignal signal, DetectionResult result, boolean dryRun) throws StageException;
}
