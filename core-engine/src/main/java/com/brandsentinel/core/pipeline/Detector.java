package com.brandsentinel.core.pipeline;

import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.model.EventView;

import java.util.List;

/**
 * Classifies an enriched event.
 *
 * <p>
 * A detector may return no results (no signal) or several. On failure its
 * contribution for that event is simply omitted.
 * </p>
 */
public interface Detector {

    String name();

    /**
     * @param signal shared cancellation signal
     * @param event  read-only view of the enriched event
     * @return detection results; never {@code null}
     * @throws StageException if detection fails
     */
    List<DetectionResult> detect(ShutdownSignal signal, EventView event) throws StageException;
}
