/**
 * The {@link com.brandsentinel.core.engine.Engine} that wires storage,
 * statistics and the configured stages into a running pipeline, and the
 * {@link com.brandsentinel.core.engine.StageFactory} that builds the stages.
 */
package com.brandsentinel.core.engine;
