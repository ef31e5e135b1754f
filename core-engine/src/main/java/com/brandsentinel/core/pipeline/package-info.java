/**
 * Pluggable pipeline stage contracts and the plumbing they share.
 *
 * <p>
 * Four roles make up the pipeline:
 * </p>
 * <ul>
 * <li>{@link com.brandsentinel.core.pipeline.Source}: produces events</li>
 * <li>{@link com.brandsentinel.core.pipeline.Enricher}: augments an event</li>
 * <li>{@link com.brandsentinel.core.pipeline.Detector}: classifies an event
 * into zero or more results</li>
 * <li>{@link com.brandsentinel.core.pipeline.Enforcer}: acts on a threat</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new variant, implement the role interface and register it in
 * {@code com.brandsentinel.core.engine.StageFactory}. The engine itself only
 * depends on these interfaces.
 * </p>
 *
 * @since 1.0.0
 */
package com.brandsentinel.core.pipeline;
