/**
 * Domain model classes for Brand Sentinel.
 *
 * <p>
 * Values flowing through the processing pipeline:
 * </p>
 * <ul>
 * <li>{@link com.brandsentinel.core.model.Event}: one observed occurrence
 * from a source, enriched in place</li>
 * <li>{@link com.brandsentinel.core.model.EventView}: read-only view handed
 * to detectors</li>
 * <li>{@link com.brandsentinel.core.model.DetectionResult}: immutable verdict
 * emitted by detectors</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.brandsentinel.core.model;
