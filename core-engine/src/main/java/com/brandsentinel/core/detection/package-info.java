/**
 * Detection rules that judge an enriched event and emit
 * {@link com.brandsentinel.core.model.DetectionResult}s.
 */
package com.brandsentinel.core.detection;
