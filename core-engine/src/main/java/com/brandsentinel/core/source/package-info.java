/**
 * Event sources. {@link com.brandsentinel.core.source.CertstreamSource}
 * turns the public certificate-transparency stream into brand-matching
 * {@link com.brandsentinel.core.model.Event}s.
 */
package com.brandsentinel.core.source;
