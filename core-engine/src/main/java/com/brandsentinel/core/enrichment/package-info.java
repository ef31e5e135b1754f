/**
 * Enrichers that add fetched facts about a domain to an event before
 * detection.
 */
package com.brandsentinel.core.enrichment;
