/**
 * Enforcers: actions taken on confirmed threats. Every enforcer honours the
 * global dry-run flag.
 */
package com.brandsentinel.core.enforcement;
