/**
 * Command-line launcher and status endpoint for the Brand Sentinel monitor.
 */
package com.brandsentinel.app;
