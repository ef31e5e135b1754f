/**
 * Configuration loading and validation for Brand Sentinel.
 *
 * <p>
 * The YAML file is loaded by
 * {@link com.brandsentinel.core.config.ConfigLoader} into a
 * {@link com.brandsentinel.core.config.SentinelConfig} instance. Defaults are
 * applied and validation runs automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.brandsentinel.core.config;
