package com.brandsentinel.core.enforcement;

import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.pipeline.Enforcer;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Writes every threat to the log. Has no side effect beyond logging, so
 * dry-run only changes the prefix.
 */
public class LoggerEnforcer implements Enforcer {

    private static final Logger LOG = LoggerFactory.getLogger(LoggerEnforcer.class);

    public static final String NAME = "logger";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void enforce(ShutdownSignal signal, DetectionResult result, boolean dryRun) {
        LOG.warn("{}Threat on {} (brand={}, rule={}, confidence={})",
                dryRun ? "[DRY-RUN] " : "",
                result.getDomain(),
                result.getBrand(),
                result.getRule(),
                String.format(Locale.ROOT, "%.2f", result.getConfidence()));
    }
}
