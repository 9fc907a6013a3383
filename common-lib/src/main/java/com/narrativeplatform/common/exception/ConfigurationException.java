package com.narrativeplatform.common.exception;

/**
 * Process-wide engine configuration is invalid: weights that do not sum to 1.0,
 * inconsistent classification thresholds, or an incomplete intensity table.
 *
 * <p>Raised while the configuration is loaded. Never surfaces per request.
 */
public class ConfigurationException extends NarrativeEngineException {

    public ConfigurationException(String component, String message) {
        super(component, message);
    }

    public ConfigurationException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
