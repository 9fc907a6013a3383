package com.narrativeplatform.common.exception;

/**
 * Base failure raised by the narrative engine. The message is prefixed with the
 * component that rejected the input or configuration.
 */
public class NarrativeEngineException extends RuntimeException {
    private final String component;

    public NarrativeEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public NarrativeEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
