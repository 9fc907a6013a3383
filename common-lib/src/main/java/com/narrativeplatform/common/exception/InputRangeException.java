package com.narrativeplatform.common.exception;

/**
 * Client-input fault: a normalized signal outside [-1, 1] or an unrecognized
 * enumerated label. Not retried.
 */
public class InputRangeException extends NarrativeEngineException {

    public InputRangeException(String component, String message) {
        super(component, message);
    }
}
