package com.draftsmith.orchestrator.model;

/**
 * Thrown at submission time when the requested processing mode is not one
 * of the supported stage sequences. The job is never created.
 */
public class UnknownProcessingModeException extends RuntimeException {

    public UnknownProcessingModeException(String mode) {
        super("Unknown processing mode '" + mode + "'. Supported modes: " + ProcessingMode.supportedWireNames());
    }
}
