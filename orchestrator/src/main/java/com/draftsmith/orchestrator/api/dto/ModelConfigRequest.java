package com.draftsmith.orchestrator.api.dto;

import com.draftsmith.orchestrator.model.ModelOverride;

/**
 * Optional per-stage model settings in a submission. Blank fields are
 * treated as absent so the process-wide defaults apply.
 */
public record ModelConfigRequest(String model, String apiKey, String baseUrl) {

    public ModelOverride toOverride() {
        return new ModelOverride(blankToNull(model), blankToNull(apiKey), blankToNull(baseUrl));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
