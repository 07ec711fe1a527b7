package com.draftsmith.orchestrator.api.dto;

import com.draftsmith.orchestrator.model.ModelOverride;
import com.draftsmith.orchestrator.model.Stage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Request body for POST /jobs.
 *
 * Required: text
 * Optional: mode (defaults to paper_polish_enhance) and per-stage model
 *   settings; anything left out falls back to the configured defaults.
 */
public record SubmitJobRequest(String text,
                               String mode,
                               ModelConfigRequest polishConfig,
                               ModelConfigRequest enhanceConfig,
                               ModelConfigRequest emotionConfig) {

    public static final String DEFAULT_MODE = "paper_polish_enhance";

    // Compact constructor: default the mode if the caller omits it.
    public SubmitJobRequest {
        if (mode == null || mode.isBlank()) mode = DEFAULT_MODE;
    }

    public Map<Stage, ModelOverride> overrides() {
        Map<Stage, ModelOverride> overrides = new EnumMap<>(Stage.class);
        if (polishConfig  != null) overrides.put(Stage.POLISH,         polishConfig.toOverride());
        if (enhanceConfig != null) overrides.put(Stage.ENHANCE,        enhanceConfig.toOverride());
        if (emotionConfig != null) overrides.put(Stage.EMOTION_POLISH, emotionConfig.toOverride());
        return overrides;
    }
}
