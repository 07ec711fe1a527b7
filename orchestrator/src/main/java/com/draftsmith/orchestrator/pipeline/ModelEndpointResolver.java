package com.draftsmith.orchestrator.pipeline;

import com.draftsmith.orchestrator.config.LlmProperties;
import com.draftsmith.orchestrator.config.LlmProperties.StageModel;
import com.draftsmith.orchestrator.llm.ModelEndpoint;
import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.ModelOverride;
import com.draftsmith.orchestrator.model.Stage;
import org.springframework.stereotype.Component;

/**
 * Works out which model, credential and endpoint a call should use.
 *
 * Each field is resolved independently: job-level override, then the stage
 * default, then the process-wide key and base URL.
 */
@Component
public class ModelEndpointResolver {

    private final LlmProperties properties;

    public ModelEndpointResolver(LlmProperties properties) {
        this.properties = properties;
    }

    /** @throws IllegalStateException if no model name is configured anywhere for {@code stage} */
    public ModelEndpoint resolve(Job job, Stage stage) {
        ModelOverride override = job.overrideFor(stage);
        StageModel    defaults = properties.defaultsFor(stage);
        String model = firstNonBlank(override.getModel(), defaults.getModel());
        if (model == null) {
            throw new IllegalStateException("No model configured for stage " + stage.wireName());
        }
        return new ModelEndpoint(
                model,
                firstNonBlank(override.getApiKey(), defaults.getApiKey(), properties.getApiKey()),
                firstNonBlank(override.getBaseUrl(), defaults.getBaseUrl(), properties.getBaseUrl()));
    }

    /**
     * Endpoint for history compression. Job overrides do not apply; an unset
     * compression model falls back to the polishing stage's default.
     */
    public ModelEndpoint compressionEndpoint() {
        StageModel compression = properties.getStages().getCompression()
                .orElse(properties.getStages().getPolish());
        if (compression.getModel() == null || compression.getModel().isBlank()) {
            throw new IllegalStateException("No model configured for history compression");
        }
        return new ModelEndpoint(
                compression.getModel(),
                firstNonBlank(compression.getApiKey(), properties.getApiKey()),
                firstNonBlank(compression.getBaseUrl(), properties.getBaseUrl()));
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
