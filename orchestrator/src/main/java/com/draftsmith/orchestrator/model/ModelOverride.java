package com.draftsmith.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Optional job-level override of a stage's model configuration.
 * Any null field falls back to the process-wide default for that stage.
 */
@Embeddable
public class ModelOverride {

    @Column(name = "model", length = 100)
    private String model;

    @Column(name = "api_key")
    private String apiKey;

    @Column(name = "base_url")
    private String baseUrl;

    protected ModelOverride() {}   // required by JPA

    public ModelOverride(String model, String apiKey, String baseUrl) {
        this.model   = model;
        this.apiKey  = apiKey;
        this.baseUrl = baseUrl;
    }

    public static ModelOverride none() {
        return new ModelOverride(null, null, null);
    }

    public String getModel()   { return model; }
    public String getApiKey()  { return apiKey; }
    public String getBaseUrl() { return baseUrl; }

    public boolean isEmpty() {
        return model == null && apiKey == null && baseUrl == null;
    }
}
