package com.draftsmith.orchestrator.llm;

/**
 * Which model to call and where: model name, credential and base URL.
 * toString() masks the credential so endpoints are safe to log.
 */
public record ModelEndpoint(String model, String apiKey, String baseUrl) {

    public String maskedApiKey() {
        if (apiKey == null || apiKey.isEmpty()) return "<none>";
        if (apiKey.length() <= 12) return "***";
        return apiKey.substring(0, 8) + "..." + apiKey.substring(apiKey.length() - 4);
    }

    @Override
    public String toString() {
        return "ModelEndpoint[model=" + model + ", apiKey=" + maskedApiKey() + ", baseUrl=" + baseUrl + "]";
    }
}
