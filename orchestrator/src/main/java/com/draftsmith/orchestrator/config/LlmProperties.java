package com.draftsmith.orchestrator.config;

import com.draftsmith.orchestrator.model.Stage;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Process-wide language-model defaults, bound from {@code draftsmith.llm.*}.
 *
 * A job may override any field per stage; whatever it leaves unset comes
 * from the stage defaults here, then from the global key and base URL.
 */
@ConfigurationProperties(prefix = "draftsmith.llm")
public class LlmProperties {

    private String apiKey;

    private String baseUrl = "https://api.openai.com/v1";

    private Stages stages = new Stages();

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Stages getStages() {
        return stages;
    }

    public void setStages(Stages stages) {
        this.stages = stages;
    }

    /** Stage defaults for {@code stage}; never null. */
    public StageModel defaultsFor(Stage stage) {
        return switch (stage) {
            case POLISH         -> stages.getPolish();
            case ENHANCE        -> stages.getEnhance();
            case EMOTION_POLISH -> stages.getEmotionPolish().orElse(stages.getPolish());
        };
    }

    // ------------------------------------------------------------------

    public static class Stages {

        private StageModel polish        = new StageModel();
        private StageModel enhance       = new StageModel();
        private StageModel emotionPolish = new StageModel();
        private StageModel compression   = new StageModel();

        public StageModel getPolish() {
            return polish;
        }

        public void setPolish(StageModel polish) {
            this.polish = polish;
        }

        public StageModel getEnhance() {
            return enhance;
        }

        public void setEnhance(StageModel enhance) {
            this.enhance = enhance;
        }

        public StageModel getEmotionPolish() {
            return emotionPolish;
        }

        public void setEmotionPolish(StageModel emotionPolish) {
            this.emotionPolish = emotionPolish;
        }

        public StageModel getCompression() {
            return compression;
        }

        public void setCompression(StageModel compression) {
            this.compression = compression;
        }
    }

    public static class StageModel {

        private String model;
        private String apiKey;
        private String baseUrl;

        public StageModel() {}

        public StageModel(String model, String apiKey, String baseUrl) {
            this.model   = model;
            this.apiKey  = apiKey;
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        /**
         * Field-wise fallback: each unset field here takes {@code other}'s value.
         * A blank value counts as unset, since an empty {@code ${VAR:}} placeholder binds as "".
         */
        public StageModel orElse(StageModel other) {
            return new StageModel(
                    isSet(model)   ? model   : other.model,
                    isSet(apiKey)  ? apiKey  : other.apiKey,
                    isSet(baseUrl) ? baseUrl : other.baseUrl);
        }

        private static boolean isSet(String value) {
            return value != null && !value.isBlank();
        }
    }
}
