package com.draftsmith.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Pipeline tuning knobs, bound from {@code draftsmith.pipeline.*}. */
@ConfigurationProperties(prefix = "draftsmith.pipeline")
public class PipelineProperties {

    /** Initial admission limit; adjustable at runtime. */
    private int maxConcurrentJobs = 5;

    /** Best-effort segment size cap, in measured length units. */
    private int segmentMaxSize = 500;

    /** Segments measuring below this are copied through without a model call. */
    private int trivialSegmentThreshold = 15;

    private int historyCompressionThreshold = 5000;

    /** Per-position constant behind the queue wait estimate. */
    private Duration averageJobDuration = Duration.ofSeconds(300);

    private int errorMessageLimit = 500;

    private int subscriberQueueCapacity = 256;

    private Duration streamPollInterval = Duration.ofSeconds(1);

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
    }

    public int getSegmentMaxSize() {
        return segmentMaxSize;
    }

    public void setSegmentMaxSize(int segmentMaxSize) {
        this.segmentMaxSize = segmentMaxSize;
    }

    public int getTrivialSegmentThreshold() {
        return Math.max(0, trivialSegmentThreshold);
    }

    public void setTrivialSegmentThreshold(int trivialSegmentThreshold) {
        this.trivialSegmentThreshold = trivialSegmentThreshold;
    }

    public int getHistoryCompressionThreshold() {
        return historyCompressionThreshold;
    }

    public void setHistoryCompressionThreshold(int historyCompressionThreshold) {
        this.historyCompressionThreshold = historyCompressionThreshold;
    }

    public Duration getAverageJobDuration() {
        return averageJobDuration;
    }

    public void setAverageJobDuration(Duration averageJobDuration) {
        this.averageJobDuration = averageJobDuration;
    }

    public int getErrorMessageLimit() {
        return errorMessageLimit;
    }

    public void setErrorMessageLimit(int errorMessageLimit) {
        this.errorMessageLimit = errorMessageLimit;
    }

    public int getSubscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
        this.subscriberQueueCapacity = subscriberQueueCapacity;
    }

    public Duration getStreamPollInterval() {
        return streamPollInterval;
    }

    public void setStreamPollInterval(Duration streamPollInterval) {
        this.streamPollInterval = streamPollInterval;
    }
}
