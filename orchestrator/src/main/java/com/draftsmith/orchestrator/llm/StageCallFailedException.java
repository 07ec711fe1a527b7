package com.draftsmith.orchestrator.llm;

/**
 * A language-model or compression call did not produce text.
 *
 * The kind tells the three wire-level failure modes apart; the pipeline
 * treats them all the same way (the segment fails, the job can be retried).
 */
public class StageCallFailedException extends RuntimeException {

    public enum Kind { TRANSPORT, HTTP_STATUS, MISSING_CONTENT, NOT_CONFIGURED }

    private final Kind kind;
    private final Integer statusCode;

    public StageCallFailedException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public StageCallFailedException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    private StageCallFailedException(Kind kind, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    /** Non-success response; the body is kept in the message. */
    public static StageCallFailedException httpStatus(int statusCode, String body) {
        return new StageCallFailedException(Kind.HTTP_STATUS,
                "Model API error %d: %s".formatted(statusCode, body), statusCode, null);
    }

    public static StageCallFailedException transport(String detail, Throwable cause) {
        return new StageCallFailedException(Kind.TRANSPORT, "Network error calling model API: " + detail, cause);
    }

    public static StageCallFailedException missingContent(String field) {
        return new StageCallFailedException(Kind.MISSING_CONTENT,
                "Model API response is missing the '" + field + "' field");
    }

    public Kind getKind() { return kind; }

    /** HTTP status for {@link Kind#HTTP_STATUS}, otherwise null. */
    public Integer getStatusCode() { return statusCode; }
}
