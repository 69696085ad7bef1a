package tech.andrefsramos.meal_scraper.core.domain.exception;

/**
 * Network error, timeout, non-2xx status or unexpected content type. Not retried in place;
 * the next scheduled cycle tries again.
 */
public class SourceUnavailableException extends MealPipelineException {

    private final String targetId;
    private final Integer status;

    public SourceUnavailableException(String targetId, String message, Integer status) {
        super("[" + targetId + "] " + message);
        this.targetId = targetId;
        this.status = status;
    }

    public SourceUnavailableException(String targetId, String message, Throwable cause) {
        super("[" + targetId + "] " + message, cause);
        this.targetId = targetId;
        this.status = null;
    }

    public String getTargetId() {
        return targetId;
    }

    public Integer getStatus() {
        return status;
    }
}
