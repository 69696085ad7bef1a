package tech.andrefsramos.meal_scraper.core.domain.exception;

/**
 * Base of the pipeline's failures. Unchecked: callers isolate them per target or per record.
 */
public abstract class MealPipelineException extends RuntimeException {

    protected MealPipelineException(String message) {
        super(message);
    }

    protected MealPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
