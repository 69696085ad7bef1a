package tech.andrefsramos.meal_scraper.core.domain.exception;

/**
 * The store could not be read and no cached snapshot was within its grace window.
 */
public class MenuStoreUnavailableException extends MealPipelineException {

    public MenuStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
