package tech.andrefsramos.meal_scraper.core.domain.exception;

import tech.andrefsramos.meal_scraper.core.domain.MenuKey;

/**
 * A single record could not be written. Counted into the run as a record failure.
 */
public class ReconcileException extends MealPipelineException {

    private final transient MenuKey key;

    public ReconcileException(MenuKey key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    public MenuKey getKey() {
        return key;
    }
}
