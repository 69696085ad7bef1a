package tech.andrefsramos.meal_scraper.core.domain.exception;

import tech.andrefsramos.meal_scraper.core.domain.MenuKey;

/**
 * Compare-and-swap lost: the key changed (or was created) after it was read.
 */
public class StaleWriteException extends MealPipelineException {

    private final transient MenuKey key;

    public StaleWriteException(MenuKey key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public StaleWriteException(MenuKey key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    public MenuKey getKey() {
        return key;
    }
}
