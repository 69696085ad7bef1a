package tech.andrefsramos.meal_scraper.adapters.inbound.api;

/**
 * Error body of the REST endpoints. {@code parameter} is set for invalid query parameters.
 */
public record ApiError(int status, String error, String message, String parameter) {

    public static ApiError of(int status, String error, String message) {
        return new ApiError(status, error, message, null);
    }
}
