package tech.andrefsramos.meal_scraper.core.domain.exception;

public class InvalidFilterException extends MealPipelineException {

    private final String parameter;

    public InvalidFilterException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    public InvalidFilterException(String parameter, String message, Throwable cause) {
        super(parameter + ": " + message, cause);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
