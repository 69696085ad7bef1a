package tech.andrefsramos.meal_scraper.core.domain.exception;

/**
 * Document structure not recognized. Carries the section being read and what was expected
 * there, so the failure can be diagnosed without fetching again.
 */
public class MenuParseException extends MealPipelineException {

    private final String targetId;
    private final String section;
    private final String expected;

    public MenuParseException(String targetId, String section, String expected) {
        this(targetId, section, expected, null);
    }

    public MenuParseException(String targetId, String section, String expected, Throwable cause) {
        super("[" + targetId + "] unrecognized document at " + section + ": expected " + expected, cause);
        this.targetId = targetId;
        this.section = section;
        this.expected = expected;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getSection() {
        return section;
    }

    public String getExpected() {
        return expected;
    }
}
