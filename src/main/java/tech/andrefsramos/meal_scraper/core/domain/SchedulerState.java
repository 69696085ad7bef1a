package tech.andrefsramos.meal_scraper.core.domain;

public enum SchedulerState {
    IDLE,
    RUNNING
}
