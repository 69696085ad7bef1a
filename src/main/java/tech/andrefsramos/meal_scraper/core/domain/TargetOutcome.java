package tech.andrefsramos.meal_scraper.core.domain;

/**
 * Result of one target inside a crawl cycle. {@code error} is null when the target was fetched,
 * parsed and reconciled (record-level failures are inside {@code result}).
 */
public record TargetOutcome(String targetId, ReconcileResult result, String error) {

    public static TargetOutcome ok(String targetId, ReconcileResult result) {
        return new TargetOutcome(targetId, result, null);
    }

    public static TargetOutcome failed(String targetId, String error) {
        return new TargetOutcome(targetId, ReconcileResult.EMPTY, error);
    }

    public boolean targetFailed() {
        return error != null;
    }
}
