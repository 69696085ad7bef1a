package tech.andrefsramos.meal_scraper.core.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record ReconcileResult(
        int seen,
        int changed,
        int skipped,
        int failed,
        Set<MenuKey> touchedKeys,
        List<String> errors
) {
    public static final ReconcileResult EMPTY = new ReconcileResult(0, 0, 0, 0, Set.of(), List.of());

    public ReconcileResult {
        touchedKeys = touchedKeys == null ? Set.of() : Set.copyOf(touchedKeys);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public ReconcileResult plus(ReconcileResult o) {
        Set<MenuKey> keys = new LinkedHashSet<>(touchedKeys);
        keys.addAll(o.touchedKeys);
        List<String> errs = new ArrayList<>(errors);
        errs.addAll(o.errors);
        return new ReconcileResult(seen + o.seen, changed + o.changed, skipped + o.skipped,
                failed + o.failed, keys, errs);
    }
}
