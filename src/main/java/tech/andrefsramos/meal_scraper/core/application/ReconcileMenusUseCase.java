package tech.andrefsramos.meal_scraper.core.application;

import tech.andrefsramos.meal_scraper.core.domain.CrawlRun;
import tech.andrefsramos.meal_scraper.core.domain.MenuDraft;
import tech.andrefsramos.meal_scraper.core.domain.ReconcileResult;

import java.util.List;

public interface ReconcileMenusUseCase {
    ReconcileResult reconcile(List<MenuDraft> drafts, CrawlRun asOf);
}
