package tech.andrefsramos.meal_scraper.core.ports;

import tech.andrefsramos.meal_scraper.core.domain.CrawlTarget;
import tech.andrefsramos.meal_scraper.core.domain.MenuDraft;
import tech.andrefsramos.meal_scraper.core.domain.SourceContent;

import java.util.List;

/**
 * Capability of one source format: fetch its raw content and turn it into drafts.
 * {@link #fetch} does one bounded attempt and never retries; {@link #parse} does no I/O.
 */
public interface MenuSourcePort {
    boolean supports(CrawlTarget target);
    SourceContent fetch(CrawlTarget target);
    List<MenuDraft> parse(SourceContent content, CrawlTarget target);
}
