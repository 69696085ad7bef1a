package tech.andrefsramos.meal_scraper.adapters.outbound.http;

import org.jsoup.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTarget;
import tech.andrefsramos.meal_scraper.core.domain.SourceContent;
import tech.andrefsramos.meal_scraper.core.domain.exception.SourceUnavailableException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Purpose

 * Static helpers for single-document sources (html-table, json-feed):
 * one GET through a fresh {@link HttpSession}, then the content-type check and the
 * conversion to {@link SourceContent}. An empty body is returned as empty content
 * ("no menu published"), not as an error.
 */
public final class HttpFetch {

    private static final Logger log = LoggerFactory.getLogger(HttpFetch.class);

    private HttpFetch() {}

    static final String USER_AGENT =
            "MealScraperBot/1.0 (+https://github.com/andrefsramos/meal-scraper)";
    static final String REF = "https://www.google.com";
    static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,application/json;q=0.9,*/*;q=0.8";
    static final String ACCEPT_LANG =
            "ko-KR,ko;q=0.9,en-US;q=0.8,en;q=0.7";
    static final String CACHE_NO = "no-cache";

    public static Duration timeoutOf(CrawlTarget target, Duration fallback) {
        Duration t = target.fetchTimeout();
        return (t == null || t.isZero() || t.isNegative()) ? fallback : t;
    }

    public static SourceContent get(CrawlTarget target, Duration timeout, List<String> defaultContentTypes, Instant fetchedAt) {
        long start = System.nanoTime();
        Connection.Response r = new HttpSession(target.id(), timeout).get(target.url());
        SourceContent content = toContent(target, target.url(), r, defaultContentTypes, fetchedAt);
        log.info("[Http] target={} fetched url={} bytes={} contentType={} elapsedMs={}ms",
                target.id(), target.url(), content.body().length, content.contentType(),
                (System.nanoTime() - start) / 1_000_000);
        return content;
    }

    public static SourceContent toContent(CrawlTarget target, String url, Connection.Response r,
                                          List<String> defaultContentTypes, Instant fetchedAt) {
        String contentType = r.contentType();
        byte[] body = r.bodyAsBytes();
        if (body == null || body.length == 0) {
            return SourceContent.empty(target.id(), url, contentType, fetchedAt);
        }

        List<String> expected = target.expectedContentTypes().isEmpty() ? defaultContentTypes : target.expectedContentTypes();
        if (!acceptsContentType(contentType, expected)) {
            throw new SourceUnavailableException(target.id(),
                    "unexpected content type '" + contentType + "' from " + url + ", expected one of " + expected,
                    r.statusCode());
        }
        return new SourceContent(target.id(), url, body, contentType, fetchedAt);
    }

    /** A missing content type is accepted; otherwise its media type must start with one of the expected ones. */
    public static boolean acceptsContentType(String contentType, List<String> expected) {
        if (contentType == null || contentType.isBlank() || expected == null || expected.isEmpty()) return true;
        String mime = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
        for (String e : expected) {
            if (e != null && mime.startsWith(e.trim().toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    public static String sanit(String s) {
        return s == null ? "" : s.trim();
    }
}
