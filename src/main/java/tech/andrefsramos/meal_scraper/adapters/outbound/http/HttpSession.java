package tech.andrefsramos.meal_scraper.adapters.outbound.http;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.meal_scraper.core.domain.exception.SourceUnavailableException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * HttpSession

 * Purpose

 * One jsoup-based HTTP conversation with a source, used for a single fetch of a single target:
 *   - Cookies received on one request are sent on the next (viewer page, then file list, then download).
 *   - Default headers (User-Agent, Accept, Accept-Language, Referrer) on every request.
 *   - One attempt per request. Network errors, timeouts and non-2xx statuses surface as
 *     {@link SourceUnavailableException}; the next scheduled cycle is the retry.

 * Typical use

 * 1) {@link #get(String)}: GET, returns the raw response (body not parsed).
 * 2) {@link #post(String, Map)}: form POST with the cookies collected so far.
 */
public class HttpSession {

    private static final Logger log = LoggerFactory.getLogger(HttpSession.class);

    private final Map<String, String> cookies = new HashMap<>();
    private final String targetId;
    private final int timeoutMs;

    public HttpSession(String targetId, Duration timeout) {
        this.targetId = targetId;
        this.timeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
    }

    public Connection.Response get(String url) {
        return execute(Connection.Method.GET, url, Map.of());
    }

    public Connection.Response post(String url, Map<String, String> form) {
        return execute(Connection.Method.POST, url, form == null ? Map.of() : form);
    }

    private Connection.Response execute(Connection.Method method, String url, Map<String, String> form) {
        long start = System.nanoTime();
        if (log.isDebugEnabled()) {
            log.debug("[Http] target={} {} url={} timeoutMs={} cookies={}", targetId, method, url, timeoutMs, cookies.size());
        }

        Connection.Response r;
        try {
            Connection conn = Jsoup.connect(url)
                    .userAgent(HttpFetch.USER_AGENT)
                    .referrer(HttpFetch.REF)
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .maxBodySize(0)
                    .header("Accept", HttpFetch.ACCEPT)
                    .header("Accept-Language", HttpFetch.ACCEPT_LANG)
                    .header("Cache-Control", HttpFetch.CACHE_NO)
                    .header("Pragma", HttpFetch.CACHE_NO)
                    .method(method);

            if (!cookies.isEmpty()) {
                conn.cookies(cookies);
            }
            if (!form.isEmpty()) {
                conn.data(form);
            }
            r = conn.execute();
        } catch (SocketTimeoutException ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.warn("[Http] target={} timeout after {} ms url={}", targetId, elapsedMs, url);
            throw new SourceUnavailableException(targetId, "timeout after " + elapsedMs + " ms: " + url, ex);
        } catch (IOException | IllegalArgumentException ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.warn("[Http] target={} {} failed url={} elapsedMs={} msg={}", targetId, method, url, elapsedMs, ex.getMessage());
            throw new SourceUnavailableException(targetId, method + " " + url + " failed: " + ex.getMessage(), ex);
        }

        cookies.putAll(r.cookies());
        int code = r.statusCode();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        if (log.isDebugEnabled()) {
            log.debug("[Http] target={} {} url={} status={} contentType={} elapsedMs={}ms cookies={}",
                    targetId, method, url, code, r.contentType(), elapsedMs, cookies.size());
        }

        if (code < 200 || code >= 300) {
            log.warn("[Http] target={} status {} url={} elapsedMs={}ms", targetId, code, url, elapsedMs);
            throw new SourceUnavailableException(targetId, "HTTP " + code + " from " + url, code);
        }
        return r;
    }
}
