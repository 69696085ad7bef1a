package tech.andrefsramos.meal_scraper.core.domain;

import java.time.Instant;

/**
 * Raw bytes of one fetch. An empty body is a valid answer ("no menu published").
 */
public record SourceContent(
        String targetId,
        String url,
        byte[] body,
        String contentType,
        Instant fetchedAt
) {
    public SourceContent {
        body = body == null ? new byte[0] : body;
    }

    public static SourceContent empty(String targetId, String url, String contentType, Instant fetchedAt) {
        return new SourceContent(targetId, url, new byte[0], contentType, fetchedAt);
    }

    public boolean isEmpty() {
        return body.length == 0;
    }

    /** Charset named in the Content-Type header, or null when the header names none. */
    public String declaredCharset() {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                String name = p.substring(8).replace("\"", "").trim();
                return name.isEmpty() ? null : name;
            }
        }
        return null;
    }
}
