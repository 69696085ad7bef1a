package tech.andrefsramos.meal_scraper.core.domain;

import tech.andrefsramos.meal_scraper.core.domain.exception.InvalidFilterException;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/*
 * Purpose

 * Keyset page token: the last returned sort key plus the filter fingerprint, url-safe base64.
 * Layout before encoding: "v1|<fingerprint>|<date>|<slot>|<base64(providerId)>".
 * A token only resumes the filter it was issued for.
 */
public record PageToken(String fingerprint, MenuKey lastKey) {

    private static final String VERSION = "v1";
    private static final Base64.Encoder ENC = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DEC = Base64.getUrlDecoder();

    public String encode() {
        String provider = ENC.encodeToString(lastKey.providerId().getBytes(StandardCharsets.UTF_8));
        String raw = String.join("|", VERSION, fingerprint, lastKey.servingDate().toString(),
                lastKey.mealSlot().name(), provider);
        return ENC.encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static PageToken decode(String token) {
        try {
            String raw = new String(DEC.decode(token.trim()), StandardCharsets.UTF_8);
            String[] parts = raw.split("\\|", -1);
            if (parts.length != 5 || !VERSION.equals(parts[0])) {
                throw new InvalidFilterException("pageToken", "malformed page token");
            }
            LocalDate date = LocalDate.parse(parts[2]);
            MealSlot slot = MealSlot.parse(parts[3])
                    .orElseThrow(() -> new InvalidFilterException("pageToken", "malformed page token"));
            String provider = new String(DEC.decode(parts[4]), StandardCharsets.UTF_8);
            return new PageToken(parts[1], new MenuKey(provider, date, slot));
        } catch (IllegalArgumentException | DateTimeParseException | NullPointerException e) {
            throw new InvalidFilterException("pageToken", "malformed page token", e);
        }
    }
}
