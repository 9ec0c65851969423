package de.alive.inboxscan.classification;

import org.jetbrains.annotations.NotNull;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Derives the subscription token from an unsubscribe URL: the longest query parameter value that is not a
 * campaign tracking parameter, else the last path segment that looks like an identifier, else the URL itself. The result is never empty.
 */
public final class TokenExtractor {

    private static final Set<String> GENERIC_SEGMENTS = Set.of(
            "unsubscribe", "unsub", "opt-out", "optout", "opt_out", "remove", "list-unsubscribe",
            "email", "emails", "mail", "newsletter", "preferences", "manage", "u", "l", "c", "v1", "v2"
    );
    private static final Set<String> TRACKING_PARAMETERS = Set.of(
            "mc_cid", "mc_eid", "_hsenc", "_hsmi", "gclid", "fbclid", "ref", "source"
    );
    private static final int MIN_IDENTIFIER_LENGTH = 16;

    private TokenExtractor() {
    }

    @NotNull
    public static String tokenFor(@NotNull String url) {
        String trimmed = url.trim();
        String query;
        String path;

        if (trimmed.regionMatches(true, 0, "mailto:", 0, 7)) {
            String rest = trimmed.substring(7);
            int questionMark = rest.indexOf('?');
            query = questionMark >= 0 ? rest.substring(questionMark + 1) : null;
            path = null;
        } else {
            try {
                URI uri = new URI(trimmed);
                query = uri.getRawQuery();
                path = uri.getRawPath();
            } catch (URISyntaxException e) {
                return trimmed;
            }
        }

        String fromQuery = longestQueryValue(query);
        if (fromQuery != null) {
            return fromQuery;
        }
        String fromPath = identifierSegment(path);
        if (fromPath != null) {
            return fromPath;
        }
        return trimmed;
    }

    private static String longestQueryValue(String query) {
        if (query == null || query.isBlank()) {
            return null;
        }
        String best = null;
        for (String pair : query.split("&")) {
            int equals = pair.indexOf('=');
            if (equals < 0) {
                continue;
            }
            if (isTrackingParameter(decode(pair.substring(0, equals)))) {
                continue;
            }
            String value = decode(pair.substring(equals + 1)).trim();
            if (!value.isEmpty() && (best == null || value.length() > best.length())) {
                best = value;
            }
        }
        return best;
    }

    static boolean isTrackingParameter(String name) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        return key.startsWith("utm_") || TRACKING_PARAMETERS.contains(key);
    }

    private static String identifierSegment(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        String[] segments = path.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            String segment = decode(segments[i]).trim();
            if (segment.isEmpty() || GENERIC_SEGMENTS.contains(stripExtension(segment).toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (looksLikeIdentifier(segment)) {
                return segment;
            }
        }
        return null;
    }

    private static boolean looksLikeIdentifier(String segment) {
        return segment.length() >= MIN_IDENTIFIER_LENGTH || segment.chars().anyMatch(Character::isDigit);
    }

    private static String stripExtension(String segment) {
        int dot = segment.lastIndexOf('.');
        return dot > 0 ? segment.substring(0, dot) : segment;
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
