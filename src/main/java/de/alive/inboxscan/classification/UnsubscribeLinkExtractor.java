package de.alive.inboxscan.classification;

import de.alive.inboxscan.domain.NormalizedMessage;
import de.alive.inboxscan.domain.UnsubscribeInfo;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the unsubscribe mechanism of a message. The List-Unsubscribe header wins over links in the body,
 * and inside the header an HTTP(S) link wins over mailto.
 */
@Slf4j
public class UnsubscribeLinkExtractor {

    private static final Pattern BRACKETED = Pattern.compile("<([^>]+)>");
    private static final Pattern BODY_URL = Pattern.compile("https?://[^\\s\"'<>()\\[\\]]+", Pattern.CASE_INSENSITIVE);
    private static final List<String> UNSUBSCRIBE_KEYWORDS = List.of(
            "unsubscribe", "unsub", "opt-out", "optout", "opt_out", "remove", "abmelden"
    );

    @NotNull
    public Optional<UnsubscribeInfo> extract(@NotNull NormalizedMessage message) {
        Optional<UnsubscribeInfo> fromHeader = extractFromHeader(message.getListUnsubscribe());
        if (fromHeader.isPresent()) {
            return fromHeader;
        }
        return extractFromBody(message.getBodyText());
    }

    @NotNull
    public Optional<UnsubscribeInfo> extractFromHeader(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return Optional.empty();
        }

        // <...> entries, or plain comma separated values when there are none
        List<String> candidates = new ArrayList<>();
        Matcher matcher = BRACKETED.matcher(headerValue);
        while (matcher.find()) {
            candidates.add(cleanLink(matcher.group(1)));
        }
        if (candidates.isEmpty()) {
            for (String part : headerValue.split(",")) {
                candidates.add(cleanLink(part));
            }
        }

        // Prefer http over mailto
        Optional<String> http = candidates.stream().filter(this::isValidHttpLink).findFirst();
        if (http.isPresent()) {
            return Optional.of(toInfo(http.get(), UnsubscribeInfo.Mechanism.HTTP));
        }
        return candidates.stream()
                .filter(this::isValidMailto)
                .findFirst()
                .map(link -> toInfo(link, UnsubscribeInfo.Mechanism.MAILTO));
    }

    @NotNull
    public Optional<UnsubscribeInfo> extractFromBody(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }

        // First link that looks like an unsubscribe link
        Matcher matcher = BODY_URL.matcher(content);
        while (matcher.find()) {
            String link = cleanLink(matcher.group());
            if (isValidHttpLink(link) && containsUnsubscribeKeyword(link)) {
                return Optional.of(toInfo(link, UnsubscribeInfo.Mechanism.HTTP));
            }
        }
        return Optional.empty();
    }

    private UnsubscribeInfo toInfo(String link, UnsubscribeInfo.Mechanism mechanism) {
        return new UnsubscribeInfo(link, TokenExtractor.tokenFor(link), mechanism);
    }

    private boolean containsUnsubscribeKeyword(String link) {
        String lower = link.toLowerCase(Locale.ROOT);
        return UNSUBSCRIBE_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private String cleanLink(String link) {
        if (link == null) return "";

        String cleaned = link.trim()
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"");
        // trailing sentence punctuation is not part of a link in running text
        while (!cleaned.isEmpty() && ".,;:!".indexOf(cleaned.charAt(cleaned.length() - 1)) >= 0) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        return cleaned;
    }

    private boolean isValidHttpLink(String link) {
        if (link == null || link.length() < 10) {
            return false;
        }
        String lower = link.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return false;
        }
        try {
            URI uri = new URI(link);
            return uri.getHost() != null;
        } catch (URISyntaxException e) {
            log.debug("Ignoring malformed unsubscribe link '{}': {}", link, e.getMessage());
            return false;
        }
    }

    private boolean isValidMailto(String link) {
        return link != null && link.toLowerCase(Locale.ROOT).startsWith("mailto:") && link.contains("@");
    }
}
