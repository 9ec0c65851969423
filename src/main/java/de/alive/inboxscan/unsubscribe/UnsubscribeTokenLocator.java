package de.alive.inboxscan.unsubscribe;

import de.alive.inboxscan.classification.UnsubscribeLinkExtractor;
import de.alive.inboxscan.domain.DecodeResult;
import de.alive.inboxscan.domain.RawMessage;
import de.alive.inboxscan.domain.UnsubscribeInfo;
import de.alive.inboxscan.exception.MailConnectionException;
import de.alive.inboxscan.infrastructure.MailboxSource;
import de.alive.inboxscan.infrastructure.MessageDecoder;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the newest message in the lookback window sent from the row's domain whose unsubscribe token matches.
 * The window is walked newest first, at most once per executor run; tokens passed on the way are remembered
 * per sender domain for later rows.
 */
@Slf4j
public class UnsubscribeTokenLocator {

    private final MailboxSource mailbox;
    private final MessageDecoder decoder;
    private final UnsubscribeLinkExtractor linkExtractor;
    private final LocalDate since;

    private final Map<String, UnsubscribeInfo> seenTokens = new HashMap<>();
    private Deque<Long> remaining;
    private int examined;

    public UnsubscribeTokenLocator(@NotNull MailboxSource mailbox,
                                   @NotNull MessageDecoder decoder,
                                   @NotNull UnsubscribeLinkExtractor linkExtractor,
                                   @NotNull LocalDate since) {
        this.mailbox = mailbox;
        this.decoder = decoder;
        this.linkExtractor = linkExtractor;
        this.since = since;
    }

    @NotNull
    public Optional<UnsubscribeInfo> locate(@NotNull String domain, @NotNull String token)
            throws MailConnectionException {
        String wanted = key(domain, token);
        UnsubscribeInfo known = seenTokens.get(wanted);
        if (known != null) {
            return Optional.of(known);
        }

        if (remaining == null) {
            List<Long> uids = mailbox.listCandidateUids(since);
            remaining = new ArrayDeque<>(uids.size());
            uids.forEach(remaining::addFirst);
            log.debug("Searching {} messages since {} for unsubscribe tokens", uids.size(), since);
        }

        while (!remaining.isEmpty()) {
            long uid = remaining.pollFirst();
            Optional<RawMessage> raw = mailbox.fetch(uid);
            if (raw.isEmpty()) {
                continue;
            }
            examined++;

            DecodeResult decoded = decoder.decode(raw.get());
            if (!decoded.isOk()) {
                log.debug("Ignoring undecodable message {} while locating tokens: {}", uid, decoded.failureReason());
                continue;
            }

            Optional<UnsubscribeInfo> info = linkExtractor.extract(decoded.message());
            if (info.isEmpty()) {
                continue;
            }
            String seen = key(decoded.message().getSenderDomain(), info.get().token());
            seenTokens.putIfAbsent(seen, info.get());
            if (seen.equals(wanted)) {
                return info;
            }
        }
        return Optional.empty();
    }

    // tokens are only unique within one sender
    private static String key(String domain, String token) {
        return domain.trim().toLowerCase(Locale.ROOT) + '\n' + token;
    }

    public int getExaminedCount() {
        return examined;
    }
}
