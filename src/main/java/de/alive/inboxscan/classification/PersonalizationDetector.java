package de.alive.inboxscan.classification;

import de.alive.inboxscan.domain.NormalizedMessage;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects mail that addresses the recipient by name. Automated senders are excluded because
 * broadcast templates routinely insert the recipient's name.
 */
public class PersonalizationDetector {

    static final List<String> AUTOMATED_SENDER_PATTERNS = List.of(
            "noreply", "no-reply", "no_reply", "donotreply", "do-not-reply", "do_not_reply",
            "notifications", "notification", "mailer-daemon", "newsletter", "bounce", "automated"
    );

    private final String name;
    private final Pattern wholeWord;

    public PersonalizationDetector(String name, @NotNull NamePolicy policy) {
        this.name = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        this.wholeWord = policy == NamePolicy.WHOLE_WORD && !this.name.isEmpty()
                ? Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(this.name) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                : null;
    }

    public boolean isPersonalized(@NotNull NormalizedMessage message) {
        if (name.isEmpty() || isAutomatedSender(message.getSenderAddress())) {
            return false;
        }
        return mentionsName(message.getSubject()) || mentionsName(message.getBodyText());
    }

    public static boolean isAutomatedSender(String address) {
        if (address == null) {
            return false;
        }
        String lower = address.toLowerCase(Locale.ROOT);
        return AUTOMATED_SENDER_PATTERNS.stream().anyMatch(lower::contains);
    }

    private boolean mentionsName(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (wholeWord != null) {
            return wholeWord.matcher(text).find();
        }
        return text.toLowerCase(Locale.ROOT).contains(name);
    }
}
