package de.alive.inboxscan.infrastructure;

import de.alive.inboxscan.domain.RawMessage;
import de.alive.inboxscan.exception.MailConnectionException;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Supplier of raw inbox messages keyed by UID. UIDs are stable within one mailbox.
 * Implementations are used by one caller at a time.
 */
public interface MailboxSource extends AutoCloseable {

    // UIDs of inbox messages that arrived on or after since, oldest first
    @NotNull List<Long> listCandidateUids(@NotNull LocalDate since) throws MailConnectionException;

    // the message, or empty when it was removed from the mailbox after listing
    @NotNull Optional<RawMessage> fetch(long uid) throws MailConnectionException;

    @Override
    void close();
}
