package de.alive.inboxscan.infrastructure;

import com.sun.mail.imap.IMAPFolder;
import de.alive.inboxscan.Configuration;
import de.alive.inboxscan.domain.RawMessage;
import de.alive.inboxscan.exception.MailConnectionException;
import de.alive.inboxscan.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import javax.mail.AuthenticationFailedException;
import javax.mail.Folder;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.Store;
import javax.mail.search.ComparisonTerm;
import javax.mail.search.ReceivedDateTerm;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Single IMAP connection to the inbox, opened read-only so scanning never changes message flags.
 */
@Slf4j
public class ImapMailboxSource implements MailboxSource {

    private static final String INBOX = "INBOX";

    private final Configuration configuration;
    private final Properties imapProperties;
    private Store store;
    private IMAPFolder inbox;

    public ImapMailboxSource(@NotNull Configuration configuration) {
        this.configuration = configuration;
        this.imapProperties = createImapProperties();
    }

    public void connect() throws MailConnectionException {
        if (store != null && store.isConnected()) {
            return;
        }
        try {
            store = connectWithRetry().block();
            inbox = (IMAPFolder) store.getFolder(INBOX);
            inbox.open(Folder.READ_ONLY);
            log.info("{} IMAP connection to {} established, {} messages in inbox",
                    LogUtils.SUCCESS_EMOJI, configuration.imapHost(), inbox.getMessageCount());
        } catch (MessagingException e) {
            close();
            throw new MailConnectionException("Cannot open inbox: " + e.getMessage(),
                    MailConnectionException.ConnectionStage.FOLDER_ACCESS, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            close();
            MailConnectionException.ConnectionStage stage = cause instanceof AuthenticationFailedException
                    ? MailConnectionException.ConnectionStage.AUTHENTICATION
                    : MailConnectionException.ConnectionStage.CONNECTION_ESTABLISHMENT;
            throw new MailConnectionException("IMAP connection failed: " + cause.getMessage(), stage, cause);
        }
    }

    @NotNull
    @Override
    public List<Long> listCandidateUids(@NotNull LocalDate since) throws MailConnectionException {
        connect();
        try {
            Date sinceDate = Date.from(since.atStartOfDay(ZoneId.systemDefault()).toInstant());
            // Server-side date filter, day granularity
            Message[] messages = inbox.search(new ReceivedDateTerm(ComparisonTerm.GE, sinceDate));

            List<Long> uids = new ArrayList<>(messages.length);
            for (Message message : messages) {
                uids.add(inbox.getUID(message));
            }
            log.info("{} Found {} messages since {}", LogUtils.SEARCH_EMOJI, uids.size(), since);
            return uids;
        } catch (MessagingException e) {
            throw new MailConnectionException("Inbox search failed: " + e.getMessage(),
                    MailConnectionException.ConnectionStage.MESSAGE_SEARCH, e);
        }
    }

    @NotNull
    @Override
    public Optional<RawMessage> fetch(long uid) throws MailConnectionException {
        connect();
        try {
            Message message = inbox.getMessageByUID(uid);
            if (message == null || message.isExpunged()) {
                log.debug("Message {} no longer exists", uid);
                return Optional.empty();
            }

            // Full RFC 822 source, decoding happens later
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            message.writeTo(out);
            Date received = message.getReceivedDate();
            Instant arrival = received != null ? received.toInstant() : Instant.EPOCH;
            return Optional.of(new RawMessage(uid, arrival, out.toByteArray()));
        } catch (MessagingException | IOException e) {
            throw new MailConnectionException("Failed to fetch message " + uid + ": " + e.getMessage(),
                    MailConnectionException.ConnectionStage.MESSAGE_FETCH, e);
        }
    }

    @Override
    public void close() {
        try {
            if (inbox != null && inbox.isOpen()) {
                inbox.close(false);
            }
            if (store != null && store.isConnected()) {
                store.close();
                log.info("{} IMAP connection closed", LogUtils.SUCCESS_EMOJI);
            }
        } catch (MessagingException e) {
            log.warn("{} Error closing IMAP connection: {}", LogUtils.WARNING_EMOJI, e.getMessage());
        } finally {
            inbox = null;
            store = null;
        }
    }

    private Mono<Store> connectWithRetry() {
        return Mono.fromCallable(() -> {
                    Session session = Session.getInstance(imapProperties);
                    Store newStore = session.getStore("imaps");
                    newStore.connect(configuration.username(), configuration.password());
                    return newStore;
                })
                .retryWhen(Retry.backoff(3, Duration.ofSeconds(2))
                        .maxBackoff(Duration.ofSeconds(15))
                        .jitter(0.2)
                        .filter(throwable -> throwable instanceof MessagingException
                                && !(throwable instanceof AuthenticationFailedException))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure())
                        .doBeforeRetry(retrySignal ->
                                log.warn("{} IMAP connection attempt {} failed: {}",
                                        LogUtils.WARNING_EMOJI,
                                        retrySignal.totalRetries() + 1,
                                        retrySignal.failure().getMessage()))
                )
                .doOnError(error -> log.error("{} IMAP connection failed after retries: {}",
                        LogUtils.ERROR_EMOJI, error.getMessage()));
    }

    // Timeouts and SSL for imaps
    private Properties createImapProperties() {
        Properties props = new Properties();
        props.setProperty("mail.store.protocol", "imaps");
        props.setProperty("mail.imaps.host", configuration.imapHost());
        props.setProperty("mail.imaps.port", String.valueOf(configuration.imapPort()));
        props.setProperty("mail.imaps.ssl.enable", "true");

        // one connection, reused sequentially
        props.setProperty("mail.imaps.connectionpoolsize", "1");

        props.setProperty("mail.imaps.connectiontimeout", "60000");
        props.setProperty("mail.imaps.timeout", "60000");
        props.setProperty("mail.imaps.writetimeout", "60000");

        props.setProperty("mail.imaps.peek", "true");
        props.setProperty("mail.imaps.fetchsize", "16384");
        props.setProperty("mail.imaps.partialfetch", "false");
        return props;
    }
}
